package com.lux032.mploader.core;

import com.lux032.mploader.exception.NoMatchException;
import com.lux032.mploader.exception.SourceUnavailableException;
import com.lux032.mploader.model.ErrorKind;
import com.lux032.mploader.model.MatchCandidate;
import com.lux032.mploader.model.NormalizedQuery;
import com.lux032.mploader.model.RunSummary;
import com.lux032.mploader.model.SkipReason;
import com.lux032.mploader.model.SourceItem;
import com.lux032.mploader.model.TaskState;
import com.lux032.mploader.model.TrackOutcome;
import com.lux032.mploader.service.MetadataSource;
import com.lux032.mploader.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 下载编排器
 * 为每个条目创建一个任务, 由固定大小的线程池并行处理, 汇总每个条目的结果
 *
 * 取消语义: 不再开始新的下载; 已在下载中的任务自然结束, 避免留下半成品文件;
 * 尚未进入下载的任务记为 Cancelled
 *
 * 占用表和取消信号都属于一次运行, 每次运行应使用新的编排器实例
 */
@Slf4j
public class DownloadOrchestrator {

    public static final int DEFAULT_WORKERS = 3;
    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final MetadataSource metadataSource;
    private final TitleNormalizer titleNormalizer;
    private final CatalogMatcher catalogMatcher;
    private final TrackFetcher trackFetcher;
    private final ClaimRegistry claimRegistry;
    private final CancellationSignal cancellationSignal;

    private volatile List<DownloadTask> currentTasks = Collections.emptyList();

    public DownloadOrchestrator(MetadataSource metadataSource,
                                TitleNormalizer titleNormalizer,
                                CatalogMatcher catalogMatcher,
                                TrackFetcher trackFetcher,
                                ClaimRegistry claimRegistry,
                                CancellationSignal cancellationSignal) {
        this.metadataSource = metadataSource;
        this.titleNormalizer = titleNormalizer;
        this.catalogMatcher = catalogMatcher;
        this.trackFetcher = trackFetcher;
        this.claimRegistry = claimRegistry;
        this.cancellationSignal = cancellationSignal;
    }

    /**
     * 执行一次完整的下载
     *
     * @param sourceUrl 视频或播放列表地址
     * @param outputDir 输出目录, 不存在时自动创建
     * @param workerCount 并行线程数
     * @return 按条目顺序排列的汇总结果, 单个条目失败不会抛出异常
     * @throws SourceUnavailableException 来源地址无法解析, 或输出目录无法使用
     */
    public RunSummary run(String sourceUrl, Path outputDir, int workerCount) throws SourceUnavailableException {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1: " + workerCount);
        }

        log.info(I18nUtil.getMessage("run.extracting"), sourceUrl);
        List<SourceItem> items = metadataSource.resolveItems(sourceUrl);

        DownloadLedger ledger;
        try {
            Files.createDirectories(outputDir);
            ledger = DownloadLedger.snapshot(outputDir);
        } catch (IOException e) {
            throw new SourceUnavailableException("Output directory is not usable: " + outputDir, e);
        }

        List<DownloadTask> tasks = new ArrayList<>(items.size());
        for (SourceItem item : items) {
            tasks.add(new DownloadTask(item));
        }
        currentTasks = Collections.unmodifiableList(tasks);

        int total = tasks.size();
        log.info(I18nUtil.getMessage("run.processing"), total, workerCount);

        AtomicInteger finished = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        List<Future<TrackOutcome>> futures = new ArrayList<>(total);
        try {
            for (DownloadTask task : tasks) {
                if (cancellationSignal.isCancelled()) {
                    // 取消后不再提交, 直接记为取消
                    futures.add(null);
                    task.finish(TaskState.CANCELLED, TrackOutcome.cancelled(task.getItem()));
                    continue;
                }
                futures.add(executor.submit(() -> {
                    TrackOutcome outcome = process(task, outputDir, ledger);
                    reportProgress(outcome, finished.incrementAndGet(), total);
                    return outcome;
                }));
            }

            List<TrackOutcome> outcomes = awaitAll(tasks, futures);
            RunSummary summary = new RunSummary(outcomes);
            logSummary(summary);
            return summary;
        } finally {
            shutdownExecutor(executor);
        }
    }

    /**
     * 请求取消, 可以在任意线程调用
     */
    public void cancel() {
        if (!cancellationSignal.isCancelled()) {
            log.info(I18nUtil.getMessage("run.cancel.requested"));
        }
        cancellationSignal.cancel();
    }

    public boolean isCancelled() {
        return cancellationSignal.isCancelled();
    }

    /**
     * 当前(或最近一次)运行中各任务的状态, 按条目顺序
     */
    public List<TaskState> getTaskStates() {
        List<TaskState> states = new ArrayList<>();
        for (DownloadTask task : currentTasks) {
            states.add(task.getState());
        }
        return states;
    }

    /**
     * 处理单个任务, 所有失败都转换为结果, 不向外抛出
     */
    TrackOutcome process(DownloadTask task, Path outputDir, DownloadLedger ledger) {
        SourceItem item = task.getItem();
        try {
            // 出队检查点
            if (cancellationSignal.isCancelled()) {
                return task.finish(TaskState.CANCELLED, TrackOutcome.cancelled(item));
            }

            task.transitionTo(TaskState.NORMALIZING);
            NormalizedQuery query = titleNormalizer.normalize(item);
            log.info(I18nUtil.getMessage("task.processing"), item.getSequenceIndex(), query.getSearchTitle());

            task.transitionTo(TaskState.MATCHING);
            MatchCandidate candidate;
            try {
                candidate = catalogMatcher.match(query);
            } catch (NoMatchException e) {
                log.warn(I18nUtil.getMessage("task.no.match"), query.getSearchTitle());
                return task.finish(TaskState.FAILED, TrackOutcome.failed(item, e.getErrorKind(), e.getMessage()));
            }

            // 匹配结束检查点
            if (cancellationSignal.isCancelled()) {
                return task.finish(TaskState.CANCELLED, TrackOutcome.cancelled(item));
            }

            task.transitionTo(TaskState.SKIP_CHECK);
            Path destination = trackFetcher.resolveDestination(candidate, outputDir);
            if (ledger.exists(destination)) {
                log.info(I18nUtil.getMessage("task.already.exists"), destination.getFileName());
                return task.finish(TaskState.SKIPPED,
                    TrackOutcome.skipped(item, destination, SkipReason.DESTINATION_ALREADY_EXISTS));
            }

            // 进入下载前的检查点, 与 cancel() 互斥
            boolean started = cancellationSignal.runUnlessCancelled(() -> {
                if (claimRegistry.tryClaim(destination)) {
                    task.transitionTo(TaskState.FETCHING);
                }
            });
            if (!started) {
                return task.finish(TaskState.CANCELLED, TrackOutcome.cancelled(item));
            }
            if (task.getState() != TaskState.FETCHING) {
                log.info(I18nUtil.getMessage("task.claimed.by.sibling"), destination.getFileName());
                return task.finish(TaskState.SKIPPED,
                    TrackOutcome.skipped(item, destination, SkipReason.CLAIMED_BY_SIBLING));
            }

            TrackOutcome result = trackFetcher.fetch(candidate, outputDir);
            switch (result.getKind()) {
                case DOWNLOADED:
                    ledger.record(destination);
                    return task.finish(TaskState.COMPLETED, result);
                case SKIPPED:
                    ledger.record(destination);
                    return task.finish(TaskState.SKIPPED, result);
                default:
                    return task.finish(TaskState.FAILED, result);
            }

        } catch (RuntimeException e) {
            log.error(I18nUtil.getMessage("task.unexpected.error"), item.getSequenceIndex(), e);
            return finishAfterError(task, e);
        }
    }

    /**
     * 意外异常后补写失败结果; 若结果已写入则保持原结果
     */
    private TrackOutcome finishAfterError(DownloadTask task, RuntimeException e) {
        return task.abort(TrackOutcome.failed(task.getItem(), ErrorKind.INTERNAL_ERROR, String.valueOf(e.getMessage())));
    }

    /**
     * 等待所有任务结束
     * 等待期间线程被中断时视为取消请求, 继续等待正在下载的任务完成
     */
    private List<TrackOutcome> awaitAll(List<DownloadTask> tasks, List<Future<TrackOutcome>> futures) {
        List<TrackOutcome> outcomes = new ArrayList<>(tasks.size());
        boolean interrupted = false;

        for (int i = 0; i < tasks.size(); i++) {
            DownloadTask task = tasks.get(i);
            Future<TrackOutcome> future = futures.get(i);
            if (future == null) {
                outcomes.add(task.getOutcome());
                continue;
            }

            TrackOutcome outcome = null;
            while (outcome == null) {
                try {
                    outcome = future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel();
                } catch (ExecutionException e) {
                    log.error(I18nUtil.getMessage("task.unexpected.error"), task.getItem().getSequenceIndex(), e.getCause());
                    outcome = task.getOutcome() != null ? task.getOutcome()
                        : TrackOutcome.failed(task.getItem(), ErrorKind.INTERNAL_ERROR, String.valueOf(e.getCause()));
                }
            }
            outcomes.add(outcome);
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return outcomes;
    }

    private void reportProgress(TrackOutcome outcome, int done, int total) {
        switch (outcome.getKind()) {
            case DOWNLOADED:
                log.info(I18nUtil.getMessage("progress.downloaded"), done, total, outcome.getDestinationPath().getFileName());
                break;
            case SKIPPED:
                log.info(I18nUtil.getMessage("progress.skipped"), done, total, outcome.getItem().getRawTitle());
                break;
            case FAILED:
                log.warn(I18nUtil.getMessage("progress.failed"), done, total, outcome.getItem().getRawTitle(),
                    outcome.getErrorKind());
                break;
            default:
                log.debug(I18nUtil.getMessage("progress.cancelled"), done, total, outcome.getItem().getRawTitle());
        }
    }

    private void logSummary(RunSummary summary) {
        log.info("============================================================");
        log.info(I18nUtil.getMessage("summary.title"));
        log.info(I18nUtil.getMessage("summary.totals"), summary.getTotal(), summary.getDownloaded(),
            summary.getSkipped(), summary.getFailed(), summary.getCancelled());

        List<TrackOutcome> failed = summary.outcomesOf(TrackOutcome.Kind.FAILED);
        if (!failed.isEmpty()) {
            log.info(I18nUtil.getMessage("summary.failed.tracks"));
            for (TrackOutcome outcome : failed) {
                log.info("  - {} ({}: {})", outcome.getItem().getRawTitle(), outcome.getErrorKind(), outcome.getMessage());
            }
        }

        List<TrackOutcome> cancelled = summary.outcomesOf(TrackOutcome.Kind.CANCELLED);
        if (!cancelled.isEmpty()) {
            log.info(I18nUtil.getMessage("summary.cancelled.tracks"));
            for (TrackOutcome outcome : cancelled) {
                log.info("  - {}", outcome.getItem().getRawTitle());
            }
        }
        log.info("============================================================");
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 工作线程命名为 Worker-N, 便于日志区分
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "Worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
