package com.lux032.mploader;

import ch.qos.logback.classic.Level;
import com.lux032.mploader.config.LoaderConfig;
import com.lux032.mploader.core.ApplicationLifecycleManager;
import com.lux032.mploader.core.DownloadOrchestrator;
import com.lux032.mploader.exception.SourceUnavailableException;
import com.lux032.mploader.model.RunSummary;
import com.lux032.mploader.util.BannerUtil;
import com.lux032.mploader.util.I18nUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * 播放列表下载器主程序
 * 功能：
 * 1. 提取 YouTube 视频或播放列表的元数据
 * 2. 在 JioSaavn 中搜索匹配的曲目
 * 3. 并行下载, 转码为 MP3 并写入标签和封面
 */
@Slf4j
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_PARTIAL = 2;
    static final int EXIT_CANCELLED = 130;

    private static final String BASE_PACKAGE = "com.lux032.mploader";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return EXIT_FAILURE;
        }
        if (options.isHelp()) {
            printUsage();
            return EXIT_OK;
        }

        if (options.isVerbose()) {
            setLogLevel(Level.DEBUG);
        }

        // 1. 加载配置, 命令行参数优先
        LoaderConfig config = LoaderConfig.getInstance();
        if (options.getOutputDirectory() != null) {
            config.setOutputDirectory(options.getOutputDirectory());
        }
        if (options.getWorkers() != null) {
            config.setWorkerCount(options.getWorkers());
        }
        I18nUtil.init(config.getLanguage());

        BannerUtil.printBanner();
        if (!config.isValid()) {
            log.error(I18nUtil.getMessage("app.config.invalid"));
            return EXIT_FAILURE;
        }
        log.info(I18nUtil.getMessage("app.output.directory"), config.getOutputDirectory());
        log.info(I18nUtil.getMessage("app.worker.count"), config.getWorkerCount());

        // 2. 初始化服务
        ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config);
        lifecycleManager.initializeServices();

        // 3. 检查依赖工具
        if (!lifecycleManager.isYtDlpAvailable()) {
            log.warn(I18nUtil.getMessage("main.ytdlp.missing"), config.getYtDlpPath());
        }
        if (!lifecycleManager.isFfmpegAvailable()) {
            log.warn(I18nUtil.getMessage("main.ffmpeg.missing"), config.getFfmpegPath());
        }

        // 4. Ctrl+C 时取消, 等待正在下载的曲目完成
        DownloadOrchestrator orchestrator = lifecycleManager.createOrchestrator();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            log.warn(I18nUtil.getMessage("main.interrupt.received"));
            orchestrator.cancel();
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        // 5. 执行下载
        try {
            Path outputDir = Paths.get(config.getOutputDirectory());
            RunSummary summary = orchestrator.run(options.getUrl(), outputDir, config.getWorkerCount());
            int exitCode = exitCode(summary, orchestrator.isCancelled());
            log.info(I18nUtil.getMessage("main.finished"), outputDir.toAbsolutePath());
            return exitCode;
        } catch (SourceUnavailableException e) {
            log.error(I18nUtil.getMessage("main.source.unavailable"), e.getMessage());
            return orchestrator.isCancelled() ? EXIT_CANCELLED : EXIT_FAILURE;
        } catch (Exception e) {
            log.error(I18nUtil.getMessage("main.error"), e);
            return EXIT_FAILURE;
        } finally {
            lifecycleManager.shutdown();
            finished.countDown();
        }
    }

    /**
     * 退出码: 0 全部成功, 2 部分失败, 1 全部失败, 130 被取消
     */
    static int exitCode(RunSummary summary, boolean cancelled) {
        if (cancelled) {
            return EXIT_CANCELLED;
        }
        if (summary.getFailed() == 0) {
            return EXIT_OK;
        }
        return summary.getFailed() == summary.getTotal() ? EXIT_FAILURE : EXIT_PARTIAL;
    }

    /**
     * 解析命令行参数
     * mploader URL [-o DIR] [-w N] [-v] [-h]
     */
    static CliOptions parseArguments(String[] args) {
        CliOptions options = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    options.setHelp(true);
                    break;
                case "-v":
                case "--verbose":
                    options.setVerbose(true);
                    break;
                case "-o":
                case "--output":
                    options.setOutputDirectory(requireValue(args, ++i, arg));
                    break;
                case "-w":
                case "--workers":
                    String value = requireValue(args, ++i, arg);
                    int workers;
                    try {
                        workers = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(I18nUtil.getMessage("cli.workers.invalid", value));
                    }
                    if (workers < 1) {
                        throw new IllegalArgumentException(I18nUtil.getMessage("cli.workers.invalid", value));
                    }
                    options.setWorkers(workers);
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException(I18nUtil.getMessage("cli.unknown.option", arg));
                    }
                    if (options.getUrl() != null) {
                        throw new IllegalArgumentException(I18nUtil.getMessage("cli.extra.argument", arg));
                    }
                    options.setUrl(arg);
            }
        }
        if (!options.isHelp() && (options.getUrl() == null || options.getUrl().isBlank())) {
            throw new IllegalArgumentException(I18nUtil.getMessage("cli.url.required"));
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException(I18nUtil.getMessage("cli.missing.value", option));
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println(I18nUtil.getMessage("cli.usage"));
        System.out.println(I18nUtil.getMessage("cli.usage.output"));
        System.out.println(I18nUtil.getMessage("cli.usage.workers"));
        System.out.println(I18nUtil.getMessage("cli.usage.verbose"));
        System.out.println(I18nUtil.getMessage("cli.usage.help"));
    }

    private static void setLogLevel(Level level) {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_PACKAGE);
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(level);
        }
    }

    /**
     * 命令行参数
     */
    @Data
    static class CliOptions {
        private String url;
        private String outputDirectory;
        private Integer workers;
        private boolean verbose;
        private boolean help;
    }
}
