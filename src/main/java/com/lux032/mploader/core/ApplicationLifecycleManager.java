package com.lux032.mploader.core;

import com.lux032.mploader.config.LoaderConfig;
import com.lux032.mploader.service.CoverArtService;
import com.lux032.mploader.service.FfmpegTranscoder;
import com.lux032.mploader.service.JioSaavnClient;
import com.lux032.mploader.service.TagWriterService;
import com.lux032.mploader.service.YtDlpMetadataSource;
import com.lux032.mploader.util.I18nUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 应用程序生命周期管理器
 * 负责初始化和关闭所有服务
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final LoaderConfig config;

    private YtDlpMetadataSource metadataSource;
    private JioSaavnClient jioSaavnClient;
    private CoverArtService coverArtService;
    private FfmpegTranscoder transcoder;
    private TagWriterService tagWriter;
    private TitleNormalizer titleNormalizer;
    private CatalogMatcher catalogMatcher;
    private TrackFetcher trackFetcher;

    public ApplicationLifecycleManager(LoaderConfig config) {
        this.config = config;
    }

    /**
     * 初始化所有服务
     */
    public void initializeServices() {
        I18nUtil.init(config.getLanguage());
        log.info(I18nUtil.getMessage("app.init.services"));

        // Level 1: 外部接口
        metadataSource = new YtDlpMetadataSource(config);
        jioSaavnClient = new JioSaavnClient(config);
        coverArtService = new CoverArtService(jioSaavnClient, config.getArtworkMaxDimension());
        transcoder = new FfmpegTranscoder(config);
        tagWriter = new TagWriterService();

        // Level 2: 核心组件
        titleNormalizer = new TitleNormalizer();
        catalogMatcher = new CatalogMatcher(jioSaavnClient, MatchWeights.fromConfig(config));
        trackFetcher = new TrackFetcher(
            jioSaavnClient,
            transcoder,
            tagWriter,
            coverArtService,
            config.getTargetBitrateKbps(),
            config.getMaxFileNameLength()
        );

        log.info(I18nUtil.getMessage("app.all.services.ready"));
    }

    /**
     * 创建一次运行使用的编排器, 占用表和取消信号每次都是新的
     */
    public DownloadOrchestrator createOrchestrator() {
        if (trackFetcher == null) {
            throw new IllegalStateException("Services are not initialized");
        }
        return new DownloadOrchestrator(
            metadataSource,
            titleNormalizer,
            catalogMatcher,
            trackFetcher,
            new ClaimRegistry(),
            new CancellationSignal()
        );
    }

    /**
     * 检查 yt-dlp 是否可用
     */
    public boolean isYtDlpAvailable() {
        return isToolAvailable(config.getYtDlpPath(), "--version");
    }

    /**
     * 检查 ffmpeg 是否可用
     */
    public boolean isFfmpegAvailable() {
        return isToolAvailable(config.getFfmpegPath(), "-version");
    }

    static boolean isToolAvailable(String path, String versionFlag) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(path, versionFlag);
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 关闭所有服务
     */
    public void shutdown() {
        log.debug(I18nUtil.getMessage("app.shutting.down"));
        if (jioSaavnClient != null) {
            try {
                jioSaavnClient.close();
            } catch (IOException e) {
                log.warn(I18nUtil.getMessage("app.shutdown.http.error"), e);
            }
        }
        log.debug(I18nUtil.getMessage("app.shutdown.complete"));
    }
}
