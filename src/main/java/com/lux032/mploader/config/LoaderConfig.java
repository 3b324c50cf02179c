package com.lux032.mploader.config;

import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 下载器配置类
 */
@Data
public class LoaderConfig {

    private static final String CONFIG_FILE = "config.properties";

    // 输出配置
    private String outputDirectory;
    private int workerCount; // 并行下载线程数
    private int maxFileNameLength;

    // 外部工具配置
    private String ytDlpPath;
    private String ffmpegPath;
    private int targetBitrateKbps; // 转码目标码率

    // 音乐目录 API 配置
    private String catalogApiUrl;
    private String userAgent;
    private int catalogMaxRetries;
    private long catalogRetryDelayMs;
    private String streamQuality; // 优先选择的音频质量, 如 320kbps

    // 封面配置
    private String artworkQuality; // 优先选择的封面尺寸, 如 500x500
    private int artworkMaxDimension;

    // 匹配权重配置
    private double titleWeight;
    private double durationWeight;
    private double artistWeight;
    private double minSimilarity;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // 国际化配置
    private String language;

    private static LoaderConfig instance;

    private LoaderConfig() {
        // 默认配置
        this.outputDirectory = "downloads";
        this.workerCount = 3;
        this.maxFileNameLength = 200;
        this.ytDlpPath = "yt-dlp";
        this.ffmpegPath = "ffmpeg";
        this.targetBitrateKbps = 320;
        this.catalogApiUrl = "https://saavn.sumit.co/api";
        this.userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        this.catalogMaxRetries = 3;
        this.catalogRetryDelayMs = 2000;
        this.streamQuality = "320kbps";
        this.artworkQuality = "500x500";
        this.artworkMaxDimension = 500;
        this.titleWeight = 0.6;
        this.durationWeight = 0.25;
        this.artistWeight = 0.15;
        this.minSimilarity = 0.45;
        this.language = "en_US";
    }

    /**
     * 获取配置单例
     */
    public static synchronized LoaderConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(CONFIG_FILE));
        }
        return instance;
    }

    /**
     * 默认配置(不读取任何文件)
     */
    public static LoaderConfig defaults() {
        return new LoaderConfig();
    }

    /**
     * 从指定文件加载配置, 文件不存在时使用默认配置
     */
    public static LoaderConfig load(Path configFile) {
        LoaderConfig config = new LoaderConfig();
        if (!Files.isRegularFile(configFile)) {
            System.out.println("未找到配置文件，使用默认配置");
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configFile)) {
            props.load(in);
            config.apply(props);
            System.out.println("配置文件加载成功");
            if (config.isProxyEnabled()) {
                System.out.println("HTTP 代理已启用: " + config.getProxyHost() + ":" + config.getProxyPort());
            }
        } catch (IOException e) {
            System.err.println("读取配置文件失败，使用默认配置: " + e.getMessage());
        }
        return config;
    }

    /**
     * 将属性应用到当前配置
     */
    void apply(Properties props) {
        if (props.containsKey("output.directory")) {
            this.outputDirectory = props.getProperty("output.directory");
        }
        this.workerCount = intProperty(props, "workers.count", workerCount);
        this.maxFileNameLength = intProperty(props, "file.maxNameLength", maxFileNameLength);

        if (props.containsKey("source.ytDlpPath")) {
            this.ytDlpPath = props.getProperty("source.ytDlpPath");
        }
        if (props.containsKey("audio.ffmpegPath")) {
            this.ffmpegPath = props.getProperty("audio.ffmpegPath");
        }
        this.targetBitrateKbps = intProperty(props, "audio.bitrateKbps", targetBitrateKbps);

        if (props.containsKey("catalog.apiUrl")) {
            this.catalogApiUrl = props.getProperty("catalog.apiUrl");
        }
        if (props.containsKey("catalog.userAgent")) {
            this.userAgent = props.getProperty("catalog.userAgent");
        }
        this.catalogMaxRetries = intProperty(props, "catalog.maxRetries", catalogMaxRetries);
        this.catalogRetryDelayMs = longProperty(props, "catalog.retryDelayMs", catalogRetryDelayMs);
        if (props.containsKey("catalog.streamQuality")) {
            this.streamQuality = props.getProperty("catalog.streamQuality");
        }

        if (props.containsKey("artwork.quality")) {
            this.artworkQuality = props.getProperty("artwork.quality");
        }
        this.artworkMaxDimension = intProperty(props, "artwork.maxDimension", artworkMaxDimension);

        this.titleWeight = doubleProperty(props, "match.weight.title", titleWeight);
        this.durationWeight = doubleProperty(props, "match.weight.duration", durationWeight);
        this.artistWeight = doubleProperty(props, "match.weight.artist", artistWeight);
        this.minSimilarity = doubleProperty(props, "match.minSimilarity", minSimilarity);

        // 加载代理配置
        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled"));
        }
        if (props.containsKey("proxy.host")) {
            this.proxyHost = props.getProperty("proxy.host");
        }
        this.proxyPort = intProperty(props, "proxy.port", proxyPort);

        if (props.containsKey("language")) {
            this.language = props.getProperty("language");
        }
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("配置项格式错误: " + key + "=" + props.getProperty(key));
            return defaultValue;
        }
    }

    private static long longProperty(Properties props, String key, long defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("配置项格式错误: " + key + "=" + props.getProperty(key));
            return defaultValue;
        }
    }

    private static double doubleProperty(Properties props, String key, double defaultValue) {
        if (!props.containsKey(key)) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("配置项格式错误: " + key + "=" + props.getProperty(key));
            return defaultValue;
        }
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (outputDirectory == null || outputDirectory.isEmpty()) {
            System.err.println("输出目录未配置");
            return false;
        }
        if (workerCount < 1) {
            System.err.println("并行线程数必须大于 0: " + workerCount);
            return false;
        }
        if (targetBitrateKbps <= 0) {
            System.err.println("转码码率必须大于 0: " + targetBitrateKbps);
            return false;
        }
        if (titleWeight < 0 || durationWeight < 0 || artistWeight < 0
            || titleWeight + durationWeight + artistWeight <= 0) {
            System.err.println("匹配权重配置无效");
            return false;
        }
        if (minSimilarity < 0 || minSimilarity > 1) {
            System.err.println("最低相似度必须在 0 到 1 之间: " + minSimilarity);
            return false;
        }
        return true;
    }
}
