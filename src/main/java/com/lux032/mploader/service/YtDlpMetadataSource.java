package com.lux032.mploader.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.mploader.config.LoaderConfig;
import com.lux032.mploader.exception.SourceUnavailableException;
import com.lux032.mploader.model.SourceItem;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 使用 yt-dlp 提取视频/播放列表元数据(不下载)
 */
@Slf4j
public class YtDlpMetadataSource implements MetadataSource {

    private final String ytDlpPath;
    private final ObjectMapper objectMapper;

    public YtDlpMetadataSource(LoaderConfig config) {
        this(config.getYtDlpPath());
    }

    public YtDlpMetadataSource(String ytDlpPath) {
        this.ytDlpPath = ytDlpPath;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<SourceItem> resolveItems(String sourceUrl) throws SourceUnavailableException {
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new SourceUnavailableException("Source URL is empty");
        }
        String json = runYtDlp(sourceUrl);
        List<SourceItem> items = parseItems(json, sourceUrl);
        log.info("提取到 {} 个条目: {}", items.size(), sourceUrl);
        return items;
    }

    private String runYtDlp(String sourceUrl) throws SourceUnavailableException {
        List<String> command = new ArrayList<>();
        command.add(ytDlpPath);
        command.add("--flat-playlist");
        command.add("--dump-single-json");
        command.add("--no-warnings");
        command.add(sourceUrl);
        log.debug("yt-dlp 命令: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot start yt-dlp (" + ytDlpPath + "): " + e.getMessage(), e);
        }

        StringBuilder errorOutput = new StringBuilder();
        Thread errorReader = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (errorOutput) {
                        errorOutput.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.debug("读取 yt-dlp 错误输出失败: {}", e.getMessage());
            }
        }, "yt-dlp-stderr");
        errorReader.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line);
            }

            int exitCode = process.waitFor();
            errorReader.join();
            if (exitCode != 0) {
                String error;
                synchronized (errorOutput) {
                    error = errorOutput.toString().trim();
                }
                log.error("yt-dlp 执行失败 (code {}): {}", exitCode, error);
                throw new SourceUnavailableException("yt-dlp exited with code " + exitCode + ": " + error);
            }
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read yt-dlp output: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while extracting metadata", e);
        }
        return output.toString();
    }

    /**
     * 解析 yt-dlp 的 JSON 输出
     * 带 entries 的是播放列表(跳过空条目), 否则是单个视频
     */
    List<SourceItem> parseItems(String json, String sourceUrl) throws SourceUnavailableException {
        if (json == null || json.isBlank()) {
            throw new SourceUnavailableException("yt-dlp returned empty output for " + sourceUrl);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SourceUnavailableException("Unreadable yt-dlp output: " + e.getMessage(), e);
        }

        List<SourceItem> items = new ArrayList<>();
        JsonNode entries = root.path("entries");
        if (entries.isArray()) {
            int index = 0;
            for (JsonNode entry : entries) {
                if (entry == null || entry.isNull() || !entry.isObject()) {
                    continue;
                }
                index++;
                items.add(toSourceItem(entry, index, entry.path("url").asText(null)));
            }
            log.info("播放列表 '{}' 共 {} 首", root.path("title").asText(""), items.size());
        } else if (root.isObject()) {
            String url = root.path("webpage_url").asText(sourceUrl);
            items.add(toSourceItem(root, 1, url));
        }

        if (items.isEmpty()) {
            throw new SourceUnavailableException("No items could be extracted from " + sourceUrl);
        }
        return items;
    }

    private SourceItem toSourceItem(JsonNode node, int index, String url) {
        String uploader = node.path("uploader").asText(null);
        if (uploader == null || uploader.isEmpty()) {
            uploader = node.path("channel").asText("");
        }
        Integer duration = null;
        JsonNode durationNode = node.path("duration");
        if (durationNode.isNumber() && durationNode.asDouble() > 0) {
            duration = (int) Math.round(durationNode.asDouble());
        }
        return new SourceItem(
            node.path("title").asText(""),
            uploader,
            node.path("id").asText(""),
            index,
            url,
            duration
        );
    }
}
