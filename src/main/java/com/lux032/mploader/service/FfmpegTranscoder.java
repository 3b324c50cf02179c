package com.lux032.mploader.service;

import com.lux032.mploader.config.LoaderConfig;
import com.lux032.mploader.exception.TranscodeException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 使用 ffmpeg 将下载的音频流转码为固定码率的 MP3
 */
@Slf4j
public class FfmpegTranscoder implements AudioTranscoder {

    private static final int MAX_OUTPUT_CHARS = 4000;

    private final String ffmpegPath;

    public FfmpegTranscoder(LoaderConfig config) {
        this(config.getFfmpegPath());
    }

    public FfmpegTranscoder(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath == null || ffmpegPath.isEmpty() ? "ffmpeg" : ffmpegPath;
    }

    @Override
    public Path transcode(Path source, Path target, int targetBitrateKbps) throws TranscodeException {
        if (targetBitrateKbps <= 0) {
            throw new TranscodeException("Invalid target bitrate: " + targetBitrateKbps);
        }
        if (!Files.isRegularFile(source)) {
            throw new TranscodeException("Source file does not exist: " + source);
        }

        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-y");
        command.add("-i");
        command.add(source.toAbsolutePath().toString());
        command.add("-vn");
        command.add("-codec:a");
        command.add("libmp3lame");
        command.add("-b:a");
        command.add(targetBitrateKbps + "k");
        command.add(target.toAbsolutePath().toString());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new TranscodeException("Cannot start ffmpeg (" + ffmpegPath + "): " + e.getMessage(), e);
        }

        // 只保留输出末尾, 错误信息在最后
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
                if (output.length() > MAX_OUTPUT_CHARS) {
                    output.delete(0, output.length() - MAX_OUTPUT_CHARS);
                }
            }
        } catch (IOException e) {
            process.destroy();
            throw new TranscodeException("Failed to read ffmpeg output: " + e.getMessage(), e);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new TranscodeException("ffmpeg interrupted", e);
        }

        if (exitCode != 0) {
            log.warn("ffmpeg 转码失败 (code {}): {}", exitCode, output.toString().trim());
            throw new TranscodeException("ffmpeg exited with code " + exitCode);
        }
        if (!Files.isRegularFile(target)) {
            throw new TranscodeException("ffmpeg produced no output: " + target.getFileName());
        }

        log.debug("转码完成: {} -> {} ({}k)", source.getFileName(), target.getFileName(), targetBitrateKbps);
        return target;
    }
}
