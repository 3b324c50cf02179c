package com.lux032.mploader.core;

import com.lux032.mploader.exception.PipelineException;
import com.lux032.mploader.model.ErrorKind;
import com.lux032.mploader.model.MatchCandidate;
import com.lux032.mploader.model.SkipReason;
import com.lux032.mploader.model.TagFields;
import com.lux032.mploader.model.TrackOutcome;
import com.lux032.mploader.service.ArtworkSource;
import com.lux032.mploader.service.AudioStreamSource;
import com.lux032.mploader.service.AudioTranscoder;
import com.lux032.mploader.service.TagWriter;
import com.lux032.mploader.util.FileNameUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * 曲目下载
 * 获取音频流 -> 转码为固定码率 MP3 -> 写入标签和封面 -> 移动到最终路径
 *
 * 所有中间文件都写在输出目录下的暂存目录中, 只有全部成功后才移动到最终路径,
 * 失败时最终路径上不会留下半成品
 */
@Slf4j
public class TrackFetcher {

    public static final String STAGING_DIRECTORY = ".mploader-staging";

    private final AudioStreamSource streamSource;
    private final AudioTranscoder transcoder;
    private final TagWriter tagWriter;
    private final ArtworkSource artworkSource;
    private final int targetBitrateKbps;
    private final int maxFileNameLength;

    public TrackFetcher(AudioStreamSource streamSource, AudioTranscoder transcoder, TagWriter tagWriter,
                        ArtworkSource artworkSource, int targetBitrateKbps, int maxFileNameLength) {
        this.streamSource = streamSource;
        this.transcoder = transcoder;
        this.tagWriter = tagWriter;
        this.artworkSource = artworkSource;
        this.targetBitrateKbps = targetBitrateKbps;
        this.maxFileNameLength = maxFileNameLength;
    }

    /**
     * 目标文件路径, 只取决于匹配到的标题和艺术家
     */
    public Path resolveDestination(MatchCandidate candidate, Path destinationDir) {
        return destinationDir.resolve(FileNameUtils.destinationFileName(candidate, maxFileNameLength));
    }

    /**
     * 下载并处理一首曲目
     * 返回的结果没有绑定 SourceItem, 由调用方绑定
     */
    public TrackOutcome fetch(MatchCandidate candidate, Path destinationDir) {
        Path destination = resolveDestination(candidate, destinationDir);
        Path stagingDir = destinationDir.resolve(STAGING_DIRECTORY);
        String stem = UUID.randomUUID().toString();
        Path rawFile = stagingDir.resolve(stem + ".src");
        Path mp3File = stagingDir.resolve(stem + FileNameUtils.MP3_EXTENSION);

        try {
            Files.createDirectories(stagingDir);

            // 1. 下载音频流
            log.info("下载音频流: {} - {}", candidate.getTitle(), candidate.getArtist());
            streamSource.fetchStream(candidate, rawFile);

            // 2. 转码
            transcoder.transcode(rawFile, mp3File, targetBitrateKbps);
            Files.deleteIfExists(rawFile);

            // 3. 封面(获取失败不影响结果)
            byte[] artwork = null;
            if (candidate.getArtworkUrl() != null && !candidate.getArtworkUrl().isEmpty()) {
                artwork = artworkSource.fetchArtwork(candidate.getArtworkUrl());
                if (artwork == null) {
                    log.warn("封面获取失败, 继续处理: {}", candidate.getArtworkUrl());
                }
            }

            // 4. 写入标签
            tagWriter.writeTags(mp3File, TagFields.from(candidate), artwork);

            // 5. 移动到最终路径
            moveIntoPlace(mp3File, destination);
            log.info("文件处理完成: {}", destination.getFileName());
            return TrackOutcome.downloaded(null, destination);

        } catch (FileAlreadyExistsException e) {
            log.info("目标文件已存在, 不覆盖: {}", destination.getFileName());
            return TrackOutcome.skipped(null, destination, SkipReason.DESTINATION_ALREADY_EXISTS);
        } catch (PipelineException e) {
            log.error("处理失败 [{}]: {} - {}", e.getErrorKind(), destination.getFileName(), e.getMessage());
            return TrackOutcome.failed(null, e.getErrorKind(), e.getMessage());
        } catch (IOException e) {
            log.error("文件操作失败: {}", destination.getFileName(), e);
            return TrackOutcome.failed(null, ErrorKind.IO_ERROR, e.getMessage());
        } finally {
            deleteQuietly(rawFile);
            deleteQuietly(mp3File);
        }
    }

    /**
     * 原子移动, 文件系统不支持时退回普通移动; 两种方式都不覆盖已有文件
     */
    private void moveIntoPlace(Path source, Path destination) throws IOException {
        if (Files.exists(destination)) {
            throw new FileAlreadyExistsException(destination.toString());
        }
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("不支持原子移动, 使用普通移动: {}", destination);
            Files.move(source, destination);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("删除临时文件失败: {} - {}", path, e.getMessage());
        }
    }
}
