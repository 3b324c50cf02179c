package com.lux032.mploader.core;

import com.lux032.mploader.exception.StreamUnavailableException;
import com.lux032.mploader.exception.TagWriteException;
import com.lux032.mploader.exception.TranscodeException;
import com.lux032.mploader.model.MatchCandidate;
import com.lux032.mploader.model.TagFields;
import com.lux032.mploader.service.ArtworkSource;
import com.lux032.mploader.service.AudioStreamSource;
import com.lux032.mploader.service.AudioTranscoder;
import com.lux032.mploader.service.TagWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用的外部接口替身, 只写本地文件
 */
final class FakeCollaborators {

    private FakeCollaborators() {
    }

    /**
     * 写入候选标题作为"音频流"; 可以指定失败的标题, 也可以在第一次下载时阻塞
     */
    static class FakeStreamSource implements AudioStreamSource {
        final AtomicInteger fetchCount = new AtomicInteger();
        final Set<String> failingTitles = ConcurrentHashMap.newKeySet();
        final CountDownLatch firstFetchStarted = new CountDownLatch(1);
        volatile CountDownLatch firstFetchRelease;

        @Override
        public void fetchStream(MatchCandidate candidate, Path target) throws StreamUnavailableException {
            int count = fetchCount.incrementAndGet();
            if (failingTitles.contains(candidate.getTitle())) {
                throw new StreamUnavailableException("stream gone: " + candidate.getTitle());
            }
            if (count == 1) {
                firstFetchStarted.countDown();
                CountDownLatch release = firstFetchRelease;
                if (release != null) {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            try {
                Files.write(target, candidate.getTitle().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    /**
     * 直接复制文件作为"转码"
     */
    static class CopyTranscoder implements AudioTranscoder {
        volatile boolean failAll;

        @Override
        public Path transcode(Path source, Path target, int targetBitrateKbps) throws TranscodeException {
            if (failAll) {
                throw new TranscodeException("unsupported input");
            }
            try {
                Files.copy(source, target);
            } catch (IOException e) {
                throw new TranscodeException("copy failed", e);
            }
            return target;
        }
    }

    static class RecordingTagWriter implements TagWriter {
        final List<TagFields> written = new CopyOnWriteArrayList<>();
        final List<byte[]> artworks = new CopyOnWriteArrayList<>();
        volatile boolean fail;

        @Override
        public void writeTags(Path audioFile, TagFields fields, byte[] artwork) throws TagWriteException {
            if (fail) {
                throw new TagWriteException("malformed file");
            }
            written.add(fields);
            if (artwork != null) {
                artworks.add(artwork);
            }
        }
    }

    static class FixedArtwork implements ArtworkSource {
        final byte[] data;

        FixedArtwork(byte[] data) {
            this.data = data;
        }

        @Override
        public byte[] fetchArtwork(String artworkUrl) {
            return data;
        }
    }

    static MatchCandidate candidate(String title, String artist) {
        return MatchCandidate.builder()
            .catalogId(title.toLowerCase())
            .title(title)
            .artist(artist)
            .album("Album")
            .year(2020)
            .durationSeconds(200)
            .artworkUrl("https://img/" + title)
            .qualityScore(320)
            .language("english")
            .build();
    }
}
