package com.lux032.mploader.core;

import com.lux032.mploader.model.ErrorKind;
import com.lux032.mploader.model.MatchCandidate;
import com.lux032.mploader.model.SkipReason;
import com.lux032.mploader.model.TagFields;
import com.lux032.mploader.model.TrackOutcome;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

public class TrackFetcherTest {

    @TempDir
    Path outputDir;

    private FakeCollaborators.FakeStreamSource streamSource;
    private FakeCollaborators.CopyTranscoder transcoder;
    private FakeCollaborators.RecordingTagWriter tagWriter;

    @BeforeEach
    public void setUp() {
        streamSource = new FakeCollaborators.FakeStreamSource();
        transcoder = new FakeCollaborators.CopyTranscoder();
        tagWriter = new FakeCollaborators.RecordingTagWriter();
    }

    private TrackFetcher fetcher(byte[] artwork) {
        return new TrackFetcher(streamSource, transcoder, tagWriter,
            new FakeCollaborators.FixedArtwork(artwork), 320, 200);
    }

    @Test
    public void testSuccessfulFetchMovesFileIntoPlace() throws IOException {
        byte[] artwork = {1, 2, 3};
        MatchCandidate candidate = FakeCollaborators.candidate("Believer", "Imagine Dragons");

        TrackOutcome outcome = fetcher(artwork).fetch(candidate, outputDir);

        Path expected = outputDir.resolve("Believer - Imagine Dragons.mp3");
        Assertions.assertTrue(outcome.isDownloaded());
        Assertions.assertEquals(expected, outcome.getDestinationPath());
        Assertions.assertEquals("Believer", Files.readString(expected, StandardCharsets.UTF_8));

        TagFields fields = tagWriter.written.get(0);
        Assertions.assertEquals("Believer", fields.getTitle());
        Assertions.assertEquals("Imagine Dragons", fields.getAlbumArtist());
        Assertions.assertEquals("English", fields.getGenre());
        Assertions.assertArrayEquals(artwork, tagWriter.artworks.get(0));
        assertStagingEmpty();
    }

    @Test
    public void testMissingArtworkDoesNotFailTrack() {
        TrackOutcome outcome = fetcher(null).fetch(FakeCollaborators.candidate("Believer", "Imagine Dragons"), outputDir);

        Assertions.assertTrue(outcome.isDownloaded());
        Assertions.assertTrue(tagWriter.artworks.isEmpty());
        Assertions.assertEquals(1, tagWriter.written.size());
    }

    @Test
    public void testStreamFailureLeavesNoFile() throws IOException {
        streamSource.failingTitles.add("Believer");

        TrackOutcome outcome = fetcher(null).fetch(FakeCollaborators.candidate("Believer", "Imagine Dragons"), outputDir);

        Assertions.assertTrue(outcome.isFailed());
        Assertions.assertEquals(ErrorKind.STREAM_UNAVAILABLE, outcome.getErrorKind());
        Assertions.assertFalse(Files.exists(outputDir.resolve("Believer - Imagine Dragons.mp3")));
        assertStagingEmpty();
    }

    @Test
    public void testTranscodeFailureLeavesNoFile() throws IOException {
        transcoder.failAll = true;

        TrackOutcome outcome = fetcher(null).fetch(FakeCollaborators.candidate("Believer", "Imagine Dragons"), outputDir);

        Assertions.assertEquals(ErrorKind.TRANSCODE_ERROR, outcome.getErrorKind());
        Assertions.assertFalse(Files.exists(outputDir.resolve("Believer - Imagine Dragons.mp3")));
        assertStagingEmpty();
    }

    @Test
    public void testTagFailureLeavesNoFile() throws IOException {
        tagWriter.fail = true;

        TrackOutcome outcome = fetcher(null).fetch(FakeCollaborators.candidate("Believer", "Imagine Dragons"), outputDir);

        Assertions.assertEquals(ErrorKind.TAG_WRITE_ERROR, outcome.getErrorKind());
        Assertions.assertFalse(Files.exists(outputDir.resolve("Believer - Imagine Dragons.mp3")));
        assertStagingEmpty();
    }

    @Test
    public void testExistingFileIsNeverOverwritten() throws IOException {
        Path existing = outputDir.resolve("Believer - Imagine Dragons.mp3");
        Files.writeString(existing, "original");

        TrackOutcome outcome = fetcher(null).fetch(FakeCollaborators.candidate("Believer", "Imagine Dragons"), outputDir);

        Assertions.assertTrue(outcome.isSkipped());
        Assertions.assertEquals(SkipReason.DESTINATION_ALREADY_EXISTS, outcome.getSkipReason());
        Assertions.assertEquals("original", Files.readString(existing));
        assertStagingEmpty();
    }

    @Test
    public void testDestinationNameIsSanitized() {
        Path destination = fetcher(null).resolveDestination(
            FakeCollaborators.candidate("What? Is: This", "AC/DC"), outputDir);

        Assertions.assertEquals("What Is This - ACDC.mp3", destination.getFileName().toString());
    }

    private void assertStagingEmpty() throws IOException {
        Path staging = outputDir.resolve(TrackFetcher.STAGING_DIRECTORY);
        if (!Files.exists(staging)) {
            return;
        }
        try (Stream<Path> files = Files.list(staging)) {
            Assertions.assertEquals(0, files.count());
        }
    }
}
