package com.lux032.mploader.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class DownloadLedgerTest {

    @TempDir
    Path outputDir;

    @Test
    public void testSnapshotContainsExistingMp3Files() throws IOException {
        Files.writeString(outputDir.resolve("Believer - Imagine Dragons.mp3"), "x");
        Files.writeString(outputDir.resolve("notes.txt"), "x");

        DownloadLedger ledger = DownloadLedger.snapshot(outputDir);

        Assertions.assertEquals(1, ledger.size());
        Assertions.assertTrue(ledger.exists(outputDir.resolve("Believer - Imagine Dragons.mp3")));
        Assertions.assertFalse(ledger.exists(outputDir.resolve("notes.mp3")));
    }

    @Test
    public void testComparisonIgnoresCase() throws IOException {
        Files.writeString(outputDir.resolve("Believer - Imagine Dragons.mp3"), "x");

        DownloadLedger ledger = DownloadLedger.snapshot(outputDir);

        Assertions.assertTrue(ledger.exists(outputDir.resolve("BELIEVER - imagine dragons.mp3")));
    }

    @Test
    public void testUpperCaseExtensionIsSeen() throws IOException {
        Files.writeString(outputDir.resolve("Song - Artist.MP3"), "x");
        Files.createDirectory(outputDir.resolve("folder.mp3"));

        DownloadLedger ledger = DownloadLedger.snapshot(outputDir);

        Assertions.assertEquals(1, ledger.size());
        Assertions.assertTrue(ledger.exists(outputDir.resolve("Song - Artist.mp3")));
    }

    @Test
    public void testSnapshotIsNotRefreshed() throws IOException {
        DownloadLedger ledger = DownloadLedger.snapshot(outputDir);
        Path later = outputDir.resolve("Later - Artist.mp3");
        Files.writeString(later, "x");

        Assertions.assertFalse(ledger.exists(later));

        ledger.record(later);
        Assertions.assertTrue(ledger.exists(later));
    }

    @Test
    public void testMissingDirectoryGivesEmptySnapshot() throws IOException {
        DownloadLedger ledger = DownloadLedger.snapshot(outputDir.resolve("does-not-exist"));

        Assertions.assertEquals(0, ledger.size());
    }
}
