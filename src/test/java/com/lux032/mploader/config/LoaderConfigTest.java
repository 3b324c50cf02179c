package com.lux032.mploader.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class LoaderConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testMissingFileUsesDefaults() {
        LoaderConfig config = LoaderConfig.load(tempDir.resolve("missing.properties"));

        Assertions.assertEquals("downloads", config.getOutputDirectory());
        Assertions.assertEquals(3, config.getWorkerCount());
        Assertions.assertEquals(320, config.getTargetBitrateKbps());
        Assertions.assertEquals("https://saavn.sumit.co/api", config.getCatalogApiUrl());
        Assertions.assertFalse(config.isProxyEnabled());
        Assertions.assertTrue(config.isValid());
    }

    @Test
    public void testFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("config.properties");
        Files.write(file, String.join("\n",
            "output.directory=music",
            "workers.count=6",
            "audio.bitrateKbps=192",
            "match.weight.title=0.8",
            "proxy.enabled=true",
            "proxy.host=127.0.0.1",
            "proxy.port=7890",
            "language=zh_CN"
        ).getBytes(StandardCharsets.UTF_8));

        LoaderConfig config = LoaderConfig.load(file);

        Assertions.assertEquals("music", config.getOutputDirectory());
        Assertions.assertEquals(6, config.getWorkerCount());
        Assertions.assertEquals(192, config.getTargetBitrateKbps());
        Assertions.assertEquals(0.8, config.getTitleWeight(), 1e-9);
        Assertions.assertEquals(0.25, config.getDurationWeight(), 1e-9);
        Assertions.assertTrue(config.isProxyEnabled());
        Assertions.assertEquals("127.0.0.1", config.getProxyHost());
        Assertions.assertEquals(7890, config.getProxyPort());
        Assertions.assertEquals("zh_CN", config.getLanguage());
    }

    @Test
    public void testMalformedNumberKeepsDefault() {
        Properties props = new Properties();
        props.setProperty("workers.count", "many");
        props.setProperty("catalog.retryDelayMs", " 500 ");

        LoaderConfig config = LoaderConfig.defaults();
        config.apply(props);

        Assertions.assertEquals(3, config.getWorkerCount());
        Assertions.assertEquals(500L, config.getCatalogRetryDelayMs());
    }

    @Test
    public void testInvalidConfigurations() {
        LoaderConfig noWorkers = LoaderConfig.defaults();
        noWorkers.setWorkerCount(0);
        Assertions.assertFalse(noWorkers.isValid());

        LoaderConfig zeroWeights = LoaderConfig.defaults();
        zeroWeights.setTitleWeight(0);
        zeroWeights.setDurationWeight(0);
        zeroWeights.setArtistWeight(0);
        Assertions.assertFalse(zeroWeights.isValid());

        LoaderConfig badThreshold = LoaderConfig.defaults();
        badThreshold.setMinSimilarity(1.5);
        Assertions.assertFalse(badThreshold.isValid());
    }
}
