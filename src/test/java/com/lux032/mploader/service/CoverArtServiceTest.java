package com.lux032.mploader.service;

import com.lux032.mploader.config.LoaderConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

public class CoverArtServiceTest {

    @Test
    public void testLargeImageScaledDown() throws IOException {
        byte[] original = png(1000, 500);

        byte[] scaled = CoverArtService.scaleToFit(original, 500);

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(scaled));
        Assertions.assertEquals(500, image.getWidth());
        Assertions.assertEquals(250, image.getHeight());
    }

    @Test
    public void testSmallImageUnchanged() throws IOException {
        byte[] original = png(300, 300);

        Assertions.assertSame(original, CoverArtService.scaleToFit(original, 500));
    }

    @Test
    public void testUnreadableDataReturnedAsIs() {
        byte[] garbage = {1, 2, 3, 4};

        Assertions.assertSame(garbage, CoverArtService.scaleToFit(garbage, 500));
    }

    @Test
    public void testArtworkCachedByUrl() throws IOException {
        AtomicInteger downloads = new AtomicInteger();
        byte[] image = png(100, 100);
        try (JioSaavnClient client = new JioSaavnClient(LoaderConfig.defaults()) {
            @Override
            public byte[] downloadArtwork(String url) {
                downloads.incrementAndGet();
                return image;
            }
        }) {
            CoverArtService service = new CoverArtService(client, 500);

            Assertions.assertArrayEquals(image, service.fetchArtwork("https://c/500.jpg"));
            Assertions.assertArrayEquals(image, service.fetchArtwork("https://c/500.jpg"));
            Assertions.assertNull(service.fetchArtwork(null));

            Assertions.assertEquals(1, downloads.get());
            Assertions.assertEquals(1, service.cacheSize());
        }
    }

    @Test
    public void testFailedDownloadNotCached() throws IOException {
        try (JioSaavnClient client = new JioSaavnClient(LoaderConfig.defaults()) {
            @Override
            public byte[] downloadArtwork(String url) {
                return null;
            }
        }) {
            CoverArtService service = new CoverArtService(client, 500);

            Assertions.assertNull(service.fetchArtwork("https://c/missing.jpg"));
            Assertions.assertEquals(0, service.cacheSize());
        }
    }

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
