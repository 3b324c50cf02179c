package com.lux032.mploader.service;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 封面艺术服务
 * 同一专辑的曲目共用封面地址, 按地址缓存, 超过尺寸上限时缩放
 */
@Slf4j
public class CoverArtService implements ArtworkSource {

    private static final float JPEG_QUALITY = 0.9f;

    private final JioSaavnClient client;
    private final int maxDimension;

    // 封面地址 -> 处理后的封面数据
    private final Map<String, byte[]> cache = new ConcurrentHashMap<>();

    public CoverArtService(JioSaavnClient client, int maxDimension) {
        this.client = client;
        this.maxDimension = maxDimension;
    }

    @Override
    public byte[] fetchArtwork(String artworkUrl) {
        if (artworkUrl == null || artworkUrl.isEmpty()) {
            return null;
        }

        byte[] cached = cache.get(artworkUrl);
        if (cached != null) {
            log.debug("从缓存获取封面: {}", artworkUrl);
            return cached;
        }

        log.debug("正在下载封面图片: {}", artworkUrl);
        byte[] raw = client.downloadArtwork(artworkUrl);
        if (raw == null || raw.length == 0) {
            return null;
        }

        byte[] artwork = scaleToFit(raw, maxDimension);
        cache.put(artworkUrl, artwork);
        return artwork;
    }

    int cacheSize() {
        return cache.size();
    }

    /**
     * 图片宽或高超过上限时等比缩小并重新编码为 JPEG
     * 无法识别的数据原样返回
     */
    static byte[] scaleToFit(byte[] imageData, int maxDimension) {
        if (imageData == null || imageData.length == 0 || maxDimension <= 0) {
            return imageData;
        }

        try {
            BufferedImage original = ImageIO.read(new ByteArrayInputStream(imageData));
            if (original == null) {
                log.warn("无法读取封面图片, 使用原始数据");
                return imageData;
            }

            int width = original.getWidth();
            int height = original.getHeight();
            if (width <= maxDimension && height <= maxDimension) {
                return imageData;
            }

            double scale = (double) maxDimension / Math.max(width, height);
            int scaledWidth = Math.max(1, (int) (width * scale));
            int scaledHeight = Math.max(1, (int) (height * scale));

            Image scaled = original.getScaledInstance(scaledWidth, scaledHeight, Image.SCALE_SMOOTH);
            BufferedImage rgbImage = new BufferedImage(scaledWidth, scaledHeight, BufferedImage.TYPE_INT_RGB);
            Graphics2D g2d = rgbImage.createGraphics();
            g2d.drawImage(scaled, 0, 0, null);
            g2d.dispose();

            byte[] compressed = toJpeg(rgbImage);
            log.debug("封面缩放: {}x{} -> {}x{}", width, height, scaledWidth, scaledHeight);
            return compressed;

        } catch (IOException e) {
            log.warn("封面缩放失败, 使用原始数据: {}", e.getMessage());
            return imageData;
        }
    }

    private static byte[] toJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new IOException("没有可用的JPEG写入器");
        }

        ImageWriter writer = writers.next();
        ImageWriteParam writeParam = writer.getDefaultWriteParam();
        writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        writeParam.setCompressionQuality(JPEG_QUALITY);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), writeParam);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
