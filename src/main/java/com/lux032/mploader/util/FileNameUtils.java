package com.lux032.mploader.util;

import com.lux032.mploader.model.MatchCandidate;

import java.util.Locale;

/**
 * 文件名工具类
 */
public final class FileNameUtils {

    public static final String MP3_EXTENSION = ".mp3";
    private static final String UNKNOWN = "Unknown";
    // 常见文件系统的文件名上限(UTF-8 字节数)
    static final int MAX_NAME_BYTES = 255;

    private FileNameUtils() {
    }

    /**
     * 根据匹配结果生成目标文件名: "标题 - 艺术家.mp3"
     * 相同的标题和艺术家总是得到相同的文件名
     */
    public static String destinationFileName(MatchCandidate candidate, int maxLength) {
        String title = sanitizeFileName(candidate.getTitle());
        String artist = sanitizeFileName(candidate.getArtist());
        if (title.isEmpty()) {
            title = UNKNOWN;
        }
        if (artist.isEmpty()) {
            artist = UNKNOWN;
        }

        String stem = title + " - " + artist;
        String truncated = truncate(stem, maxLength, MAX_NAME_BYTES - MP3_EXTENSION.length());
        if (truncated.length() < stem.length()) {
            stem = trimTrailing(truncated);
        }
        return stem + MP3_EXTENSION;
    }

    /**
     * 按码点截断, 不拆分代理对; 同时限制 UTF-8 字节数
     * @param maxCodePoints 最大字符数, 不大于 0 时不限制
     */
    static String truncate(String value, int maxCodePoints, int maxBytes) {
        StringBuilder result = new StringBuilder(value.length());
        int count = 0;
        int bytes = 0;
        int i = 0;
        while (i < value.length()) {
            int codePoint = value.codePointAt(i);
            int size = utf8Length(codePoint);
            if ((maxCodePoints > 0 && count >= maxCodePoints) || bytes + size > maxBytes) {
                break;
            }
            result.appendCodePoint(codePoint);
            count++;
            bytes += size;
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }

    /**
     * 清理文件名中的非法字符
     */
    public static String sanitizeFileName(String fileName) {
        if (fileName == null) {
            return "";
        }

        // 替换 Windows 文件名中的非法字符和控制字符
        String cleaned = fileName
            .replaceAll("[\\\\/:*?\"<>|]", "")
            .replaceAll("\\p{Cntrl}", "")
            .replaceAll("\\s+", " ")
            .trim();
        return trimTrailing(cleaned);
    }

    /**
     * 用于比较的文件名键, 忽略大小写
     */
    public static String comparisonKey(String fileName) {
        return fileName.toLowerCase(Locale.ROOT);
    }

    // Windows 不允许文件名以点或空格结尾
    private static String trimTrailing(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == '.' || value.charAt(end - 1) == ' ')) {
            end--;
        }
        return value.substring(0, end);
    }
}
