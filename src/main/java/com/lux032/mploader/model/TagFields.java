package com.lux032.mploader.model;

import lombok.Builder;
import lombok.Value;

/**
 * 写入音频文件的标签字段
 */
@Value
@Builder
public class TagFields {
    String title;
    String artist;
    String album;
    Integer year;
    String albumArtist;
    String composer;
    String label;
    String genre;
    String copyright;
    Integer durationSeconds;
    String url;

    /**
     * 从匹配结果构建标签
     * 专辑艺术家缺失时回退到艺术家, 流派使用目录中的语言
     */
    public static TagFields from(MatchCandidate candidate) {
        String albumArtist = candidate.getAlbumArtist();
        if (albumArtist == null || albumArtist.isBlank()) {
            albumArtist = candidate.getArtist();
        }
        return TagFields.builder()
            .title(candidate.getTitle())
            .artist(candidate.getArtist())
            .album(candidate.getAlbum())
            .year(candidate.getYear())
            .albumArtist(albumArtist)
            .composer(candidate.getComposer())
            .label(candidate.getLabel())
            .genre(titleCase(candidate.getLanguage()))
            .copyright(candidate.getCopyright())
            .durationSeconds(candidate.getDurationSeconds())
            .url(candidate.getPageUrl())
            .build();
    }

    /**
     * 时长格式化为 m:ss
     */
    public String formattedDuration() {
        if (durationSeconds == null || durationSeconds <= 0) {
            return null;
        }
        return String.format("%d:%02d", durationSeconds / 60, durationSeconds % 60);
    }

    private static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return Character.toUpperCase(trimmed.charAt(0)) + trimmed.substring(1).toLowerCase();
    }
}
