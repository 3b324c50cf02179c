package com.lux032.mploader.model;

import lombok.Builder;
import lombok.Value;

/**
 * 音乐目录搜索结果
 * 外部接口返回的松散结构在接收时立即转换为此类
 */
@Value
@Builder(toBuilder = true)
public class MatchCandidate {
    String catalogId;
    String title;
    String artist;
    String album;
    Integer year;
    Integer durationSeconds;
    String artworkUrl;
    double qualityScore; // 目录报告的最高码率(kbps)

    // 标签及下载相关字段
    String albumArtist;
    String composer;
    String label;
    String language;
    String copyright;
    String pageUrl;
    String streamUrl;

    @Override
    public String toString() {
        return String.format("MatchCandidate{id='%s', title='%s', artist='%s', album='%s', quality=%.0f}",
            catalogId, title, artist, album, qualityScore);
    }
}
