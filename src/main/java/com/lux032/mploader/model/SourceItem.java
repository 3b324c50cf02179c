package com.lux032.mploader.model;

import lombok.Data;

/**
 * 播放列表中的一个条目(或单个视频)
 */
@Data
public class SourceItem {
    private final String rawTitle;
    private final String uploader;
    private final String sourceId;
    private final int sequenceIndex; // 在播放列表中的位置, 从 1 开始
    private final String sourceUrl;
    private final Integer durationSeconds; // 可能为 null

    public SourceItem(String rawTitle, String uploader, String sourceId, int sequenceIndex) {
        this(rawTitle, uploader, sourceId, sequenceIndex, null, null);
    }

    public SourceItem(String rawTitle, String uploader, String sourceId, int sequenceIndex,
                      String sourceUrl, Integer durationSeconds) {
        this.rawTitle = rawTitle == null ? "" : rawTitle;
        this.uploader = uploader == null ? "" : uploader;
        this.sourceId = sourceId;
        this.sequenceIndex = sequenceIndex;
        this.sourceUrl = sourceUrl;
        this.durationSeconds = durationSeconds;
    }
}
