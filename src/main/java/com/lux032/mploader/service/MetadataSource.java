package com.lux032.mploader.service;

import com.lux032.mploader.exception.SourceUnavailableException;
import com.lux032.mploader.model.SourceItem;

import java.util.List;

/**
 * 来源元数据提取
 * 单个视频和整个播放列表都展开为同一个有序条目列表
 */
public interface MetadataSource {

    /**
     * @param sourceUrl 视频或播放列表地址
     * @return 按播放列表顺序排列的条目
     * @throws SourceUnavailableException 地址完全无法解析时
     */
    List<SourceItem> resolveItems(String sourceUrl) throws SourceUnavailableException;
}
