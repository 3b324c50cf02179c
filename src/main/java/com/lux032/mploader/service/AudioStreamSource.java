package com.lux032.mploader.service;

import com.lux032.mploader.exception.StreamUnavailableException;
import com.lux032.mploader.model.MatchCandidate;

import java.nio.file.Path;

/**
 * 获取匹配曲目的最佳质量音频流
 */
public interface AudioStreamSource {

    /**
     * 将音频流完整写入 target
     */
    void fetchStream(MatchCandidate candidate, Path target) throws StreamUnavailableException;
}
