package com.lux032.mploader.service;

import com.lux032.mploader.exception.TranscodeException;

import java.nio.file.Path;

/**
 * 音频转码, 输出固定码率的 MP3
 */
public interface AudioTranscoder {

    /**
     * @return 转码后的本地文件(即 target)
     */
    Path transcode(Path source, Path target, int targetBitrateKbps) throws TranscodeException;
}
