package com.lux032.mploader.service;

import com.lux032.mploader.exception.TagWriteException;
import com.lux032.mploader.model.TagFields;

import java.nio.file.Path;

/**
 * 标签写入
 */
public interface TagWriter {

    /**
     * @param artwork 封面数据, 可以为 null
     */
    void writeTags(Path audioFile, TagFields fields, byte[] artwork) throws TagWriteException;
}
