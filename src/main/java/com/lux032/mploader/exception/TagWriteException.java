package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 标签写入失败(文件损坏或字段不支持)
 */
public class TagWriteException extends PipelineException {

    public TagWriteException(String message) {
        super(ErrorKind.TAG_WRITE_ERROR, message);
    }

    public TagWriteException(String message, Throwable cause) {
        super(ErrorKind.TAG_WRITE_ERROR, message, cause);
    }
}
