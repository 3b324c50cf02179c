package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 音乐目录中没有可接受的匹配结果
 */
public class NoMatchException extends PipelineException {

    public NoMatchException(String message) {
        super(ErrorKind.NO_MATCH, message);
    }

    public NoMatchException(String message, Throwable cause) {
        super(ErrorKind.NO_MATCH, message, cause);
    }
}
