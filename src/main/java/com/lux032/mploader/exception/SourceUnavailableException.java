package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 来源地址无法解析, 整个运行终止
 */
public class SourceUnavailableException extends PipelineException {

    public SourceUnavailableException(String message) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
