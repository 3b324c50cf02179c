package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 下载流程中的类型化失败
 */
public class PipelineException extends Exception {

    private final ErrorKind errorKind;

    public PipelineException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public PipelineException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
