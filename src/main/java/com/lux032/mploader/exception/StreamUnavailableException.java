package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 无法获取音频流
 */
public class StreamUnavailableException extends PipelineException {

    public StreamUnavailableException(String message) {
        super(ErrorKind.STREAM_UNAVAILABLE, message);
    }

    public StreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STREAM_UNAVAILABLE, message, cause);
    }
}
