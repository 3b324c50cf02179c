package com.lux032.mploader.exception;

import com.lux032.mploader.model.ErrorKind;

/**
 * 音频转码失败(输入不支持或缺少转码工具)
 */
public class TranscodeException extends PipelineException {

    public TranscodeException(String message) {
        super(ErrorKind.TRANSCODE_ERROR, message);
    }

    public TranscodeException(String message, Throwable cause) {
        super(ErrorKind.TRANSCODE_ERROR, message, cause);
    }
}
