package com.lux032.mploader.model;

/**
 * 失败类型
 */
public enum ErrorKind {
    /** 无法解析来源地址, 整个运行终止 */
    SOURCE_UNAVAILABLE,
    NO_MATCH,
    STREAM_UNAVAILABLE,
    TRANSCODE_ERROR,
    TAG_WRITE_ERROR,
    IO_ERROR,
    INTERNAL_ERROR
}
