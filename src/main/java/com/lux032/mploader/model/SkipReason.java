package com.lux032.mploader.model;

/**
 * 跳过原因
 */
public enum SkipReason {
    /** 目标文件在运行开始时已存在, 或本次运行中已完成 */
    DESTINATION_ALREADY_EXISTS,
    /** 本次运行中另一个任务已占用同一目标路径 */
    CLAIMED_BY_SIBLING
}
