package com.lux032.mploader.model;

/**
 * 单个下载任务的状态
 *
 * Queued -> Normalizing -> Matching -> SkipCheck -> Fetching -> {Completed | Failed | Skipped}
 * 任何非终止状态在收到取消信号后都可以进入 Cancelled,
 * 但 Fetching 中的任务会自然结束, 不会被中途取消
 */
public enum TaskState {
    QUEUED,
    NORMALIZING,
    MATCHING,
    SKIP_CHECK,
    FETCHING,
    COMPLETED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * 检查状态转换是否合法
     */
    public boolean canTransitionTo(TaskState next) {
        switch (this) {
            case QUEUED:
                return next == NORMALIZING || next == CANCELLED;
            case NORMALIZING:
                return next == MATCHING || next == CANCELLED;
            case MATCHING:
                return next == SKIP_CHECK || next == FAILED || next == CANCELLED;
            case SKIP_CHECK:
                return next == FETCHING || next == SKIPPED || next == CANCELLED;
            case FETCHING:
                return next == COMPLETED || next == FAILED || next == SKIPPED;
            default:
                return false;
        }
    }
}
