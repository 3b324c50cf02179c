package com.lux032.mploader.core;

import com.lux032.mploader.model.SourceItem;
import com.lux032.mploader.model.TaskState;
import com.lux032.mploader.model.TrackOutcome;

/**
 * 单个条目的下载任务状态
 * 状态由处理该条目的工作线程修改, 其他线程只读
 */
public class DownloadTask {

    private final SourceItem item;
    private volatile TaskState state = TaskState.QUEUED;
    private volatile TrackOutcome outcome;

    public DownloadTask(SourceItem item) {
        this.item = item;
    }

    public SourceItem getItem() {
        return item;
    }

    public TaskState getState() {
        return state;
    }

    public TrackOutcome getOutcome() {
        return outcome;
    }

    /**
     * 状态转换, 非法转换说明流程有错误
     */
    synchronized void transitionTo(TaskState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Illegal task transition %s -> %s for item #%d", state, next, item.getSequenceIndex()));
        }
        state = next;
    }

    /**
     * 写入最终结果并进入对应的终止状态, 只能执行一次
     */
    synchronized TrackOutcome finish(TaskState terminal, TrackOutcome result) {
        if (outcome != null) {
            throw new IllegalStateException("Outcome already recorded for item #" + item.getSequenceIndex());
        }
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        transitionTo(terminal);
        outcome = result.forItem(item);
        return outcome;
    }

    /**
     * 处理过程中出现意外异常时强制记为失败, 不校验状态转换
     * 已有结果时保持原结果
     */
    synchronized TrackOutcome abort(TrackOutcome failure) {
        if (outcome != null) {
            return outcome;
        }
        state = TaskState.FAILED;
        outcome = failure.forItem(item);
        return outcome;
    }
}
