package com.lux032.mploader.core;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 取消信号
 * 在任务出队、匹配之后以及进入下载之前检查
 * 进入下载与 cancel() 互斥: cancel() 返回后不会再有任务开始下载
 */
@Slf4j
public class CancellationSignal {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean cancelled;

    public void cancel() {
        lock.writeLock().lock();
        try {
            if (!cancelled) {
                cancelled = true;
                log.debug("取消信号已发出");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 未取消时执行状态转换
     * @return 已取消时返回 false, 转换不会执行
     */
    public boolean runUnlessCancelled(Runnable transition) {
        lock.readLock().lock();
        try {
            if (cancelled) {
                return false;
            }
            transition.run();
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }
}
