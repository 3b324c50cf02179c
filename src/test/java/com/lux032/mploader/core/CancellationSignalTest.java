package com.lux032.mploader.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationSignalTest {

    @Test
    public void testTransitionRunsOnlyBeforeCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicBoolean ran = new AtomicBoolean();

        Assertions.assertTrue(signal.runUnlessCancelled(() -> ran.set(true)));
        Assertions.assertTrue(ran.get());

        signal.cancel();
        ran.set(false);

        Assertions.assertTrue(signal.isCancelled());
        Assertions.assertFalse(signal.runUnlessCancelled(() -> ran.set(true)));
        Assertions.assertFalse(ran.get());
    }

    @Test
    public void testCancelWaitsForTransitionInProgress() throws InterruptedException {
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread worker = new Thread(() -> signal.runUnlessCancelled(() -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        worker.start();
        Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread canceller = new Thread(signal::cancel);
        canceller.start();
        canceller.join(200);

        // 状态转换还没结束, cancel() 被阻塞
        Assertions.assertTrue(canceller.isAlive());
        Assertions.assertFalse(signal.isCancelled());

        release.countDown();
        canceller.join(5000);
        worker.join(5000);

        Assertions.assertFalse(canceller.isAlive());
        Assertions.assertTrue(signal.isCancelled());
    }

    @Test
    public void testCancelIsIdempotent() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        signal.cancel();

        Assertions.assertTrue(signal.isCancelled());
    }
}
