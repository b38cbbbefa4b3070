package com.jolly.ai;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Pacer that really waits. {@link #cancel()} releases the current wait and turns
 * every later one into a no-op, so a controller can skip the rest of an AI turn's pauses.
 */
public class SleepingPacer implements Pacer {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public void await(Duration delay) {
        if (delay.isZero() || delay.isNegative() || isCancelled()) {
            return;
        }
        try {
            cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            // Hand the interrupt back to the owner of the thread
            Thread.currentThread().interrupt();
        }
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}
