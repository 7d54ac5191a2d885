package com.postq.internal;

import java.util.concurrent.TimeUnit;

/**
 * Spaces consecutive sends of this process at least {@code minDelayMs} apart,
 * regardless of which delivery thread performs them.
 */
final class SendThrottle {

    private final long minDelayNanos;
    private long nextSlotNanos = Long.MIN_VALUE;

    SendThrottle(long minDelayMs) {
        this.minDelayNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minDelayMs));
    }

    void acquire() throws InterruptedException {
        if (minDelayNanos == 0) {
            return;
        }
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = nextSlotNanos == Long.MIN_VALUE ? now : Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + minDelayNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }
}
