package com.policyqa.infra;

import java.time.Duration;

/**
 * Wall-clock allowance for one query, measured on the monotonic clock.
 */
public final class TimeBudget {

    private final long startNanos;
    private final long deadlineNanos;

    private TimeBudget(long startNanos, Duration total) {
        this.startNanos = startNanos;
        this.deadlineNanos = startNanos + total.toNanos();
    }

    public static TimeBudget start(Duration total) {
        return new TimeBudget(System.nanoTime(), total);
    }

    public long remainingMs() {
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public boolean isExhausted() {
        return System.nanoTime() >= deadlineNanos;
    }
}
