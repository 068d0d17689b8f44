package com.questrail.coverage.internal.time;

/**
 * SystemMonotonicClock
 * =============================================================================
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>For deterministic tests use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
