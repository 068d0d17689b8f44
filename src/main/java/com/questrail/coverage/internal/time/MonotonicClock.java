package com.questrail.coverage.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for elapsed-time measurements.
 *
 * <h2>Binding invariant</h2>
 * Ping round-trip durations, reply timeouts and lifecycle timers are measured
 * against this clock. Wall-clock instants ({@link WallClock}) are used only for
 * the timestamps that travel with samples and fences.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only the
     * difference between two readings is meaningful.
     */
    long nowNanos();
}
