package com.questrail.coverage.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler for ping timeouts, pacer ticks and session lifecycle timers.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds obtained from a
 * {@link MonotonicClock}, never as wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after a relative delay measured on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
