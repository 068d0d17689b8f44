package com.questrail.coverage.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task registered with a {@link MonotonicScheduler}.
 *
 * <p>Ping timeouts, the pacer cadence and the session lifecycle timers all hold
 * one of these so a stopped measurement can withdraw work it no longer wants.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
