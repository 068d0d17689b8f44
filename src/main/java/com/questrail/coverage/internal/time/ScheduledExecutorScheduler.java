package com.questrail.coverage.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Deadline conversion</h2>
 * <p>Absolute monotonic deadlines are turned into relative delays at the moment
 * of scheduling, using the same {@link MonotonicClock} the callers use to compute
 * them. Deadlines already in the past run immediately.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>The executor is owned by the caller (normally the composition root,
 * {@code CoverageProductionRuntime}) which is responsible for shutting it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
