package com.questrail.coverage.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time checks of the production scheduler. Timeouts are generous so a
 * loaded build machine does not fail them.
 */
class ScheduledExecutorSchedulerTest {

    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void pingTimeoutFiresAfterItsDeadline() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        long scheduledAt = clock.nowNanos();
        long[] firedAt = new long[1];

        scheduler.scheduleAtNanos(scheduledAt + TimeUnit.MILLISECONDS.toNanos(50), () -> {
            firedAt[0] = clock.nowNanos();
            fired.countDown();
        });

        assertTrue(fired.await(1, TimeUnit.SECONDS));
        assertTrue(firedAt[0] - scheduledAt >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void overdueDeadlineRunsWithoutDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(5), fired::countDown);

        assertTrue(fired.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTickNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();

        Cancellable tick = scheduler.scheduleAtNanos(
                clock.nowNanos() + TimeUnit.MILLISECONDS.toNanos(100), () -> ran.set(true));

        assertTrue(tick.cancel());
        assertFalse(tick.cancel());
        Thread.sleep(200);
        assertFalse(ran.get());
    }

    @Test
    void cancellingAfterExecutionReportsFalse() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(clock.nowNanos(), fired::countDown);

        assertTrue(fired.await(200, TimeUnit.MILLISECONDS));
        assertFalse(handle.cancel());
    }

    @Test
    void deadlinesDecideExecutionOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);
        long now = clock.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> { order.add("sub-session"); done.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> { order.add("timeout"); done.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> { order.add("tick"); done.countDown(); });

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("tick", "timeout", "sub-session"), order);
    }
}
