package com.questrail.coverage.engine;

import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.RecordingCoverageObservabilitySink;
import com.questrail.coverage.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventMergerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ManualMonotonicClock clock = new ManualMonotonicClock(T0);
    private EventMerger merger;

    @AfterEach
    void tearDown() {
        if (merger != null) {
            merger.stop();
        }
    }

    @Test
    void eventsFromOneProducerKeepTheirOrder() throws InterruptedException {
        List<MeasurementEvent> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(100);
        merger = new EventMerger(e -> {
            seen.add(e);
            done.countDown();
        }, clock, null);
        merger.start();

        for (int i = 0; i < 100; i++) {
            merger.submit(new MeasurementEvent.StopRequested(T0.plusMillis(i)));
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < 100; i++) {
            assertEquals(T0.plusMillis(i), seen.get(i).timestamp());
        }
    }

    @Test
    void allProducersAreConsumedOnOneThread() throws InterruptedException {
        List<String> threads = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(40);
        merger = new EventMerger(e -> {
            threads.add(Thread.currentThread().getName());
            done.countDown();
        }, clock, null);
        merger.start();

        Thread[] producers = new Thread[4];
        for (int p = 0; p < producers.length; p++) {
            producers[p] = new Thread(() -> {
                for (int i = 0; i < 10; i++) {
                    merger.submit(new MeasurementEvent.StopRequested(T0));
                }
            });
            producers[p].start();
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(threads.stream().allMatch("coverage-event-merger"::equals));
    }

    @Test
    void consumerFailureIsReportedAndLoopContinues() throws InterruptedException {
        RecordingCoverageObservabilitySink sink = new RecordingCoverageObservabilitySink();
        CountDownLatch second = new CountDownLatch(1);
        merger = new EventMerger(e -> {
            if (e.timestamp().equals(T0)) {
                throw new IllegalStateException("boom");
            }
            second.countDown();
        }, clock, sink);
        clock.advanceMillis(5000);
        merger.start();

        merger.submit(new MeasurementEvent.StopRequested(T0));
        merger.submit(new MeasurementEvent.StopRequested(T0.plusSeconds(1)));

        assertTrue(second.await(2, TimeUnit.SECONDS));
        List<CoverageErrorEvent> errors = sink.eventsOfType(CoverageErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals(T0.plusSeconds(5), errors.get(0).timestamp());
    }

    @Test
    void submitBeforeStartOrAfterStopIsIgnored() throws InterruptedException {
        List<MeasurementEvent> seen = new CopyOnWriteArrayList<>();
        merger = new EventMerger(seen::add, clock, null);

        merger.submit(new MeasurementEvent.StopRequested(T0));
        merger.start();
        merger.stop();
        merger.submit(new MeasurementEvent.StopRequested(T0));

        assertFalse(merger.isRunning());
        assertTrue(seen.isEmpty());
    }

    @Test
    void stopFromTheLoopThreadDoesNotDeadlock() throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        merger = new EventMerger(e -> {
            merger.stop();
            stopped.countDown();
        }, clock, null);
        merger.start();

        merger.submit(new MeasurementEvent.StopRequested(T0));

        assertTrue(stopped.await(2, TimeUnit.SECONDS));
        assertFalse(merger.isRunning());
    }
}
