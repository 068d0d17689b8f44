package com.questrail.coverage.engine;

import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.CoverageObservabilitySink;
import com.questrail.coverage.observability.NullCoverageObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * EventMerger
 * =============================================================================
 * Fan-in of all measurement event producers into one sequential consumer.
 *
 * <h2>Threading model</h2>
 * Producers call {@link #submit} from any thread. A single event-loop thread
 * takes events from one FIFO queue and hands them to the consumer one at a
 * time, so the consumer never needs locking. Events of one producer keep their
 * submission order; the interleaving of different producers is whatever order
 * they reached the queue in.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   merger.start()       starts the event-loop thread
 *   merger.submit(...)   enqueues an event
 *   merger.stop()        stops the loop; callable from the loop itself
 * </pre>
 *
 * <h2>Failures</h2>
 * A consumer exception is reported to the observability sink and the loop
 * continues with the next event.
 */
public final class EventMerger {

    private final Consumer<MeasurementEvent> consumer;
    private final WallClock wallClock;
    private final CoverageObservabilitySink observabilitySink;

    private final BlockingQueue<MeasurementEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    public EventMerger(Consumer<MeasurementEvent> consumer,
                       WallClock wallClock,
                       CoverageObservabilitySink observabilitySink) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullCoverageObservabilitySink.INSTANCE);
    }

    /**
     * Starts the event loop thread. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            queue.clear();
            eventLoopThread = new Thread(this::runEventLoop, "coverage-event-merger");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop. Events still queued are discarded. When called from
     * another thread this blocks until the loop has terminated.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread loop = eventLoopThread;
            if (loop == null || loop == Thread.currentThread()) {
                return;
            }
            loop.interrupt();
            try {
                loop.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Enqueues an event. Ignored while the merger is not running.
     */
    public void submit(MeasurementEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            queue.offer(event);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                MeasurementEvent event = queue.take();
                if (running.get()) {
                    consumer.accept(event);
                }
            } catch (InterruptedException e) {
                // stop() interrupts a blocked take()
                if (!running.get()) {
                    break;
                }
            } catch (RuntimeException e) {
                observabilitySink.onError(new CoverageErrorEvent(
                        wallClock.now(),
                        "Measurement event processing error",
                        e));
            }
        }
    }
}
