package com.questrail.coverage.ping;

import com.questrail.coverage.internal.time.Cancellable;
import com.questrail.coverage.internal.time.MonotonicClock;
import com.questrail.coverage.internal.time.MonotonicScheduler;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.PingFailure;
import com.questrail.coverage.model.PingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PingPacer
 * =============================================================================
 * Emits one ping attempt per fixed interval and turns each attempt into a
 * timestamped {@link PingOutcome}.
 *
 * <h2>States</h2>
 * <pre>
 *   NeedsInitiation --tick--> InProgress --session opened--> Ready(session)
 *         ^                        |                             |
 *         +----initiation failed---+                             |
 *         +----RE01 / failure threshold / lifecycle request------+
 * </pre>
 *
 * <h2>Tick behavior</h2>
 * <ul>
 *   <li>{@code NeedsInitiation}: start initiating; once the session is open the
 *       tick's ping is sent on it. A failed initiation yields an error outcome.</li>
 *   <li>{@code InProgress}: emit an error outcome immediately so the cadence is
 *       never held up by the control plane.</li>
 *   <li>{@code Ready}: send one ping. Earlier pings may still be outstanding.</li>
 * </ul>
 *
 * <h2>Cadence</h2>
 * The first tick runs on {@link #start()}; tick {@code n} is scheduled at
 * {@code start + n * interval} on the monotonic scheduler, so slow replies never
 * shift later ticks.
 *
 * <h2>Reinitialization</h2>
 * The session is dropped on an {@code RE01} reply, after
 * {@code failureThreshold} consecutive failed pings (0 disables the threshold),
 * or on {@link #requestReinitialization()}.
 */
public final class PingPacer {

    private static final Logger log = LoggerFactory.getLogger(PingPacer.class);

    /**
     * Pacer state.
     */
    public sealed interface State {
        record NeedsInitiation() implements State {}
        record InProgress() implements State {}
        record Ready(PingSessionHandle session) implements State {}
    }

    private static final State NEEDS_INITIATION = new State.NeedsInitiation();
    private static final State IN_PROGRESS = new State.InProgress();

    private final PingSessionProtocol protocol;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final Duration interval;
    private final int failureThreshold;
    private final Consumer<PingOutcome> sink;

    private final Object lock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private State state = NEEDS_INITIATION;
    private int consecutiveFailures;
    private long firstTickNanos;
    private long ticksScheduled;
    private volatile Cancellable nextTick;

    public PingPacer(PingSessionProtocol protocol,
                     MonotonicClock clock,
                     MonotonicScheduler scheduler,
                     WallClock wallClock,
                     Duration interval,
                     int failureThreshold,
                     Consumer<PingOutcome> sink) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (failureThreshold < 0) {
            throw new IllegalArgumentException("failureThreshold must be >= 0");
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Runs the first tick immediately and starts the fixed-rate cadence.
     * Idempotent while running.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            synchronized (lock) {
                state = NEEDS_INITIATION;
                consecutiveFailures = 0;
                firstTickNanos = clock.nowNanos();
                ticksScheduled = 0;
            }
            tick();
        }
    }

    /**
     * Stops the cadence and closes the ping session. Outcomes of pings still in
     * flight are no longer emitted.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable t = nextTick;
            if (t != null) {
                t.cancel();
            }
            protocol.close();
        }
    }

    /**
     * Drops the current session so the next tick initiates a new one. Has no
     * effect while no session is established.
     */
    public void requestReinitialization() {
        synchronized (lock) {
            if (state instanceof State.Ready) {
                log.info("Ping session reinitialization requested");
                state = NEEDS_INITIATION;
                consecutiveFailures = 0;
            }
        }
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        scheduleNextTick();

        Instant sentAt = wallClock.now();
        State current;
        synchronized (lock) {
            current = state;
            if (current instanceof State.NeedsInitiation) {
                state = IN_PROGRESS;
            }
        }

        try {
            if (current instanceof State.Ready ready) {
                ping(ready.session(), sentAt);
            }
            else if (current instanceof State.NeedsInitiation) {
                initiate(sentAt);
            }
            else {
                emit(PingOutcome.error(sentAt, PingFailure.SESSION_NOT_READY));
            }
        } catch (RuntimeException e) {
            log.error("Ping tick failed", e);
            emit(PingOutcome.error(sentAt, PingFailure.NETWORK_ISSUE));
        }
    }

    private void scheduleNextTick() {
        long deadline;
        synchronized (lock) {
            ticksScheduled++;
            deadline = firstTickNanos + ticksScheduled * interval.toNanos();
        }
        nextTick = scheduler.scheduleAtNanos(deadline, this::tick);
    }

    private void initiate(Instant sentAt) {
        protocol.initiateSession().whenComplete((session, error) -> {
            if (error != null) {
                synchronized (lock) {
                    if (state instanceof State.InProgress) {
                        state = NEEDS_INITIATION;
                    }
                }
                log.warn("Ping session initiation failed: {}", error.toString());
                emit(PingOutcome.error(sentAt, PingFailureException.reasonOf(error)));
                return;
            }

            if (!running.get()) {
                protocol.close();
                return;
            }
            synchronized (lock) {
                state = new State.Ready(session);
                consecutiveFailures = 0;
            }
            ping(session, sentAt);
        });
    }

    private void ping(PingSessionHandle session, Instant sentAt) {
        protocol.sendPing(session).whenComplete((roundTrip, error) -> {
            if (error == null) {
                synchronized (lock) {
                    consecutiveFailures = 0;
                }
                emit(PingOutcome.success(sentAt, roundTrip));
                return;
            }

            PingFailure reason = PingFailureException.reasonOf(error);
            onPingFailure(session, reason);
            emit(PingOutcome.error(sentAt, reason));
        });
    }

    private void onPingFailure(PingSessionHandle session, PingFailure reason) {
        synchronized (lock) {
            if (!(state instanceof State.Ready ready) || !ready.session().equals(session)) {
                return;
            }
            if (reason == PingFailure.NEEDS_REINITIALIZATION) {
                state = NEEDS_INITIATION;
                consecutiveFailures = 0;
                return;
            }
            consecutiveFailures++;
            if (failureThreshold > 0 && consecutiveFailures >= failureThreshold) {
                log.info("{} consecutive ping failures, reinitializing session", consecutiveFailures);
                state = NEEDS_INITIATION;
                consecutiveFailures = 0;
            }
        }
    }

    private void emit(PingOutcome outcome) {
        if (!running.get()) {
            return;
        }
        try {
            sink.accept(outcome);
        } catch (RuntimeException e) {
            log.error("Ping outcome sink failed", e);
        }
    }
}
