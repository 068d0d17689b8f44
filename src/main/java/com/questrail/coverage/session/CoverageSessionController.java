package com.questrail.coverage.session;

import com.questrail.coverage.config.CoverageTimingPolicy;
import com.questrail.coverage.controlserver.ControlServerApi;
import com.questrail.coverage.controlserver.ControlServerException;
import com.questrail.coverage.controlserver.CoverageSessionRequest;
import com.questrail.coverage.internal.time.Cancellable;
import com.questrail.coverage.internal.time.MonotonicClock;
import com.questrail.coverage.internal.time.MonotonicScheduler;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.SessionToken;
import com.questrail.coverage.observability.CoverageObservabilitySink;
import com.questrail.coverage.observability.NullCoverageObservabilitySink;
import com.questrail.coverage.observability.SubSessionStartedEvent;
import com.questrail.coverage.ping.PingSessionInitiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * CoverageSessionController
 * =============================================================================
 * Owns the control-plane token of a measurement run and its two timers.
 *
 * <h2>Tokens</h2>
 * Each {@link #requestToken()} posts a {@code coverageRequest} whose
 * {@code loop_uuid} is the previous sub-session's {@code test_uuid}, so the server
 * can chain sub-sessions. The instant a token is confirmed becomes the
 * sub-session's anchor and is announced through
 * {@link Listener#onSubSessionInitialized}.
 *
 * <h2>Timers</h2>
 * <ul>
 *   <li>per sub-session ({@code max_coverage_measurement_seconds}): re-armed with
 *       every token; on expiry {@link Listener#onReinitializationDue()} asks for a
 *       transparent switch to a new token.</li>
 *   <li>total ({@code max_coverage_session_seconds}): measured from
 *       {@link #start()}; on expiry {@link Listener#onMaximumDurationReached()}
 *       stops the run.</li>
 * </ul>
 * Limits the server does not announce fall back to {@link CoverageTimingPolicy}.
 *
 * <h2>Offline start</h2>
 * A failed request completes the future exceptionally and changes nothing; the
 * ping pacer asks again on its next tick.
 */
public final class CoverageSessionController implements PingSessionInitiator {

    private static final Logger log = LoggerFactory.getLogger(CoverageSessionController.class);

    /**
     * Receives lifecycle decisions of the controller.
     */
    public interface Listener {
        void onSubSessionInitialized(ActiveSubSession subSession, String loopUuid);

        void onReinitializationDue();

        void onMaximumDurationReached();
    }

    private final ControlServerApi api;
    private final Executor executor;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final CoverageTimingPolicy timingPolicy;
    private final CoverageObservabilitySink observabilitySink;

    private volatile Listener listener;

    // Guarded by this.
    private boolean running;
    private long startNanos;
    private String lastTestUuid;
    private ActiveSubSession active;
    private int subSessionCount;
    private Cancellable subSessionTimer;
    private Cancellable totalTimer;

    /**
     * @param executor runs the blocking control-plane calls
     */
    public CoverageSessionController(ControlServerApi api,
                                     Executor executor,
                                     MonotonicClock clock,
                                     MonotonicScheduler scheduler,
                                     WallClock wallClock,
                                     CoverageTimingPolicy timingPolicy,
                                     CoverageObservabilitySink observabilitySink) {
        this.api = Objects.requireNonNull(api, "api");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullCoverageObservabilitySink.INSTANCE);
    }

    /**
     * Must be called before {@link #start()}.
     */
    public void setListener(Listener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Begins a run: forgets the previous run's tokens and arms the total-duration
     * timer with the default limit.
     */
    public synchronized void start() {
        if (listener == null) {
            throw new IllegalStateException("Listener must be set before start()");
        }
        running = true;
        startNanos = clock.nowNanos();
        lastTestUuid = null;
        active = null;
        subSessionCount = 0;
        cancelTimers();
        totalTimer = scheduler.scheduleAtNanos(
                startNanos + timingPolicy.defaultMaxTotalDuration().toNanos(), this::totalDurationExpired);
    }

    /**
     * Cancels both timers. The last sub-session stays readable through
     * {@link #activeSubSession()} so the run's fences can still be submitted.
     */
    public synchronized void stop() {
        running = false;
        cancelTimers();
    }

    @Override
    public CompletableFuture<SessionToken> requestToken() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return obtainToken();
            } catch (ControlServerException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    public synchronized Optional<ActiveSubSession> activeSubSession() {
        return Optional.ofNullable(active);
    }

    public synchronized Optional<String> lastTestUuid() {
        return Optional.ofNullable(lastTestUuid);
    }

    public synchronized int subSessionCount() {
        return subSessionCount;
    }

    private SessionToken obtainToken() throws ControlServerException {
        String loopUuid;
        synchronized (this) {
            if (!running) {
                throw new ControlServerException("measurement is not running");
            }
            loopUuid = lastTestUuid;
        }

        CoverageSessionRequest request = CoverageSessionRequest.dedicated(wallClock.now().toEpochMilli(), loopUuid);
        SessionToken token = api.requestCoverageSession(request).toToken(loopUuid);

        Instant anchor = wallClock.now();
        ActiveSubSession subSession = new ActiveSubSession(token.testUuid(), anchor);
        int count;
        synchronized (this) {
            if (!running) {
                throw new ControlServerException("measurement stopped while requesting a session");
            }
            lastTestUuid = token.testUuid();
            active = subSession;
            count = ++subSessionCount;
            armTimers(token, count == 1);
        }

        observabilitySink.onSubSessionStarted(new SubSessionStartedEvent(anchor, token.testUuid(), loopUuid, count));
        listener.onSubSessionInitialized(subSession, loopUuid);
        return token;
    }

    private void armTimers(SessionToken token, boolean first) {
        if (subSessionTimer != null) {
            subSessionTimer.cancel();
        }
        Duration subSessionLimit = token.maxMeasurementDuration() != null
                ? token.maxMeasurementDuration()
                : timingPolicy.defaultMaxSubSessionDuration();
        subSessionTimer = scheduler.scheduleAfter(subSessionLimit, clock, this::subSessionExpired);

        if (first && token.maxSessionDuration() != null) {
            if (totalTimer != null) {
                totalTimer.cancel();
            }
            totalTimer = scheduler.scheduleAtNanos(
                    startNanos + token.maxSessionDuration().toNanos(), this::totalDurationExpired);
        }
    }

    private void subSessionExpired() {
        synchronized (this) {
            if (!running) {
                return;
            }
        }
        log.info("Sub-session {} reached its time limit, requesting a new one", lastTestUuid().orElse("?"));
        listener.onReinitializationDue();
    }

    private void totalDurationExpired() {
        synchronized (this) {
            if (!running) {
                return;
            }
        }
        log.info("Coverage measurement reached its maximum duration");
        listener.onMaximumDurationReached();
    }

    private void cancelTimers() {
        if (subSessionTimer != null) {
            subSessionTimer.cancel();
            subSessionTimer = null;
        }
        if (totalTimer != null) {
            totalTimer.cancel();
            totalTimer = null;
        }
    }
}
