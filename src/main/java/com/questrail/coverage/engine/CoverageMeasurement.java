package com.questrail.coverage.engine;

import com.questrail.coverage.internal.time.Cancellable;
import com.questrail.coverage.internal.time.MonotonicClock;
import com.questrail.coverage.internal.time.MonotonicScheduler;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.LocationSample;
import com.questrail.coverage.model.NetworkTypeSample;
import com.questrail.coverage.model.PingOutcome;
import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.CoverageObservabilitySink;
import com.questrail.coverage.observability.MeasurementLifecycleEvent;
import com.questrail.coverage.observability.NullCoverageObservabilitySink;
import com.questrail.coverage.ping.PingPacer;
import com.questrail.coverage.session.CoverageSessionController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * CoverageMeasurement
 * =============================================================================
 * One coverage measurement run, from {@link #start()} until the future returned
 * by {@link #stop()} completes.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Funnels location, network-type, ping and session events into a single
 *       {@link EventMerger} consumed by the {@link FenceSegmentationEngine}.</li>
 *   <li>Reacts to the {@link CoverageSessionController}: a new token becomes a
 *       {@link MeasurementEvent.SessionInitialized}, an expired sub-session
 *       reinitializes the ping pacer, an expired run stops everything.</li>
 *   <li>Holds the {@link KeepMeasuringToken} while running.</li>
 * </ul>
 *
 * <h2>Stopping</h2>
 * {@link #stop()} halts the pacer and the controller timers first, then queues a
 * {@link MeasurementEvent.StopRequested} behind any events already merged. The
 * engine closes the run when it reaches that event, so nothing produced before
 * the stop is lost. Stop may be triggered by the caller, by the total-duration
 * timer or by insufficient location accuracy; only the first trigger counts.
 *
 * <h2>Insufficient accuracy</h2>
 * When the timing policy sets an auto-stop interval, {@link #start()} arms a
 * one-shot timer for it. On expiry an {@link MeasurementEvent.AccuracyCheckDue}
 * is queued, so fixes merged before it are taken into account. The engine then
 * stops the run if none of them was accurate.
 *
 * <p>A run is single-use. Start a new instance for the next measurement.</p>
 */
public final class CoverageMeasurement implements CoverageSessionController.Listener {

    private static final Logger log = LoggerFactory.getLogger(CoverageMeasurement.class);

    private enum Phase { CREATED, RUNNING, STOPPING, STOPPED }

    private final FenceSegmentationEngine engine;
    private final CoverageSessionController controller;
    private final PingPacer pacer;
    private final KeepMeasuringToken keepMeasuringToken;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final CoverageObservabilitySink observabilitySink;
    private final EventMerger merger;

    private final Object lock = new Object();
    private Phase phase = Phase.CREATED;
    private Cancellable accuracyCheck;
    private final CompletableFuture<List<Fence>> result = new CompletableFuture<>();

    /**
     * @param pacerFactory builds the pacer that reports into the given outcome
     *                     consumer
     */
    public CoverageMeasurement(FenceSegmentationEngine engine,
                               CoverageSessionController controller,
                               Function<Consumer<PingOutcome>, PingPacer> pacerFactory,
                               KeepMeasuringToken keepMeasuringToken,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               WallClock wallClock,
                               CoverageObservabilitySink observabilitySink) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.keepMeasuringToken = Objects.requireNonNull(keepMeasuringToken, "keepMeasuringToken");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullCoverageObservabilitySink.INSTANCE);
        this.pacer = Objects.requireNonNull(pacerFactory, "pacerFactory").apply(this::onPingOutcome);
        this.merger = new EventMerger(this::dispatch, wallClock, this.observabilitySink);

        controller.setListener(this);
        engine.setInsufficientAccuracyHandler(this::stop);
    }

    /**
     * @throws IllegalStateException if this run was started before
     */
    public void start() {
        Instant now;
        synchronized (lock) {
            if (phase != Phase.CREATED) {
                throw new IllegalStateException("Coverage measurement already " + phase.name().toLowerCase());
            }
            phase = Phase.RUNNING;
            now = wallClock.now();
        }

        keepMeasuringToken.acquire();
        engine.begin(now);
        merger.start();
        controller.start();
        pacer.start();
        armAccuracyCheck();

        observabilitySink.onMeasurementLifecycle(
                new MeasurementLifecycleEvent(now, MeasurementLifecycleEvent.Phase.STARTED, 0));
    }

    /**
     * Requests the end of the run. Idempotent; every call returns the same
     * future, which completes with the run's fences once all earlier events
     * have been processed.
     */
    public CompletableFuture<List<Fence>> stop() {
        Instant now;
        synchronized (lock) {
            if (phase == Phase.CREATED) {
                phase = Phase.STOPPED;
                result.complete(List.of());
                return result;
            }
            if (phase != Phase.RUNNING) {
                return result;
            }
            phase = Phase.STOPPING;
            now = wallClock.now();
        }

        log.info("Stopping coverage measurement");
        cancelAccuracyCheck();
        pacer.stop();
        controller.stop();
        merger.submit(new MeasurementEvent.StopRequested(now));
        return result;
    }

    public void onLocation(LocationSample sample) {
        Objects.requireNonNull(sample, "sample");
        if (isLocationReportingAllowed()) {
            merger.submit(new MeasurementEvent.LocationUpdate(sample));
        }
    }

    public void onNetworkType(NetworkTypeSample sample) {
        Objects.requireNonNull(sample, "sample");
        if (isLocationReportingAllowed()) {
            merger.submit(new MeasurementEvent.NetworkTypeUpdate(sample));
        }
    }

    /**
     * {@code true} between {@link #start()} and the first stop trigger.
     */
    public boolean isLocationReportingAllowed() {
        synchronized (lock) {
            return phase == Phase.RUNNING;
        }
    }

    public boolean isFinished() {
        synchronized (lock) {
            return phase == Phase.STOPPED;
        }
    }

    public List<Fence> fences() {
        return engine.fences();
    }

    public PingPacer pacer() {
        return pacer;
    }

    // -------------------------------------------------------------------------
    // CoverageSessionController.Listener
    // -------------------------------------------------------------------------

    @Override
    public void onSubSessionInitialized(ActiveSubSession subSession, String loopUuid) {
        merger.submit(new MeasurementEvent.SessionInitialized(subSession.anchor(), subSession.testUuid(), loopUuid));
    }

    @Override
    public void onReinitializationDue() {
        pacer.requestReinitialization();
    }

    @Override
    public void onMaximumDurationReached() {
        stop();
    }

    // -------------------------------------------------------------------------
    // Event loop
    // -------------------------------------------------------------------------

    private void armAccuracyCheck() {
        Duration interval = engine.timingPolicy().insufficientAccuracyAutoStop();
        if (interval == null) {
            return;
        }
        Cancellable handle = scheduler.scheduleAfter(interval, clock,
                () -> merger.submit(new MeasurementEvent.AccuracyCheckDue(wallClock.now())));
        synchronized (lock) {
            if (phase == Phase.RUNNING) {
                accuracyCheck = handle;
                return;
            }
        }
        handle.cancel();
    }

    private void cancelAccuracyCheck() {
        Cancellable handle;
        synchronized (lock) {
            handle = accuracyCheck;
            accuracyCheck = null;
        }
        if (handle != null) {
            handle.cancel();
        }
    }

    private void onPingOutcome(PingOutcome outcome) {
        merger.submit(new MeasurementEvent.PingUpdate(outcome));
    }

    private void dispatch(MeasurementEvent event) {
        if (event instanceof MeasurementEvent.StopRequested stop) {
            finish(stop.timestamp());
        }
        else {
            engine.handle(event);
        }
    }

    private void finish(Instant at) {
        boolean hadSession = engine.activeSessionUuid().isPresent();
        List<Fence> fences;
        try {
            fences = engine.finish(at);
        } catch (RuntimeException e) {
            observabilitySink.onError(new CoverageErrorEvent(at, "Could not finish coverage measurement", e));
            fences = engine.fences();
        }

        synchronized (lock) {
            phase = Phase.STOPPED;
        }
        cancelAccuracyCheck();
        merger.stop();
        keepMeasuringToken.release();

        observabilitySink.onMeasurementLifecycle(new MeasurementLifecycleEvent(
                at,
                hadSession ? MeasurementLifecycleEvent.Phase.STOPPED : MeasurementLifecycleEvent.Phase.DISCARDED,
                fences.size()));
        result.complete(fences);
    }
}
