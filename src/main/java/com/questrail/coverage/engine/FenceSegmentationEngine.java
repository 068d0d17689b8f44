package com.questrail.coverage.engine;

import com.questrail.coverage.config.CoverageTimingPolicy;
import com.questrail.coverage.controlserver.CoverageSubmissionException;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.InaccurateLocationWindow;
import com.questrail.coverage.model.LocationSample;
import com.questrail.coverage.model.NetworkType;
import com.questrail.coverage.model.PingOutcome;
import com.questrail.coverage.model.RadioTechnology;
import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.CoverageObservabilitySink;
import com.questrail.coverage.observability.FenceClosedEvent;
import com.questrail.coverage.observability.NullCoverageObservabilitySink;
import com.questrail.coverage.persistence.FencePersistenceService;
import com.questrail.coverage.persistence.SendCoverageResultsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * FenceSegmentationEngine
 * =============================================================================
 * Turns the merged measurement event stream into fences.
 *
 * <h2>Threading model</h2>
 * All methods except {@link #fences()} and the setters must be called from one
 * thread, normally the {@link EventMerger} loop. Fence state is owned by that
 * thread; readers get immutable snapshots through {@link #fences()} or the
 * fence observer.
 *
 * <h2>Locations</h2>
 * A fix worse than the accuracy threshold opens (or extends) an
 * {@link InaccurateLocationWindow} and is otherwise ignored. An accurate fix
 * closes the open window. While the last known network type is Wi-Fi it
 * changes no fence. Otherwise it opens the first fence, starts a new fence
 * when it lies at least one fence radius from the open fence's starting
 * location, or is appended to the open fence together with the current radio
 * technology.
 *
 * <h2>Insufficient accuracy</h2>
 * The run owner submits {@link MeasurementEvent.AccuracyCheckDue} once the
 * auto-stop interval has passed since the start of the run. If no accurate fix
 * was processed before it, the insufficient-accuracy handler runs.
 *
 * <h2>Pings</h2>
 * Dropped while the last known network type is Wi-Fi and when their timestamp
 * falls inside an inaccurate window. Otherwise attributed to the most recent
 * fence whose {@code [dateEntered, dateExited)} covers the timestamp, which
 * tolerates pings that arrive after the location update that closed their fence.
 *
 * <h2>Sub-sessions</h2>
 * Fences without a session, and the open fence, adopt each newly initialized
 * sub-session. Closed fences keep the sub-session they were closed under.
 *
 * <h2>Side effects</h2>
 * No store writes happen before the first sub-session token. Persistence and
 * submission run on the background executor in call order.
 * Their failures are reported to the observability sink and never reach the
 * event loop.
 */
public final class FenceSegmentationEngine {

    private static final Logger log = LoggerFactory.getLogger(FenceSegmentationEngine.class);

    private final CoverageTimingPolicy timingPolicy;
    private final RadioTechnologyService radioTechnology;
    private final FencePersistenceService persistence;
    private final SendCoverageResultsService resultsService;
    private final Executor backgroundExecutor;
    private final WallClock wallClock;
    private final CoverageObservabilitySink observabilitySink;

    private final List<Fence> fences = new ArrayList<>();
    private final List<InaccurateLocationWindow> inaccurateWindows = new ArrayList<>();
    private NetworkType networkType;
    private String activeSessionUuid;
    private Instant activeAnchor;
    private boolean hasEverHadAccurateLocation;
    private Instant runStart;

    private volatile List<Fence> snapshot = List.of();
    private volatile Consumer<List<Fence>> fenceObserver = fences -> { };
    private volatile Runnable insufficientAccuracyHandler = () -> { };

    public FenceSegmentationEngine(CoverageTimingPolicy timingPolicy,
                                   RadioTechnologyService radioTechnology,
                                   FencePersistenceService persistence,
                                   SendCoverageResultsService resultsService,
                                   Executor backgroundExecutor,
                                   WallClock wallClock,
                                   CoverageObservabilitySink observabilitySink) {
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.radioTechnology = Objects.requireNonNull(radioTechnology, "radioTechnology");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.resultsService = Objects.requireNonNull(resultsService, "resultsService");
        this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor, "backgroundExecutor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullCoverageObservabilitySink.INSTANCE);
    }

    /**
     * Receives an immutable copy of the fence list after every change.
     */
    public void setFenceObserver(Consumer<List<Fence>> observer) {
        this.fenceObserver = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Invoked when an {@link MeasurementEvent.AccuracyCheckDue} finds that the
     * run never had an accurate fix.
     */
    public void setInsufficientAccuracyHandler(Runnable handler) {
        this.insufficientAccuracyHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Resets the engine for a new run. Nothing is written to the store until
     * the first sub-session token arrives.
     */
    public void begin(Instant at) {
        runStart = Objects.requireNonNull(at, "at");
        fences.clear();
        inaccurateWindows.clear();
        networkType = null;
        activeSessionUuid = null;
        activeAnchor = null;
        hasEverHadAccurateLocation = false;
        publish();
    }

    public void handle(MeasurementEvent event) {
        Objects.requireNonNull(event, "event");

        if (event instanceof MeasurementEvent.LocationUpdate location) {
            onLocation(location.sample());
        }
        else if (event instanceof MeasurementEvent.PingUpdate ping) {
            onPing(ping.outcome());
        }
        else if (event instanceof MeasurementEvent.NetworkTypeUpdate networkTypeUpdate) {
            networkType = networkTypeUpdate.sample().type();
        }
        else if (event instanceof MeasurementEvent.SessionInitialized initialized) {
            onSessionInitialized(initialized);
        }
        else if (event instanceof MeasurementEvent.AccuracyCheckDue) {
            onAccuracyCheckDue();
        }
        else {
            throw new IllegalArgumentException("Unsupported measurement event: " + event.getClass().getSimpleName());
        }
    }

    /**
     * Ends the run: closes the open fence at {@code at} and, if a sub-session
     * token was ever obtained, stores it, submits the fences and finalizes the
     * sub-session. Without a token everything is discarded without touching
     * the store.
     *
     * @return the run's fences as they were at the end
     */
    public List<Fence> finish(Instant at) {
        Objects.requireNonNull(at, "at");

        Fence open = openFence().orElse(null);
        if (open != null) {
            Instant exit = at.isBefore(open.dateEntered()) ? open.dateEntered() : at;
            Fence closed = open.exitedAt(exit);
            fences.set(fences.size() - 1, closed);
            fenceClosed(closed);
        }

        List<Fence> result = List.copyOf(fences);
        if (activeSessionUuid == null) {
            log.info("Discarding {} fences, no coverage session was ever obtained", result.size());
            fences.clear();
            publish();
            return result;
        }

        publish();
        ActiveSubSession subSession = new ActiveSubSession(activeSessionUuid, activeAnchor);
        inBackground("send coverage results", () -> {
            try {
                resultsService.send(subSession, result);
            } catch (CoverageSubmissionException e) {
                reportError("Coverage results not submitted, kept for resend", e);
            }
        });
        inBackground("finalize coverage session", () -> persistence.sessionFinalized(at));
        return result;
    }

    /**
     * Latest fence snapshot; safe to call from any thread.
     */
    public List<Fence> fences() {
        return snapshot;
    }

    public Optional<String> activeSessionUuid() {
        return Optional.ofNullable(activeSessionUuid);
    }

    public boolean hasEverHadAccurateLocation() {
        return hasEverHadAccurateLocation;
    }

    public CoverageTimingPolicy timingPolicy() {
        return timingPolicy;
    }

    public List<InaccurateLocationWindow> inaccurateWindows() {
        return List.copyOf(inaccurateWindows);
    }

    // -------------------------------------------------------------------------
    // Event handling
    // -------------------------------------------------------------------------

    private void onLocation(LocationSample sample) {
        if (sample.horizontalAccuracy() > timingPolicy.minimumLocationAccuracyMeters()) {
            onInaccurateLocation(sample.timestamp());
            return;
        }
        closeInaccurateWindow(sample.timestamp());
        hasEverHadAccurateLocation = true;

        if (networkType == NetworkType.WIFI) {
            return;
        }

        RadioTechnology technology = radioTechnology.currentTechnology().orElse(null);
        double radius = timingPolicy.fenceRadiusMeters();
        Optional<Fence> open = openFence();

        if (open.isEmpty()) {
            if (!fences.isEmpty() && !sample.timestamp().isAfter(fences.get(fences.size() - 1).dateEntered())) {
                log.debug("Dropping stale location at {}", sample.timestamp());
                return;
            }
            fences.add(Fence.openAt(sample, technology, radius, activeSessionUuid));
            publish();
            return;
        }

        Fence current = open.get();
        double distance = current.startingLocation().coordinate().distanceMeters(sample.coordinate());
        if (distance >= radius) {
            if (!sample.timestamp().isAfter(current.dateEntered())) {
                log.debug("Dropping out-of-order location at {}", sample.timestamp());
                return;
            }
            Fence closed = current.exitedAt(sample.timestamp());
            fences.set(fences.size() - 1, closed);
            fenceClosed(closed);
            fences.add(Fence.openAt(sample, technology, radius, activeSessionUuid));
        }
        else {
            fences.set(fences.size() - 1, current.withLocation(sample, technology));
        }
        publish();
    }

    private void onInaccurateLocation(Instant timestamp) {
        if (openWindow().isEmpty()) {
            inaccurateWindows.add(InaccurateLocationWindow.openAt(timestamp));
        }
    }

    private void onAccuracyCheckDue() {
        if (hasEverHadAccurateLocation) {
            return;
        }
        log.info("No accurate location since the run started at {}, stopping measurement", runStart);
        insufficientAccuracyHandler.run();
    }

    private void closeInaccurateWindow(Instant timestamp) {
        Optional<InaccurateLocationWindow> window = openWindow();
        if (window.isPresent()) {
            InaccurateLocationWindow open = window.get();
            Instant end = timestamp.isBefore(open.begin()) ? open.begin() : timestamp;
            inaccurateWindows.set(inaccurateWindows.size() - 1, open.closedAt(end));
        }
    }

    private void onPing(PingOutcome outcome) {
        if (networkType == NetworkType.WIFI) {
            return;
        }

        Instant timestamp = outcome.timestamp();
        for (InaccurateLocationWindow window : inaccurateWindows) {
            if (window.contains(timestamp)) {
                return;
            }
        }

        for (int i = fences.size() - 1; i >= 0; i--) {
            Fence fence = fences.get(i);
            if (fence.covers(timestamp)) {
                Fence updated = fence.withPing(outcome);
                fences.set(i, updated);
                if (!updated.isOpen() && activeSessionUuid != null
                        && activeSessionUuid.equals(updated.sessionUuid())) {
                    // the closed fence was already stored with its old average
                    inBackground("update fence " + updated.id(), () -> persistence.save(updated));
                }
                publish();
                return;
            }
        }
    }

    private void onSessionInitialized(MeasurementEvent.SessionInitialized initialized) {
        Instant anchor = initialized.timestamp();
        String testUuid = initialized.testUuid();

        boolean first = activeSessionUuid == null;
        if (first) {
            Instant startedAt = runStart == null || anchor.isBefore(runStart) ? anchor : runStart;
            inBackground("start coverage session", () -> persistence.sessionStarted(startedAt));
        }
        else {
            inBackground("roll over coverage session", () -> {
                persistence.sessionFinalized(anchor);
                persistence.sessionStarted(anchor);
            });
        }
        inBackground("assign coverage session " + testUuid,
                () -> persistence.sessionAssigned(testUuid, initialized.loopUuid(), anchor));

        activeSessionUuid = testUuid;
        activeAnchor = anchor;
        List<Fence> adopted = new ArrayList<>();
        for (int i = 0; i < fences.size(); i++) {
            Fence fence = fences.get(i);
            if (fence.sessionUuid() == null || fence.isOpen()) {
                Fence updated = fence.withSessionUuid(testUuid);
                fences.set(i, updated);
                if (!updated.isOpen()) {
                    adopted.add(updated);
                }
            }
        }
        // fences closed before the first token have not been stored yet
        for (Fence fence : adopted) {
            inBackground("store fence " + fence.id(), () -> persistence.save(fence));
        }
        publish();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private Optional<Fence> openFence() {
        if (fences.isEmpty()) {
            return Optional.empty();
        }
        Fence last = fences.get(fences.size() - 1);
        return last.isOpen() ? Optional.of(last) : Optional.empty();
    }

    private Optional<InaccurateLocationWindow> openWindow() {
        if (inaccurateWindows.isEmpty()) {
            return Optional.empty();
        }
        InaccurateLocationWindow last = inaccurateWindows.get(inaccurateWindows.size() - 1);
        return last.isOpen() ? Optional.of(last) : Optional.empty();
    }

    private void fenceClosed(Fence closed) {
        observabilitySink.onFenceClosed(new FenceClosedEvent(closed.dateExited(), closed));
        if (activeSessionUuid != null) {
            inBackground("store fence " + closed.id(), () -> persistence.save(closed));
        }
    }

    private void publish() {
        List<Fence> copy = List.copyOf(fences);
        snapshot = copy;
        try {
            fenceObserver.accept(copy);
        } catch (RuntimeException e) {
            reportError("Fence observer failed", e);
        }
    }

    private void inBackground(String what, Runnable task) {
        try {
            backgroundExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    reportError("Could not " + what, e);
                }
            });
        } catch (RejectedExecutionException e) {
            reportError("Could not schedule: " + what, e);
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new CoverageErrorEvent(wallClock.now(), message, cause));
    }
}
