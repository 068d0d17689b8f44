package com.questrail.coverage.engine;

import com.questrail.coverage.config.CoverageTimingPolicy;
import com.questrail.coverage.controlserver.CoverageSubmissionException;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.LocationSample;
import com.questrail.coverage.model.NetworkType;
import com.questrail.coverage.model.NetworkTypeSample;
import com.questrail.coverage.model.PingFailure;
import com.questrail.coverage.model.PingOutcome;
import com.questrail.coverage.model.RadioTechnology;
import com.questrail.coverage.observability.CoverageErrorEvent;
import com.questrail.coverage.observability.FenceClosedEvent;
import com.questrail.coverage.observability.RecordingCoverageObservabilitySink;
import com.questrail.coverage.persistence.FencePersistenceService;
import com.questrail.coverage.persistence.SendCoverageResultsService;
import com.questrail.coverage.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FenceSegmentationEngineTest
 * -----------------------------------------------------------------------------
 * Fence creation, ping attribution and sub-session bookkeeping, with
 * persistence and submission running inline.
 */
class FenceSegmentationEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    // about 111 m apart
    private static final double LAT_A = 48.000;
    private static final double LAT_B = 48.001;
    private static final double LON = 16.000;

    private RecordingPersistence persistence;
    private RecordingResults results;
    private RecordingCoverageObservabilitySink sink;
    private AtomicReference<RadioTechnology> technology;
    private ManualMonotonicClock clock;
    private FenceSegmentationEngine engine;

    @BeforeEach
    void setUp() {
        persistence = new RecordingPersistence();
        results = new RecordingResults();
        sink = new RecordingCoverageObservabilitySink();
        technology = new AtomicReference<>(RadioTechnology.LTE);
        clock = new ManualMonotonicClock(T0);
        engine = newEngine(CoverageTimingPolicy.defaults());
        engine.begin(T0);
    }

    private FenceSegmentationEngine newEngine(CoverageTimingPolicy policy) {
        return new FenceSegmentationEngine(
                policy,
                () -> Optional.ofNullable(technology.get()),
                persistence,
                results,
                Runnable::run,
                clock,
                sink);
    }

    private static Instant t(long seconds) {
        return T0.plusSeconds(seconds);
    }

    private void location(double lat, long second) {
        engine.handle(new MeasurementEvent.LocationUpdate(LocationSample.of(lat, LON, 5, t(second))));
    }

    private void inaccurateLocation(long second) {
        engine.handle(new MeasurementEvent.LocationUpdate(LocationSample.of(LAT_A, LON, 80, t(second))));
    }

    private void ping(long second, long millis) {
        engine.handle(new MeasurementEvent.PingUpdate(PingOutcome.success(t(second), Duration.ofMillis(millis))));
    }

    private void networkType(NetworkType type, long second) {
        engine.handle(new MeasurementEvent.NetworkTypeUpdate(new NetworkTypeSample(type, t(second))));
    }

    private void session(String testUuid, String loopUuid, long second) {
        engine.handle(new MeasurementEvent.SessionInitialized(t(second), testUuid, loopUuid));
    }

    @Test
    void averagePingPerFence() {
        location(LAT_A, 1);
        ping(2, 10);
        ping(3, 20);
        ping(4, 26);
        location(LAT_B, 5);

        List<Fence> fences = engine.fences();
        assertEquals(2, fences.size());
        assertEquals(OptionalInt.of(19), fences.get(0).averagePingMillis());
        assertEquals(OptionalInt.empty(), fences.get(1).averagePingMillis());
        assertEquals(t(5), fences.get(0).dateExited());
        assertTrue(fences.get(1).isOpen());
    }

    @Test
    void nearbyLocationIsAppendedWithCurrentTechnology() {
        location(LAT_A, 1);
        technology.set(RadioTechnology.NR);
        engine.handle(new MeasurementEvent.LocationUpdate(LocationSample.of(LAT_A + 0.0001, LON, 5, t(2))));

        List<Fence> fences = engine.fences();
        assertEquals(1, fences.size());
        assertEquals(2, fences.get(0).locations().size());
        assertEquals(RadioTechnology.NR, fences.get(0).significantTechnology().orElseThrow());
    }

    @Test
    void inaccurateLocationsNeverCreateFences() {
        inaccurateLocation(1);
        inaccurateLocation(2);

        assertTrue(engine.fences().isEmpty());
        assertEquals(1, engine.inaccurateWindows().size());
        assertTrue(engine.inaccurateWindows().get(0).isOpen());
    }

    @Test
    void pingsInsideInaccurateWindowAreDropped() {
        location(LAT_A, 1);
        inaccurateLocation(2);
        ping(3, 40);
        location(LAT_A, 4);
        ping(4, 12);
        ping(2, 99);

        Fence fence = engine.fences().get(0);
        assertEquals(1, fence.pings().size());
        assertEquals(OptionalInt.of(12), fence.averagePingMillis());
        assertEquals(t(4), engine.inaccurateWindows().get(0).end());
    }

    @Test
    void pingsOnWifiAreDropped() {
        location(LAT_A, 1);
        engine.handle(new MeasurementEvent.NetworkTypeUpdate(new NetworkTypeSample(NetworkType.WIFI, t(1))));
        ping(2, 10);
        engine.handle(new MeasurementEvent.NetworkTypeUpdate(new NetworkTypeSample(NetworkType.CELLULAR, t(3))));
        ping(3, 30);

        assertEquals(OptionalInt.of(30), engine.fences().get(0).averagePingMillis());
        assertEquals(1, engine.fences().get(0).pings().size());
    }

    @Test
    void locationsOnWifiLeaveFencesUntouched() {
        networkType(NetworkType.WIFI, 0);
        location(LAT_A, 1);
        location(LAT_B, 2);

        assertTrue(engine.fences().isEmpty());

        networkType(NetworkType.CELLULAR, 3);
        location(LAT_A, 4);
        networkType(NetworkType.WIFI, 5);
        location(LAT_B, 6);
        location(LAT_A + 0.0001, 7);

        List<Fence> fences = engine.fences();
        assertEquals(1, fences.size());
        assertTrue(fences.get(0).isOpen());
        assertEquals(1, fences.get(0).locations().size());
    }

    @Test
    void latePingIsAttributedToTheFenceItWasSentIn() {
        location(LAT_A, 1);
        location(LAT_B, 5);
        ping(3, 44);
        ping(6, 8);

        List<Fence> fences = engine.fences();
        assertEquals(OptionalInt.of(44), fences.get(0).averagePingMillis());
        assertEquals(OptionalInt.of(8), fences.get(1).averagePingMillis());
    }

    @Test
    void pingBeforeFirstFenceIsDropped() {
        ping(0, 10);
        location(LAT_A, 1);

        assertTrue(engine.fences().get(0).pings().isEmpty());
    }

    @Test
    void errorOutcomesAreAttributedButDoNotCountTowardsAverage() {
        location(LAT_A, 1);
        engine.handle(new MeasurementEvent.PingUpdate(PingOutcome.error(t(2), PingFailure.TIMED_OUT)));
        ping(3, 10);

        Fence fence = engine.fences().get(0);
        assertEquals(2, fence.pings().size());
        assertEquals(OptionalInt.of(10), fence.averagePingMillis());
    }

    @Test
    void outOfOrderDistantLocationIsDropped() {
        location(LAT_A, 5);
        location(LAT_B, 3);

        assertEquals(1, engine.fences().size());
        assertTrue(engine.fences().get(0).isOpen());
    }

    @Test
    void nothingIsPersistedBeforeTheFirstToken() {
        location(LAT_A, 1);
        location(LAT_B, 2);

        assertTrue(persistence.calls.isEmpty());
        assertEquals(1, sink.eventsOfType(FenceClosedEvent.class).size());
    }

    @Test
    void firstTokenAdoptsAllFencesAndStoresClosedOnes() {
        location(LAT_A, 1);
        location(LAT_B, 2);
        session("s1", null, 3);

        assertEquals(List.of("started", "assigned:s1:null", "save:s1"), persistence.calls);
        assertTrue(engine.fences().stream().allMatch(f -> "s1".equals(f.sessionUuid())));
        assertEquals("s1", engine.activeSessionUuid().orElseThrow());
    }

    @Test
    void reinitializationMovesOnlyTheOpenFence() {
        session("s1", null, 0);
        location(LAT_A, 1);
        location(LAT_B, 2);
        session("s2", "s1", 3);
        location(LAT_A, 4);

        List<Fence> fences = engine.fences();
        assertEquals("s1", fences.get(0).sessionUuid());
        assertEquals("s2", fences.get(1).sessionUuid());
        assertEquals("s2", fences.get(2).sessionUuid());
        assertEquals(List.of(
                "started", "assigned:s1:null",
                "save:s1",
                "finalized", "started", "assigned:s2:s1",
                "save:s2"), persistence.calls);
    }

    @Test
    void finishClosesOpenFenceAndSubmitsThenFinalizes() {
        session("s1", null, 0);
        location(LAT_A, 1);

        List<Fence> fences = engine.finish(t(10));

        assertEquals(1, fences.size());
        assertEquals(t(10), fences.get(0).dateExited());
        assertEquals(List.of(fences), results.sent);
        assertEquals(List.of(new ActiveSubSession("s1", t(0))), results.subSessions);
        assertEquals(List.of("started", "assigned:s1:null", "save:s1", "finalized"), persistence.calls);
    }

    @Test
    void finishWithoutTokenDiscardsEverything() {
        location(LAT_A, 1);
        location(LAT_B, 2);

        List<Fence> fences = engine.finish(t(3));

        assertEquals(2, fences.size());
        assertTrue(persistence.calls.isEmpty());
        assertTrue(results.sent.isEmpty());
        assertTrue(engine.fences().isEmpty());
    }

    @Test
    void submissionFailureIsReportedNotThrown() {
        results.failure = new CoverageSubmissionException("HTTP 406", 406, null);
        session("s1", null, 0);
        location(LAT_A, 1);

        engine.finish(t(2));

        assertTrue(sink.hasEventOfType(CoverageErrorEvent.class));
        assertTrue(persistence.calls.contains("finalized"));
    }

    @Test
    void persistenceFailureDoesNotAffectInMemoryState() {
        persistence.failSaves = true;
        clock.advanceMillis(42_000);
        session("s1", null, 0);
        location(LAT_A, 1);
        location(LAT_B, 2);

        assertEquals(2, engine.fences().size());
        List<CoverageErrorEvent> errors = sink.eventsOfType(CoverageErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals(T0.plusSeconds(42), errors.get(0).timestamp());
    }

    @Test
    void finishSubmitsUnderTheSubSessionItsFencesBelongTo() {
        session("s1", null, 0);
        location(LAT_A, 1);
        session("s2", "s1", 5);
        location(LAT_B, 6);

        engine.finish(t(9));

        assertEquals(List.of(new ActiveSubSession("s2", t(5))), results.subSessions);
    }

    @Test
    void accuracyCheckStopsRunThatNeverHadAnAccurateFix() {
        AtomicInteger stops = new AtomicInteger();
        engine.setInsufficientAccuracyHandler(stops::incrementAndGet);

        inaccurateLocation(1);
        inaccurateLocation(20);
        engine.handle(new MeasurementEvent.AccuracyCheckDue(t(30)));

        assertEquals(1, stops.get());
        assertFalse(engine.hasEverHadAccurateLocation());
    }

    @Test
    void accuracyCheckStopsRunWithoutAnyLocation() {
        AtomicInteger stops = new AtomicInteger();
        engine.setInsufficientAccuracyHandler(stops::incrementAndGet);

        engine.handle(new MeasurementEvent.AccuracyCheckDue(t(30)));

        assertEquals(1, stops.get());
    }

    @Test
    void oneAccurateFixKeepsTheRunAlive() {
        AtomicInteger stops = new AtomicInteger();
        engine.setInsufficientAccuracyHandler(stops::incrementAndGet);

        location(LAT_A, 1);
        inaccurateLocation(100);
        inaccurateLocation(200);
        engine.handle(new MeasurementEvent.AccuracyCheckDue(t(30)));
        inaccurateLocation(4000);

        assertEquals(0, stops.get());
        assertTrue(engine.hasEverHadAccurateLocation());
    }

    @Test
    void accurateFixOnWifiStillCountsAsAccurate() {
        AtomicInteger stops = new AtomicInteger();
        engine.setInsufficientAccuracyHandler(stops::incrementAndGet);

        networkType(NetworkType.WIFI, 0);
        location(LAT_A, 1);
        engine.handle(new MeasurementEvent.AccuracyCheckDue(t(30)));

        assertEquals(0, stops.get());
        assertTrue(engine.fences().isEmpty());
    }

    @Test
    void beginResetsAccuracyHistory() {
        location(LAT_A, 1);
        engine.begin(t(10));

        assertFalse(engine.hasEverHadAccurateLocation());
    }

    @Test
    void observerSeesEverySnapshot() {
        List<Integer> sizes = new ArrayList<>();
        engine.setFenceObserver(f -> sizes.add(f.size()));

        location(LAT_A, 1);
        location(LAT_B, 2);

        assertEquals(List.of(1, 2), sizes);
    }

    static final class RecordingPersistence implements FencePersistenceService {
        final List<String> calls = new ArrayList<>();
        boolean failSaves;

        @Override
        public void save(Fence fence) {
            if (failSaves) {
                throw new IllegalStateException("disk full");
            }
            calls.add("save:" + fence.sessionUuid());
        }

        @Override
        public void sessionStarted(Instant at) {
            calls.add("started");
        }

        @Override
        public void sessionAssigned(String testUuid, String loopUuid, Instant anchor) {
            calls.add("assigned:" + testUuid + ":" + loopUuid);
        }

        @Override
        public void sessionFinalized(Instant at) {
            calls.add("finalized");
        }
    }

    static final class RecordingResults implements SendCoverageResultsService {
        final List<List<Fence>> sent = new ArrayList<>();
        final List<ActiveSubSession> subSessions = new ArrayList<>();
        CoverageSubmissionException failure;

        @Override
        public void send(ActiveSubSession subSession, List<Fence> fences) throws CoverageSubmissionException {
            subSessions.add(subSession);
            sent.add(fences);
            if (failure != null) {
                throw failure;
            }
        }
    }
}
