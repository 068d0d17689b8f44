package com.questrail.coverage.persistence;

import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.RadioTechnology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.coverage.persistence.FenceFixtures.fence;
import static com.questrail.coverage.persistence.FenceFixtures.t;
import static org.junit.jupiter.api.Assertions.*;

class JdbcCoverageStoreTest {

    private JdbcCoverageStore store;

    @BeforeEach
    void setUp() {
        store = FenceFixtures.newStore();
    }

    @Test
    void schemaInitializationIsRepeatable() {
        store.initializeSchema();
        assertTrue(store.loadSessions().isEmpty());
    }

    @Test
    void sessionLifecycleIsRecorded() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(2));
        store.save(fence("s1", 1, 5L));
        store.sessionFinalized(t(9));

        StoredSession session = store.findByTestUuid("s1").orElseThrow();
        assertEquals(t(0), session.startedAt());
        assertEquals(t(2), session.anchorAt());
        assertEquals(t(9), session.finalizedAt());
        assertEquals(1, session.fences().size());
    }

    @Test
    void fenceFieldsSurviveStorage() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(0));
        Fence fence = fence("s1", 1, 5L);
        store.save(fence);

        FenceRecord stored = store.findByTestUuid("s1").orElseThrow().fences().get(0);
        assertEquals(fence.id(), stored.fenceId());
        assertEquals(t(1), stored.dateEntered());
        assertEquals(t(5), stored.dateExited());
        assertEquals(fence.startingLocation().coordinate(), stored.coordinate());
        assertEquals(4.5, stored.accuracy());
        assertEquals(30, stored.avgPingMillis());
        assertEquals(RadioTechnology.LTE, stored.technology());
        assertEquals(20.0, stored.radiusMeters());
    }

    @Test
    void savingTheSameFenceAgainReplacesIt() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(0));
        Fence open = fence("s1", 1, null);
        store.save(open);
        store.save(open.exitedAt(t(7)));

        List<FenceRecord> fences = store.findByTestUuid("s1").orElseThrow().fences();
        assertEquals(1, fences.size());
        assertEquals(t(7), fences.get(0).dateExited());
    }

    @Test
    void fenceWithoutSessionGoesToTheUnfinishedSession() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(0));
        store.sessionFinalized(t(3));
        store.sessionStarted(t(3));
        store.save(fence(null, 4, 6L));

        List<StoredSession> sessions = store.loadSessions();
        assertEquals(0, sessions.get(0).fences().size());
        assertEquals(1, sessions.get(1).fences().size());
    }

    @Test
    void fenceIsStoredUnderItsOwnSessionEvenAfterRollover() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(0));
        store.sessionFinalized(t(3));
        store.sessionStarted(t(3));
        store.sessionAssigned("s2", "s1", t(3));

        store.save(fence("s1", 1, 3L));

        assertEquals(1, store.findByTestUuid("s1").orElseThrow().fences().size());
        assertEquals(0, store.findByTestUuid("s2").orElseThrow().fences().size());
        assertEquals("s1", store.findByTestUuid("s2").orElseThrow().loopUuid());
    }

    @Test
    void saveWithoutAnySessionFails() {
        assertThrows(PersistenceException.class, () -> store.save(fence("s1", 1, 2L)));
    }

    @Test
    void deletingASessionRemovesItsFences() {
        store.sessionStarted(t(0));
        store.sessionAssigned("s1", null, t(0));
        store.save(fence("s1", 1, 2L));
        store.save(fence("s1", 2, 3L));

        assertEquals(1, store.deleteSessionsByTestUuid("s1"));
        assertTrue(store.loadSessions().isEmpty());
        assertEquals(0, store.deleteSessionsByTestUuid("s1"));
    }

    @Test
    void finalizingWithoutOpenSessionIsANoOp() {
        store.sessionFinalized(t(1));
        assertTrue(store.loadSessions().isEmpty());
    }
}
