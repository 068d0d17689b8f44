package com.questrail.coverage.persistence;

import com.questrail.coverage.controlserver.CoverageSubmissionException;
import com.questrail.coverage.internal.time.WallClock;
import com.questrail.coverage.model.ActiveSubSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PersistedSessionsResender
 * =============================================================================
 * Resend sweep over the sub-sessions left in the store.
 *
 * <h2>Sweep</h2>
 * <ol>
 *   <li>Purge every sub-session whose finalization (or start, if unfinished) is
 *       older than {@code maxResendAge}, sent or not.</li>
 *   <li>Purge finalized sub-sessions without fences or without a {@code testUuid}.
 *       At process launch the same applies to unfinished ones, and unfinished
 *       sub-sessions that do have both are finalized so they become sendable.</li>
 *   <li>Submit each remaining finalized sub-session other than the active one,
 *       latest first by earliest fence timestamp. A success deletes the
 *       sub-session; a failure is logged and leaves it for the next sweep.</li>
 * </ol>
 *
 * <h2>Concurrency</h2>
 * Sweeps are serialized, so a sub-session is never submitted twice at once by
 * this process.
 */
public final class PersistedSessionsResender {

    private static final Logger log = LoggerFactory.getLogger(PersistedSessionsResender.class);

    /**
     * Counts of one sweep. {@code skipped} sessions have a test uuid but no
     * anchor and stay in the store untouched.
     */
    public record Report(int purged, int submitted, int failed, int skipped) {
    }

    private final JdbcCoverageStore store;
    private final CoverageResultSubmitter submitter;
    private final WallClock wallClock;
    private final Duration maxResendAge;
    private final Supplier<Optional<ActiveSubSession>> activeSubSession;

    public PersistedSessionsResender(JdbcCoverageStore store,
                                     CoverageResultSubmitter submitter,
                                     WallClock wallClock,
                                     Duration maxResendAge,
                                     Supplier<Optional<ActiveSubSession>> activeSubSession) {
        this.store = Objects.requireNonNull(store, "store");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.maxResendAge = Objects.requireNonNull(maxResendAge, "maxResendAge");
        this.activeSubSession = Objects.requireNonNull(activeSubSession, "activeSubSession");
    }

    public synchronized Report resendPersistentSessions(boolean isLaunched) {
        Instant cutoff = wallClock.now().minus(maxResendAge);
        String activeTestUuid = activeSubSession.get().map(ActiveSubSession::testUuid).orElse(null);

        int purged = 0;
        List<StoredSession> resendable = new ArrayList<>();

        for (StoredSession session : store.loadSessions()) {
            boolean incomplete = session.fences().isEmpty() || session.testUuid() == null;

            if (session.ageReference().isBefore(cutoff)) {
                log.info("Purging coverage session {} (test {}) older than {}", session.id(), session.testUuid(), maxResendAge);
                store.deleteSession(session.id());
                purged++;
            }
            else if (incomplete && (session.isFinalized() || isLaunched)) {
                log.debug("Purging coverage session {} without fences or test uuid", session.id());
                store.deleteSession(session.id());
                purged++;
            }
            else if (!session.isFinalized() && isLaunched) {
                Instant finalizedAt = session.latestFenceActivity().orElse(session.startedAt());
                log.info("Finalizing coverage session {} (test {}) left open by a previous run", session.id(), session.testUuid());
                store.finalizeSession(session.id(), finalizedAt);
                resendable.add(session);
            }
            else if (session.isFinalized() && !session.testUuid().equals(activeTestUuid)) {
                resendable.add(session);
            }
        }

        resendable.sort(Comparator.comparing(
                (StoredSession s) -> s.earliestFence().orElse(Instant.MIN)).reversed());

        int submitted = 0;
        int failed = 0;
        int skipped = 0;
        for (StoredSession session : resendable) {
            if (session.anchorAt() == null) {
                skipped++;
                log.warn("Not resending coverage session {} (test {}): no anchor to offset its fences against",
                        session.id(), session.testUuid());
                continue;
            }
            try {
                submitter.submit(session.testUuid(), session.anchorAt(), session.fences());
                store.deleteSession(session.id());
                submitted++;
                log.info("Resent coverage session {} with {} fences", session.testUuid(), session.fences().size());
            } catch (CoverageSubmissionException | RuntimeException e) {
                failed++;
                log.warn("Resending coverage session {} failed, keeping it: {}", session.testUuid(), e.toString());
            }
        }

        return new Report(purged, submitted, failed, skipped);
    }
}
