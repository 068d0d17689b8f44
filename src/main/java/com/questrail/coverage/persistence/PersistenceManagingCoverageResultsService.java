package com.questrail.coverage.persistence;

import com.questrail.coverage.controlserver.CoverageSubmissionException;
import com.questrail.coverage.controlserver.MissingTestUuidException;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.Fence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * PersistenceManagingCoverageResultsService
 * =============================================================================
 * {@link SendCoverageResultsService} that keeps the store consistent with what
 * the server confirmed.
 *
 * <p>Only fences of the given sub-session are submitted, offset against its
 * anchor. The caller passes the sub-session its fences were recorded under,
 * which may lag behind the controller's when a token arrives during stop. The
 * sub-session's stored data is deleted iff the submission succeeded, after
 * which the resend sweep runs for older sub-sessions. When no fence belongs to
 * the sub-session only the sweep runs.</p>
 */
public final class PersistenceManagingCoverageResultsService implements SendCoverageResultsService {

    private static final Logger log = LoggerFactory.getLogger(PersistenceManagingCoverageResultsService.class);

    private final JdbcCoverageStore store;
    private final CoverageResultSubmitter submitter;
    private final PersistedSessionsResender resender;

    public PersistenceManagingCoverageResultsService(JdbcCoverageStore store,
                                                     CoverageResultSubmitter submitter,
                                                     PersistedSessionsResender resender) {
        this.store = Objects.requireNonNull(store, "store");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.resender = Objects.requireNonNull(resender, "resender");
    }

    @Override
    public void send(ActiveSubSession active, List<Fence> fences) throws CoverageSubmissionException {
        Objects.requireNonNull(fences, "fences");
        if (active == null) {
            throw new MissingTestUuidException();
        }

        List<FenceRecord> matching = fences.stream()
                .filter(f -> active.testUuid().equals(f.sessionUuid()))
                .map(FenceRecord::from)
                .collect(Collectors.toList());

        if (matching.isEmpty()) {
            log.debug("No fences for {}, running resend sweep only", active.testUuid());
            resender.resendPersistentSessions(false);
            return;
        }

        submitter.submit(active.testUuid(), active.anchor(), matching);
        int deleted = store.deleteSessionsByTestUuid(active.testUuid());
        log.info("Submitted {} fences for {} ({} stored sessions removed)", matching.size(), active.testUuid(), deleted);

        resender.resendPersistentSessions(false);
    }
}
