package com.questrail.coverage.persistence;

import com.questrail.coverage.model.Fence;

import java.time.Instant;

/**
 * FencePersistenceService
 * -----------------------------------------------------------------------------
 * Durable storage of fences grouped by sub-session.
 *
 * <p>Calls are made in order from a single background thread. Implementations
 * throw {@link PersistenceException} on failure; callers log and continue.</p>
 */
public interface FencePersistenceService {

    /**
     * Stores or replaces {@code fence} under the sub-session named by its
     * {@code sessionUuid}, or under the unfinished sub-session if it has none.
     */
    void save(Fence fence);

    /**
     * Opens a new, not yet identified sub-session.
     */
    void sessionStarted(Instant at);

    /**
     * Gives the unfinished sub-session its token identity and anchor.
     *
     * @param loopUuid {@code testUuid} of the preceding sub-session, may be {@code null}
     */
    void sessionAssigned(String testUuid, String loopUuid, Instant anchor);

    /**
     * Marks the unfinished sub-session complete, which makes it eligible for resend.
     */
    void sessionFinalized(Instant at);
}
