package com.questrail.coverage.observability;

import java.time.Instant;

/**
 * A sub-session token was confirmed.
 *
 * @param loopUuid        preceding sub-session, {@code null} for the first one
 * @param subSessionCount number of sub-sessions in the run so far, this one included
 */
public record SubSessionStartedEvent(
        Instant timestamp,
        String testUuid,
        String loopUuid,
        int subSessionCount
) {
}
