package com.questrail.coverage.observability;

import java.time.Instant;

/**
 * Start or stop of a measurement run.
 *
 * @param fenceCount fences held by the run at that moment
 */
public record MeasurementLifecycleEvent(
        Instant timestamp,
        Phase phase,
        int fenceCount
) {
    public enum Phase {
        STARTED,
        STOPPED,
        DISCARDED
    }
}
