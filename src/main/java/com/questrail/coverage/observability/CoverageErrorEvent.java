package com.questrail.coverage.observability;

import java.time.Instant;

/**
 * Record representing an error absorbed by the measurement pipeline.
 */
public record CoverageErrorEvent(
        Instant timestamp,
        String message,
        Throwable cause
) {
}
