package com.questrail.coverage.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the wall-clock instants stamped on ping outcomes, fences and
 * session anchors.
 *
 * <p>Never used to measure durations; see {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
