package com.questrail.coverage.config;

import java.time.Duration;
import java.util.Objects;

/**
 * CoverageTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing and threshold settings of a coverage measurement.
 *
 * <h2>Configuration parameters</h2>
 * <ul>
 *   <li><b>pingInterval</b>: cadence of the ping pacer.</li>
 *   <li><b>pingTimeout</b>: how long a ping waits for its reply before it counts
 *       as timed out.</li>
 *   <li><b>pingFailureThreshold</b>: consecutive failed pings after which the ping
 *       session is reinitialized; 0 disables.</li>
 *   <li><b>fenceRadiusMeters</b>: distance from a fence's starting location at
 *       which a new fence begins.</li>
 *   <li><b>minimumLocationAccuracyMeters</b>: fixes with a worse horizontal
 *       accuracy are treated as inaccurate.</li>
 *   <li><b>maxResendAge</b>: persisted sub-sessions older than this are purged,
 *       sent or not.</li>
 *   <li><b>defaultMaxSubSessionDuration</b> / <b>defaultMaxTotalDuration</b>: used
 *       when the control server does not announce its own limits.</li>
 *   <li><b>insufficientAccuracyAutoStop</b>: stop the run if no accurate
 *       location arrived within this long of its start; {@code null} disables.</li>
 * </ul>
 */
public record CoverageTimingPolicy(
        Duration pingInterval,
        Duration pingTimeout,
        int pingFailureThreshold,
        double fenceRadiusMeters,
        double minimumLocationAccuracyMeters,
        Duration maxResendAge,
        Duration defaultMaxSubSessionDuration,
        Duration defaultMaxTotalDuration,
        Duration insufficientAccuracyAutoStop
) {
    public CoverageTimingPolicy {
        Objects.requireNonNull(pingInterval, "pingInterval");
        Objects.requireNonNull(pingTimeout, "pingTimeout");
        Objects.requireNonNull(maxResendAge, "maxResendAge");
        Objects.requireNonNull(defaultMaxSubSessionDuration, "defaultMaxSubSessionDuration");
        Objects.requireNonNull(defaultMaxTotalDuration, "defaultMaxTotalDuration");

        requirePositive(pingInterval, "pingInterval");
        requirePositive(pingTimeout, "pingTimeout");
        requirePositive(maxResendAge, "maxResendAge");
        requirePositive(defaultMaxSubSessionDuration, "defaultMaxSubSessionDuration");
        requirePositive(defaultMaxTotalDuration, "defaultMaxTotalDuration");
        if (insufficientAccuracyAutoStop != null) {
            requirePositive(insufficientAccuracyAutoStop, "insufficientAccuracyAutoStop");
        }
        if (pingFailureThreshold < 0) {
            throw new IllegalArgumentException("pingFailureThreshold must be non-negative");
        }
        if (!(fenceRadiusMeters > 0)) {
            throw new IllegalArgumentException("fenceRadiusMeters must be positive");
        }
        if (!(minimumLocationAccuracyMeters > 0)) {
            throw new IllegalArgumentException("minimumLocationAccuracyMeters must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>pingInterval: 100ms</li>
     *   <li>pingTimeout: 1s</li>
     *   <li>pingFailureThreshold: 5</li>
     *   <li>fenceRadiusMeters: 20</li>
     *   <li>minimumLocationAccuracyMeters: 10</li>
     *   <li>maxResendAge: 7 days</li>
     *   <li>defaultMaxSubSessionDuration: 1h, defaultMaxTotalDuration: 4h</li>
     *   <li>insufficientAccuracyAutoStop: 30 min</li>
     * </ul>
     */
    public static CoverageTimingPolicy defaults() {
        return new CoverageTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofSeconds(1),
                5,
                20.0,
                10.0,
                Duration.ofDays(7),
                Duration.ofHours(1),
                Duration.ofHours(4),
                Duration.ofMinutes(30));
    }

    public CoverageTimingPolicy withFenceRadiusMeters(double radius) {
        return new CoverageTimingPolicy(pingInterval, pingTimeout, pingFailureThreshold, radius,
                minimumLocationAccuracyMeters, maxResendAge, defaultMaxSubSessionDuration,
                defaultMaxTotalDuration, insufficientAccuracyAutoStop);
    }

    public CoverageTimingPolicy withMinimumLocationAccuracyMeters(double accuracy) {
        return new CoverageTimingPolicy(pingInterval, pingTimeout, pingFailureThreshold, fenceRadiusMeters,
                accuracy, maxResendAge, defaultMaxSubSessionDuration,
                defaultMaxTotalDuration, insufficientAccuracyAutoStop);
    }

    public CoverageTimingPolicy withInsufficientAccuracyAutoStop(Duration autoStop) {
        return new CoverageTimingPolicy(pingInterval, pingTimeout, pingFailureThreshold, fenceRadiusMeters,
                minimumLocationAccuracyMeters, maxResendAge, defaultMaxSubSessionDuration,
                defaultMaxTotalDuration, autoStop);
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
