package com.questrail.coverage.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * PingOutcome
 * -----------------------------------------------------------------------------
 * Result of one pacer tick: either a measured round-trip time or a failure.
 *
 * <p>{@code timestamp} is the wall-clock instant at which the ping was sent, which
 * is what fence attribution compares against fence boundaries.</p>
 */
public record PingOutcome(Instant timestamp, Duration roundTrip, PingFailure failure) {

    public PingOutcome {
        Objects.requireNonNull(timestamp, "timestamp");
        if ((roundTrip == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of roundTrip and failure must be set");
        }
        if (roundTrip != null && roundTrip.isNegative()) {
            throw new IllegalArgumentException("roundTrip must be non-negative");
        }
    }

    public static PingOutcome success(Instant timestamp, Duration roundTrip) {
        return new PingOutcome(timestamp, Objects.requireNonNull(roundTrip, "roundTrip"), null);
    }

    public static PingOutcome error(Instant timestamp, PingFailure failure) {
        return new PingOutcome(timestamp, null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return roundTrip != null;
    }

    public Optional<Duration> roundTripTime() {
        return Optional.ofNullable(roundTrip);
    }
}
