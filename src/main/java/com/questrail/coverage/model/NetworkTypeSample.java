package com.questrail.coverage.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Change notification from the network-type monitor.
 */
public record NetworkTypeSample(NetworkType type, Instant timestamp) {

    public NetworkTypeSample {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
