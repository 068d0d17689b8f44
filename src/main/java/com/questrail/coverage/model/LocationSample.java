package com.questrail.coverage.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A position fix delivered by the location source.
 *
 * @param horizontalAccuracy radius of uncertainty in meters; larger is worse
 */
public record LocationSample(Coordinate coordinate, double horizontalAccuracy, Instant timestamp) {

    public LocationSample {
        Objects.requireNonNull(coordinate, "coordinate");
        Objects.requireNonNull(timestamp, "timestamp");
        if (Double.isNaN(horizontalAccuracy) || horizontalAccuracy < 0) {
            throw new IllegalArgumentException("horizontalAccuracy must be >= 0");
        }
    }

    public static LocationSample of(double latitude, double longitude, double horizontalAccuracy, Instant timestamp) {
        return new LocationSample(new Coordinate(latitude, longitude), horizontalAccuracy, timestamp);
    }
}
