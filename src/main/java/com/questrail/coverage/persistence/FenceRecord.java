package com.questrail.coverage.persistence;

import com.questrail.coverage.model.Coordinate;
import com.questrail.coverage.model.Fence;
import com.questrail.coverage.model.RadioTechnology;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The part of a {@link Fence} that is stored and submitted. Pings are reduced to
 * their average and technologies to the significant one.
 *
 * @param accuracy       horizontal accuracy of the starting location in meters
 * @param avgPingMillis  {@code null} when no successful ping was attributed
 * @param technology     {@code null} when no technology sample was taken
 * @param dateExited     {@code null} for a fence that was never closed
 */
public record FenceRecord(
        UUID fenceId,
        Instant dateEntered,
        Coordinate coordinate,
        Double accuracy,
        Integer avgPingMillis,
        RadioTechnology technology,
        Instant dateExited,
        double radiusMeters
) {
    public FenceRecord {
        Objects.requireNonNull(fenceId, "fenceId");
        Objects.requireNonNull(dateEntered, "dateEntered");
        Objects.requireNonNull(coordinate, "coordinate");
    }

    public static FenceRecord from(Fence fence) {
        return new FenceRecord(
                fence.id(),
                fence.dateEntered(),
                fence.startingLocation().coordinate(),
                fence.startingLocation().horizontalAccuracy(),
                fence.averagePingMillis().isPresent() ? fence.averagePingMillis().getAsInt() : null,
                fence.significantTechnology().orElse(null),
                fence.dateExited(),
                fence.radiusMeters());
    }
}
