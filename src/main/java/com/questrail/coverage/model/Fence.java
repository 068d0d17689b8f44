package com.questrail.coverage.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Fence
 * =============================================================================
 * A geographic cell the device stayed in for a while, together with the pings
 * and radio technologies observed there.
 *
 * <h2>Lifecycle</h2>
 * A fence is created open ({@code dateExited == null}) when a qualifying location
 * arrives, grows while open, and is closed when the device leaves its radius or
 * the measurement stops. Only the fence segmentation engine creates new versions;
 * every mutation returns a new instance, so fences can be handed to persistence
 * and submission threads without copying.
 *
 * <h2>Session ownership</h2>
 * {@code sessionUuid} is the {@code test_uuid} of the sub-session the fence will
 * be submitted under. It is {@code null} until a session token is known.
 */
public record Fence(
        UUID id,
        LocationSample startingLocation,
        Instant dateEntered,
        Instant dateExited,
        List<LocationSample> locations,
        List<PingOutcome> pings,
        List<RadioTechnology> technologies,
        double radiusMeters,
        String sessionUuid
) {
    public Fence {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(startingLocation, "startingLocation");
        Objects.requireNonNull(dateEntered, "dateEntered");
        locations = List.copyOf(Objects.requireNonNull(locations, "locations"));
        pings = List.copyOf(Objects.requireNonNull(pings, "pings"));
        technologies = List.copyOf(Objects.requireNonNull(technologies, "technologies"));
        if (!(radiusMeters > 0)) {
            throw new IllegalArgumentException("radiusMeters must be > 0");
        }
        if (dateExited != null && dateExited.isBefore(dateEntered)) {
            throw new IllegalArgumentException("dateExited must not precede dateEntered");
        }
    }

    /**
     * Opens a new fence at {@code location}.
     */
    public static Fence openAt(LocationSample location,
                               RadioTechnology technology,
                               double radiusMeters,
                               String sessionUuid) {
        return new Fence(
                UUID.randomUUID(),
                location,
                location.timestamp(),
                null,
                List.of(location),
                List.of(),
                technology == null ? List.of() : List.of(technology),
                radiusMeters,
                sessionUuid);
    }

    public boolean isOpen() {
        return dateExited == null;
    }

    /**
     * {@code true} if {@code timestamp} lies in {@code [dateEntered, dateExited)},
     * or at/after {@code dateEntered} for an open fence.
     */
    public boolean covers(Instant timestamp) {
        return !timestamp.isBefore(dateEntered) && (dateExited == null || timestamp.isBefore(dateExited));
    }

    /**
     * Rounded mean of the successful round-trip times in milliseconds, empty if
     * no successful ping was attributed.
     */
    public OptionalInt averagePingMillis() {
        long count = 0;
        double totalMillis = 0;
        for (PingOutcome ping : pings) {
            if (ping.isSuccess()) {
                totalMillis += ping.roundTrip().toNanos() / 1_000_000.0;
                count++;
            }
        }
        if (count == 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) Math.round(totalMillis / count));
    }

    /**
     * Last technology sample (last write wins).
     */
    public Optional<RadioTechnology> significantTechnology() {
        return technologies.isEmpty()
                ? Optional.empty()
                : Optional.of(technologies.get(technologies.size() - 1));
    }

    public Optional<Duration> duration() {
        return dateExited == null ? Optional.empty() : Optional.of(Duration.between(dateEntered, dateExited));
    }

    public Fence withLocation(LocationSample location, RadioTechnology technology) {
        List<LocationSample> newLocations = new ArrayList<>(locations);
        newLocations.add(location);
        List<RadioTechnology> newTechnologies = technologies;
        if (technology != null) {
            newTechnologies = new ArrayList<>(technologies);
            newTechnologies.add(technology);
        }
        return new Fence(id, startingLocation, dateEntered, dateExited,
                newLocations, pings, newTechnologies, radiusMeters, sessionUuid);
    }

    public Fence withPing(PingOutcome ping) {
        List<PingOutcome> newPings = new ArrayList<>(pings);
        newPings.add(ping);
        return new Fence(id, startingLocation, dateEntered, dateExited,
                locations, newPings, technologies, radiusMeters, sessionUuid);
    }

    public Fence exitedAt(Instant exit) {
        return new Fence(id, startingLocation, dateEntered, exit,
                locations, pings, technologies, radiusMeters, sessionUuid);
    }

    public Fence withSessionUuid(String newSessionUuid) {
        return new Fence(id, startingLocation, dateEntered, dateExited,
                locations, pings, technologies, radiusMeters, newSessionUuid);
    }
}
