package com.questrail.coverage.persistence;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A persisted sub-session with its fences, ordered by {@code dateEntered}.
 *
 * @param testUuid    {@code null} while the sub-session's token is unknown
 * @param anchorAt    instant the token was confirmed, {@code null} with {@code testUuid}
 * @param finalizedAt {@code null} while the sub-session is still collecting fences
 */
public record StoredSession(
        long id,
        String testUuid,
        String loopUuid,
        Instant startedAt,
        Instant anchorAt,
        Instant finalizedAt,
        List<FenceRecord> fences
) {
    public StoredSession {
        Objects.requireNonNull(startedAt, "startedAt");
        fences = List.copyOf(Objects.requireNonNull(fences, "fences"));
    }

    public boolean isFinalized() {
        return finalizedAt != null;
    }

    /**
     * Instant the max-resend-age cutoff is compared against.
     */
    public Instant ageReference() {
        return finalizedAt != null ? finalizedAt : startedAt;
    }

    public Optional<Instant> earliestFence() {
        return fences.stream().map(FenceRecord::dateEntered).min(Comparator.naturalOrder());
    }

    public Optional<Instant> latestFenceActivity() {
        return fences.stream()
                .map(f -> f.dateExited() != null ? f.dateExited() : f.dateEntered())
                .max(Comparator.naturalOrder());
    }
}
