package com.questrail.coverage.controlserver;

import com.questrail.coverage.persistence.CoverageResultSubmitter;
import com.questrail.coverage.persistence.EpochMicros;
import com.questrail.coverage.persistence.FenceRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds {@code POST /coverageResult} bodies and sends them through a
 * {@link ControlServerApi}.
 *
 * <p>{@code offset_ms} is the fence's entry time relative to the sub-session
 * anchor, rounded to whole milliseconds; it is negative for fences recorded
 * before the token was confirmed.</p>
 */
public final class ControlServerResultSubmitter implements CoverageResultSubmitter {

    private final ControlServerApi api;

    public ControlServerResultSubmitter(ControlServerApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    @Override
    public void submit(String testUuid, Instant anchor, List<FenceRecord> fences) throws CoverageSubmissionException {
        if (testUuid == null) {
            throw new MissingTestUuidException();
        }
        Objects.requireNonNull(anchor, "anchor");
        api.submitCoverageResult(toRequest(testUuid, anchor, fences));
    }

    public static CoverageResultRequest toRequest(String testUuid, Instant anchor, List<FenceRecord> fences) {
        List<CoverageResultRequest.FenceEntry> entries = fences.stream()
                .sorted((a, b) -> a.dateEntered().compareTo(b.dateEntered()))
                .map(f -> toEntry(f, anchor))
                .collect(Collectors.toList());
        return new CoverageResultRequest(testUuid, entries);
    }

    static CoverageResultRequest.FenceEntry toEntry(FenceRecord fence, Instant anchor) {
        Long durationMs = fence.dateExited() == null
                ? null
                : roundMillis(Duration.between(fence.dateEntered(), fence.dateExited()));

        return new CoverageResultRequest.FenceEntry(
                EpochMicros.of(fence.dateEntered()),
                new CoverageResultRequest.LocationEntry(
                        fence.coordinate().latitude(),
                        fence.coordinate().longitude(),
                        fence.accuracy()),
                fence.avgPingMillis(),
                roundMillis(Duration.between(anchor, fence.dateEntered())),
                durationMs,
                fence.technology() == null ? null : fence.technology().code(),
                fence.technology() == null ? null : fence.technology().id(),
                (int) Math.round(fence.radiusMeters()));
    }

    static long roundMillis(Duration duration) {
        return Math.round(duration.toNanos() / 1_000_000.0);
    }
}
