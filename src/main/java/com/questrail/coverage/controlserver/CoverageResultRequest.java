package com.questrail.coverage.controlserver;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Body of {@code POST /coverageResult}: every fence of one sub-session.
 */
public record CoverageResultRequest(
        @JsonProperty("test_uuid") String testUuid,
        @JsonProperty("fences") List<FenceEntry> fences
) {
    public CoverageResultRequest {
        Objects.requireNonNull(testUuid, "testUuid");
        fences = List.copyOf(Objects.requireNonNull(fences, "fences"));
    }

    /**
     * One submitted fence. {@code durationMs} is present only for fences with an
     * exit time.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FenceEntry(
            @JsonProperty("timestamp_microseconds") long timestampMicroseconds,
            @JsonProperty("location") LocationEntry location,
            @JsonProperty("avg_ping_ms") Integer avgPingMs,
            @JsonProperty("offset_ms") long offsetMs,
            @JsonProperty("duration_ms") Long durationMs,
            @JsonProperty("technology") String technology,
            @JsonProperty("technology_id") Integer technologyId,
            @JsonProperty("radius_m") int radiusM
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LocationEntry(
            @JsonProperty("latitude") double latitude,
            @JsonProperty("longitude") double longitude,
            @JsonProperty("accuracy") Double accuracy
    ) {
    }
}
