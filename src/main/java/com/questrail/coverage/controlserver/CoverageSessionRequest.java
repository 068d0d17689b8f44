package com.questrail.coverage.controlserver;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Body of {@code POST /coverageRequest}.
 *
 * @param time     client wall clock in epoch milliseconds
 * @param loopUuid {@code test_uuid} of the sub-session being continued, omitted for the first one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CoverageSessionRequest(
        @JsonProperty("time") long time,
        @JsonProperty("measurement_type") String measurementType,
        @JsonProperty("loop_uuid") String loopUuid
) {
    public static final String DEDICATED = "dedicated";

    public CoverageSessionRequest {
        Objects.requireNonNull(measurementType, "measurementType");
    }

    public static CoverageSessionRequest dedicated(long time, String loopUuid) {
        return new CoverageSessionRequest(time, DEDICATED, loopUuid);
    }
}
