package com.questrail.coverage.controlserver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.questrail.coverage.model.IpVersion;
import com.questrail.coverage.model.SessionToken;

import java.time.Duration;

/**
 * Body returned by {@code POST /coverageRequest}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoverageSessionResponse(
        @JsonProperty("test_uuid") String testUuid,
        @JsonProperty("ping_token") String pingToken,
        @JsonProperty("ping_host") String pingHost,
        @JsonProperty("ping_port") Integer pingPort,
        @JsonProperty("ip_version") Integer ipVersion,
        @JsonProperty("max_coverage_session_seconds") Long maxCoverageSessionSeconds,
        @JsonProperty("max_coverage_measurement_seconds") Long maxCoverageMeasurementSeconds
) {
    /**
     * Converts to a token, rejecting responses that lack a mandatory field.
     *
     * @param loopUuid the {@code loop_uuid} the request was sent with
     */
    public SessionToken toToken(String loopUuid) throws ControlServerException {
        if (isBlank(testUuid) || isBlank(pingToken) || isBlank(pingHost) || pingPort == null) {
            throw new ControlServerException("coverage session response is missing mandatory fields");
        }
        try {
            return new SessionToken(
                    testUuid,
                    pingToken,
                    pingHost,
                    pingPort,
                    IpVersion.fromWire(ipVersion),
                    loopUuid,
                    positiveSeconds(maxCoverageSessionSeconds),
                    positiveSeconds(maxCoverageMeasurementSeconds));
        } catch (IllegalArgumentException e) {
            throw new ControlServerException("coverage session response is invalid: " + e.getMessage(), e);
        }
    }

    private static Duration positiveSeconds(Long seconds) {
        return seconds == null || seconds <= 0 ? null : Duration.ofSeconds(seconds);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
