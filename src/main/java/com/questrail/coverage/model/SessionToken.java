package com.questrail.coverage.model;

import java.time.Duration;
import java.util.Objects;

/**
 * SessionToken
 * -----------------------------------------------------------------------------
 * Control-plane grant for one coverage sub-session.
 *
 * @param testUuid               identifier the sub-session's fences are submitted under
 * @param pingToken              opaque Base64 token appended to every ping request
 * @param loopUuid               {@code testUuid} of the preceding sub-session, if chained
 * @param maxSessionDuration     total run limit announced by the server, may be {@code null}
 * @param maxMeasurementDuration sub-session limit announced by the server, may be {@code null}
 */
public record SessionToken(
        String testUuid,
        String pingToken,
        String pingHost,
        int pingPort,
        IpVersion ipVersion,
        String loopUuid,
        Duration maxSessionDuration,
        Duration maxMeasurementDuration
) {
    public SessionToken {
        Objects.requireNonNull(testUuid, "testUuid");
        Objects.requireNonNull(pingToken, "pingToken");
        Objects.requireNonNull(pingHost, "pingHost");
        Objects.requireNonNull(ipVersion, "ipVersion");
        if (pingPort < 1 || pingPort > 65535) {
            throw new IllegalArgumentException("pingPort out of range: " + pingPort);
        }
    }
}
