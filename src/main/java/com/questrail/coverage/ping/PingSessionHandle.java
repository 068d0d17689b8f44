package com.questrail.coverage.ping;

import com.questrail.coverage.model.SessionToken;

import java.util.Objects;

/**
 * Opaque reference to an established ping session. A handle outlives its session:
 * once the session is replaced or invalidated, pings sent with it fail with
 * {@code NEEDS_REINITIALIZATION}.
 */
public record PingSessionHandle(long generation, SessionToken token) {

    public PingSessionHandle {
        Objects.requireNonNull(token, "token");
    }
}
