package com.questrail.coverage.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The sub-session whose token is currently in use, with the instant the token
 * was confirmed. Fence offsets are computed relative to {@code anchor}.
 */
public record ActiveSubSession(String testUuid, Instant anchor) {

    public ActiveSubSession {
        Objects.requireNonNull(testUuid, "testUuid");
        Objects.requireNonNull(anchor, "anchor");
    }
}
