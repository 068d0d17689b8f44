package com.questrail.coverage.ping;

import java.util.Objects;

/**
 * Decoded server reply to a ping request.
 *
 * @param sequence sequence number echoed by the server, as an unsigned 32-bit value
 */
public record PingReply(Kind kind, long sequence) {

    public enum Kind {
        /** {@code RR01}: the ping was answered. */
        SUCCESS,
        /** {@code RE01}: the server rejected the session token. */
        ERROR
    }

    public PingReply {
        Objects.requireNonNull(kind, "kind");
        if (sequence < 0 || sequence > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("sequence must be an unsigned 32-bit value");
        }
    }
}
