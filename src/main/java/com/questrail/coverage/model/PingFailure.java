package com.questrail.coverage.model;

/**
 * Why a ping attempt produced no round-trip time.
 */
public enum PingFailure {
    /** No reply arrived within the reply timeout. The ping session stays valid. */
    TIMED_OUT,
    /** The datagram could not be sent or the socket went down. */
    NETWORK_ISSUE,
    /** The server answered {@code RE01}; a new ping session is required. */
    NEEDS_REINITIALIZATION,
    /** A session initiation was still in progress when the tick fired. */
    SESSION_NOT_READY
}
