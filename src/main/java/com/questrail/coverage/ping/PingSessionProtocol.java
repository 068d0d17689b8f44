package com.questrail.coverage.ping;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * PingSessionProtocol
 * -----------------------------------------------------------------------------
 * Request/reply echo protocol used by {@link PingPacer}.
 *
 * <p>Futures returned by {@link #sendPing} complete with the round-trip time or
 * exceptionally with a {@link PingFailureException}.</p>
 */
public interface PingSessionProtocol {

    /**
     * Obtains a new token and opens a ping session with it. Any previous session
     * is closed.
     */
    CompletableFuture<PingSessionHandle> initiateSession();

    /**
     * Sends one ping. Several pings may be outstanding at the same time.
     */
    CompletableFuture<Duration> sendPing(PingSessionHandle session);

    /**
     * Closes the current session, failing any outstanding pings.
     */
    void close();
}
