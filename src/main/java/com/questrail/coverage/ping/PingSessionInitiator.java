package com.questrail.coverage.ping;

import com.questrail.coverage.model.SessionToken;

import java.util.concurrent.CompletableFuture;

/**
 * Obtains the control-plane token a ping session is opened with.
 */
@FunctionalInterface
public interface PingSessionInitiator {

    CompletableFuture<SessionToken> requestToken();
}
