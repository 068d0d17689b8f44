package com.questrail.coverage.session;

import com.questrail.coverage.model.SessionToken;
import com.questrail.coverage.persistence.PersistedSessionsResender;
import com.questrail.coverage.ping.PingSessionInitiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a best-effort resend sweep before every token request, so sub-sessions
 * left over from earlier runs are delivered as soon as the network is back.
 * A failing sweep never prevents the token request.
 */
public final class ResendingSessionInitiator implements PingSessionInitiator {

    private static final Logger log = LoggerFactory.getLogger(ResendingSessionInitiator.class);

    private final PingSessionInitiator delegate;
    private final PersistedSessionsResender resender;
    private final Executor executor;

    public ResendingSessionInitiator(PingSessionInitiator delegate, PersistedSessionsResender resender, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.resender = Objects.requireNonNull(resender, "resender");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<SessionToken> requestToken() {
        return CompletableFuture
                .runAsync(() -> {
                    try {
                        resender.resendPersistentSessions(false);
                    } catch (RuntimeException e) {
                        log.warn("Resend sweep before session request failed: {}", e.toString());
                    }
                }, executor)
                .thenCompose(ignored -> delegate.requestToken());
    }
}
