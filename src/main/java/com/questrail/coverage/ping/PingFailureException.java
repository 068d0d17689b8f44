package com.questrail.coverage.ping;

import com.questrail.coverage.model.PingFailure;

import java.util.Objects;

/**
 * Completes a ping future exceptionally. The {@link PingFailure} tells the pacer
 * whether the session is still usable.
 */
public final class PingFailureException extends RuntimeException {

    private final PingFailure failure;

    public PingFailureException(PingFailure failure, String message) {
        this(failure, message, null);
    }

    public PingFailureException(PingFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public PingFailure failure() {
        return failure;
    }

    /**
     * Extracts the failure reason from a future's exception, unwrapping
     * completion wrappers. Anything that is not a {@code PingFailureException}
     * counts as a network issue.
     */
    public static PingFailure reasonOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PingFailureException pfe) {
                return pfe.failure();
            }
            current = current.getCause();
        }
        return PingFailure.NETWORK_ISSUE;
    }
}
