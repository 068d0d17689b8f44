package com.questrail.coverage.controlserver;

/**
 * Submitting a sub-session's fences failed. The fences stay persisted and are
 * retried by the next resend sweep.
 */
public class CoverageSubmissionException extends Exception {

    private final int statusCode;

    public CoverageSubmissionException(String message) {
        this(message, -1, null);
    }

    public CoverageSubmissionException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status received, or -1 if no response arrived.
     */
    public int statusCode() {
        return statusCode;
    }
}
