package com.questrail.coverage.controlserver;

/**
 * A control-plane session request could not be completed: the server was not
 * reachable, answered with a non-2xx status, or returned an unusable body.
 */
public class ControlServerException extends Exception {

    private final int statusCode;

    public ControlServerException(String message) {
        this(message, -1, null);
    }

    public ControlServerException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ControlServerException(String message, int statusCode, Throwable cause) {
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
