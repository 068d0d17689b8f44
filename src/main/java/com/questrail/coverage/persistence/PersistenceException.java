package com.questrail.coverage.persistence;

/**
 * Failure of the embedded fence store. Callers log it and carry on; in-memory
 * measurement state is never affected.
 */
public final class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
