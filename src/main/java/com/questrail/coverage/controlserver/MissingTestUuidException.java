package com.questrail.coverage.controlserver;

/**
 * Fences were handed over for submission while no sub-session token was known.
 */
public final class MissingTestUuidException extends CoverageSubmissionException {

    public MissingTestUuidException() {
        super("no test_uuid is known for the current measurement");
    }
}
