package com.questrail.coverage.controlserver;

/**
 * Request/response contract of the measurement control server.
 */
public interface ControlServerApi {

    /**
     * {@code POST /coverageRequest}.
     */
    CoverageSessionResponse requestCoverageSession(CoverageSessionRequest request) throws ControlServerException;

    /**
     * {@code POST /coverageResult}. Returns normally only for a 2xx status.
     */
    void submitCoverageResult(CoverageResultRequest request) throws CoverageSubmissionException;
}
