package com.questrail.coverage.persistence;

import com.questrail.coverage.controlserver.CoverageSubmissionException;

import java.time.Instant;
import java.util.List;

/**
 * Delivers one sub-session's fences. Returns normally only if the server
 * confirmed receipt.
 */
@FunctionalInterface
public interface CoverageResultSubmitter {

    void submit(String testUuid, Instant anchor, List<FenceRecord> fences) throws CoverageSubmissionException;
}
