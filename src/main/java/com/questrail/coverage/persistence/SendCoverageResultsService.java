package com.questrail.coverage.persistence;

import com.questrail.coverage.controlserver.CoverageSubmissionException;
import com.questrail.coverage.model.ActiveSubSession;
import com.questrail.coverage.model.Fence;

import java.util.List;

/**
 * Submits the fences of a finished measurement.
 */
public interface SendCoverageResultsService {

    /**
     * @param subSession the sub-session the run was in when it finished, as
     *                   seen by the engine that recorded {@code fences}
     */
    void send(ActiveSubSession subSession, List<Fence> fences) throws CoverageSubmissionException;
}
