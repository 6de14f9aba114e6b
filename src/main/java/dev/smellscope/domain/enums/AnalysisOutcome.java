package dev.smellscope.domain.enums;

import dev.smellscope.domain.valueobject.BackendStatus;

import java.util.Collection;

/**
 * Terminal outcome of a completed analysis. None of these is a failure from
 * the caller's point of view: a single backend outage still yields a result.
 */
public enum AnalysisOutcome {
    COMPLETED, PARTIAL_FAILURE, EMPTY_RESULT;

    /**
     * @param attempted statuses of the detectors that were actually called
     */
    public static AnalysisOutcome from(Collection<BackendStatus> attempted) {
        long succeeded = attempted.stream().filter(BackendStatus::isSuccess).count();
        if (succeeded == 0) return EMPTY_RESULT;
        return succeeded == attempted.size() ? COMPLETED : PARTIAL_FAILURE;
    }
}
