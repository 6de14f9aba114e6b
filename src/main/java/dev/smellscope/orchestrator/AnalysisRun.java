package dev.smellscope.orchestrator;

import dev.smellscope.domain.enums.AnalysisOutcome;
import dev.smellscope.domain.enums.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request state machine. Confined to the thread running the orchestration.
 */
final class AnalysisRun {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRun.class);

    private final String requestId;
    private RequestState state = RequestState.PENDING;
    private AnalysisOutcome outcome;

    AnalysisRun(String requestId) {
        this.requestId = requestId;
    }

    void advance(RequestState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Request %s cannot move from %s to %s".formatted(requestId, state, next));
        }
        log.debug("Request {}: {} → {}", requestId, state, next);
        state = next;
    }

    void complete(AnalysisOutcome outcome) {
        advance(RequestState.COMPLETED);
        this.outcome = outcome;
    }

    RequestState state() {
        return state;
    }

    AnalysisOutcome outcome() {
        return outcome;
    }
}
