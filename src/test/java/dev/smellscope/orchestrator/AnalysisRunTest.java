package dev.smellscope.orchestrator;

import dev.smellscope.domain.enums.AnalysisOutcome;
import dev.smellscope.domain.enums.RequestState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisRunTest {

    @Test
    @DisplayName("walks PENDING → FANNING_OUT → AGGREGATING → COMPLETED")
    void happyPath() {
        AnalysisRun run = new AnalysisRun("r1");
        assertThat(run.state()).isEqualTo(RequestState.PENDING);

        run.advance(RequestState.FANNING_OUT);
        run.advance(RequestState.AGGREGATING);
        run.complete(AnalysisOutcome.PARTIAL_FAILURE);

        assertThat(run.state()).isEqualTo(RequestState.COMPLETED);
        assertThat(run.outcome()).isEqualTo(AnalysisOutcome.PARTIAL_FAILURE);
    }

    @Test
    @DisplayName("skipping a state is rejected")
    void cannotSkipStates() {
        AnalysisRun run = new AnalysisRun("r2");

        assertThatThrownBy(() -> run.advance(RequestState.AGGREGATING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PENDING");
    }

    @Test
    @DisplayName("a completed run cannot be completed again")
    void completedIsTerminal() {
        AnalysisRun run = new AnalysisRun("r3");
        run.advance(RequestState.FANNING_OUT);
        run.advance(RequestState.AGGREGATING);
        run.complete(AnalysisOutcome.COMPLETED);

        assertThatThrownBy(() -> run.complete(AnalysisOutcome.EMPTY_RESULT))
                .isInstanceOf(IllegalStateException.class);
    }
}
