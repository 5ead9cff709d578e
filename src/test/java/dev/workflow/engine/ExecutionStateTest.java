package dev.workflow.engine;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionStateTest {

    @Test
    void initializesCorrectly() {
        var state = new ExecutionState("e1", "sha256:abc", null);

        assertThat(state.executionId()).isEqualTo("e1");
        assertThat(state.workflowHash()).isEqualTo("sha256:abc");
        assertThat(state.stepCount()).isZero();
        assertThat(state.nextAttempt("lint")).isEqualTo(1);
        assertThat(state.fastForwarding()).isFalse();
    }

    @Test
    void countsVisitedSteps() {
        var state = new ExecutionState("e1", "sha256:abc", null);

        assertThat(state.visitStep()).isEqualTo(1);
        assertThat(state.visitStep()).isEqualTo(2);
        assertThat(state.stepCount()).isEqualTo(2);
    }

    @Test
    void attemptsArePerStepId() {
        var state = new ExecutionState("e1", "sha256:abc", null);

        assertThat(state.nextAttempt("lint")).isEqualTo(1);
        assertThat(state.nextAttempt("lint")).isEqualTo(2);
        assertThat(state.nextAttempt("test")).isEqualTo(1);
        assertThat(state.nextAttempt("lint")).isEqualTo(3);
    }

    @Test
    void fastForwardEndsAtCheckpoint() {
        var state = new ExecutionState("e1", "sha256:abc",
            new ResumeTarget(null, Set.of()));

        assertThat(state.fastForwarding()).isTrue();
        state.reachedCheckpoint();
        assertThat(state.fastForwarding()).isFalse();
        assertThat(state.fastForwardTarget()).isNull();
    }
}
