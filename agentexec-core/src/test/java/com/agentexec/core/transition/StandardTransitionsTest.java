package com.agentexec.core.transition;

import com.agentexec.core.model.ExecutionState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardTransitionsTest {

    @Test
    void retryFromVerification_isTheOnlyRetryTransition() {
        List<Transition> retries = StandardTransitions.all().stream().filter(Transition::isRetry).toList();

        assertThat(retries).extracting(Transition::getId)
            .containsExactly(StandardTransitions.RETRY_FROM_VERIFICATION);
    }

    @Test
    void failFamily_coversEveryNonTerminalState() {
        assertThat(StandardTransitions.all())
            .filteredOn(t -> t.getTo() == ExecutionState.FAILED)
            .extracting(Transition::getId)
            .containsExactlyInAnyOrder("idle-to-failed", "planning-to-failed", "executing-to-failed",
                "verifying-to-failed", "committing-to-failed");
    }

    @Test
    void fail_fromTerminalState_isRejected() {
        assertThatThrownBy(() -> StandardTransitions.fail(ExecutionState.COMPLETED))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void canTransitionFrom_isTrueOnlyForFrom() {
        Transition transition = StandardTransitions.startCommit();

        for (ExecutionState state : ExecutionState.values()) {
            assertThat(transition.canTransitionFrom(state)).isEqualTo(state == ExecutionState.VERIFYING);
        }
    }
}
