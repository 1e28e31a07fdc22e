package com.agentexec.engine.statemachine;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.transition.Transition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Settings for a {@link StateMachineExecutor}.
 *
 * @param maxRetries              how many times VERIFYING may loop back to EXECUTING
 * @param allowFailFromAny        register a transition to FAILED for every non-terminal state
 * @param slowTransitionThreshold transitions slower than this are logged as warnings
 * @param customTransitions       extra transitions registered after the standard set
 * @param onStateChange           called after every successful transition
 * @param onError                 called with the error message after every failed transition
 */
public record StateMachineConfig(
    int maxRetries,
    boolean allowFailFromAny,
    Duration slowTransitionThreshold,
    List<Transition> customTransitions,
    StateChangeListener onStateChange,
    BiConsumer<String, ExecutionContext> onError
) {
    public StateMachineConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        customTransitions = List.copyOf(customTransitions);
    }

    public static StateMachineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for state machine settings.
     */
    public static class Builder {
        private int maxRetries = 3;
        private boolean allowFailFromAny = true;
        private Duration slowTransitionThreshold = Duration.ofSeconds(30);
        private final List<Transition> customTransitions = new ArrayList<>();
        private StateChangeListener onStateChange = (from, to, ctx) -> { };
        private BiConsumer<String, ExecutionContext> onError = (error, ctx) -> { };

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder allowFailFromAny(boolean allowFailFromAny) {
            this.allowFailFromAny = allowFailFromAny;
            return this;
        }

        public Builder slowTransitionThreshold(Duration threshold) {
            this.slowTransitionThreshold = threshold;
            return this;
        }

        public Builder customTransition(Transition transition) {
            this.customTransitions.add(transition);
            return this;
        }

        public Builder onStateChange(StateChangeListener listener) {
            this.onStateChange = listener;
            return this;
        }

        public Builder onError(BiConsumer<String, ExecutionContext> listener) {
            this.onError = listener;
            return this;
        }

        public StateMachineConfig build() {
            return new StateMachineConfig(maxRetries, allowFailFromAny, slowTransitionThreshold,
                customTransitions, onStateChange, onError);
        }
    }
}
