package com.agentexec.engine.statemachine;

import com.agentexec.core.contract.ConditionPredicate;
import com.agentexec.core.transition.TransitionAction;

/**
 * Phase callbacks for a full lifecycle run. Missing handlers are no-ops; a missing
 * verifier counts as a pass.
 */
public final class ExecutionHandlers {

    private static final TransitionAction NO_OP = ctx -> { };

    private final TransitionAction onPlanning;
    private final TransitionAction onExecuting;
    private final ConditionPredicate onVerifying;
    private final TransitionAction onCommitting;

    private ExecutionHandlers(Builder builder) {
        this.onPlanning = builder.onPlanning;
        this.onExecuting = builder.onExecuting;
        this.onVerifying = builder.onVerifying;
        this.onCommitting = builder.onCommitting;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ExecutionHandlers none() {
        return builder().build();
    }

    public TransitionAction onPlanning() {
        return onPlanning;
    }

    public TransitionAction onExecuting() {
        return onExecuting;
    }

    /**
     * @return the verifier, or {@code null} when verification always passes
     */
    public ConditionPredicate onVerifying() {
        return onVerifying;
    }

    public TransitionAction onCommitting() {
        return onCommitting;
    }

    /**
     * Builder for handlers.
     */
    public static class Builder {
        private TransitionAction onPlanning = NO_OP;
        private TransitionAction onExecuting = NO_OP;
        private ConditionPredicate onVerifying;
        private TransitionAction onCommitting = NO_OP;

        public Builder onPlanning(TransitionAction handler) {
            this.onPlanning = handler;
            return this;
        }

        public Builder onExecuting(TransitionAction handler) {
            this.onExecuting = handler;
            return this;
        }

        public Builder onVerifying(ConditionPredicate verifier) {
            this.onVerifying = verifier;
            return this;
        }

        public Builder onCommitting(TransitionAction handler) {
            this.onCommitting = handler;
            return this;
        }

        public ExecutionHandlers build() {
            return new ExecutionHandlers(this);
        }
    }
}
