package com.agentexec.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for a unit of agent work.
 * Transitions follow a strict state machine; VERIFYING -> EXECUTING is the only cycle.
 */
public enum ExecutionState {
    /**
     * Admitted but not yet planned.
     * Transitions: -> PLANNING, FAILED
     */
    IDLE,

    /**
     * Agent is producing a plan for the task.
     * Transitions: -> EXECUTING, FAILED
     */
    PLANNING,

    /**
     * Agent is executing the plan.
     * Transitions: -> VERIFYING, FAILED
     */
    EXECUTING,

    /**
     * Outputs are being checked against postconditions.
     * Transitions: -> COMMITTING, EXECUTING (retry), FAILED
     */
    VERIFYING,

    /**
     * Verified outputs are being persisted.
     * Transitions: -> COMPLETED, FAILED
     */
    COMMITTING,

    /**
     * Successfully finished. Terminal state.
     */
    COMPLETED,

    /**
     * Gave up. Terminal state.
     */
    FAILED;

    /**
     * Check if this state is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionState target) {
        return switch (this) {
            case IDLE -> target == PLANNING || target == FAILED;
            case PLANNING -> target == EXECUTING || target == FAILED;
            case EXECUTING -> target == VERIFYING || target == FAILED;
            case VERIFYING -> target == COMMITTING || target == EXECUTING || target == FAILED;
            case COMMITTING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * All states reachable from this state in one transition.
     */
    public Set<ExecutionState> validTargets() {
        Set<ExecutionState> targets = EnumSet.noneOf(ExecutionState.class);
        for (ExecutionState candidate : values()) {
            if (canTransitionTo(candidate)) {
                targets.add(candidate);
            }
        }
        return targets;
    }
}
