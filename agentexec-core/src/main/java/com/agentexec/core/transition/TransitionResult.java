package com.agentexec.core.transition;

import com.agentexec.core.model.ExecutionState;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one transition attempt.
 *
 * @param success          whether the context is now in {@code toState}
 * @param transitionId     transition that was attempted
 * @param fromState        state the context was in when the attempt started
 * @param toState          target state of the transition
 * @param durationMs       wall time of the attempt
 * @param timestamp        when the attempt started
 * @param errorCode        one of the {@code *_FAILED} codes or UNDEFINED_TRANSITION
 * @param error            failure message
 * @param validTransitions for an undefined transition, the only state it may fire from
 * @param rolledBack       whether a rollback action ran to completion
 * @param rollbackError    rollback failure message; the original error is kept in {@code error}
 */
public record TransitionResult(
    boolean success,
    String transitionId,
    ExecutionState fromState,
    ExecutionState toState,
    long durationMs,
    Instant timestamp,
    String errorCode,
    String error,
    List<ExecutionState> validTransitions,
    boolean rolledBack,
    String rollbackError
) {
    public static final String UNDEFINED_TRANSITION = "UNDEFINED_TRANSITION";
    public static final String GUARD_FAILED = "GUARD_FAILED";
    public static final String PRE_ACTION_FAILED = "PRE_ACTION_FAILED";
    public static final String POST_ACTION_FAILED = "POST_ACTION_FAILED";
    public static final String TRANSITION_TIMEOUT = "TRANSITION_TIMEOUT";

    public static TransitionResult succeeded(String transitionId, ExecutionState from, ExecutionState to,
                                             Instant start, long durationMs) {
        return new TransitionResult(true, transitionId, from, to, durationMs, start, null, null,
            List.of(), false, null);
    }

    public static TransitionResult failed(String transitionId, ExecutionState from, ExecutionState to,
                                          Instant start, long durationMs, String errorCode, String error) {
        return new TransitionResult(false, transitionId, from, to, durationMs, start, errorCode, error,
            List.of(), false, null);
    }

    public TransitionResult withRollback(boolean wasRolledBack, String rollbackFailure) {
        return new TransitionResult(success, transitionId, fromState, toState, durationMs, timestamp,
            errorCode, error, validTransitions, wasRolledBack, rollbackFailure);
    }

    public TransitionResult withValidTransitions(List<ExecutionState> states) {
        return new TransitionResult(success, transitionId, fromState, toState, durationMs, timestamp,
            errorCode, error, List.copyOf(states), rolledBack, rollbackError);
    }
}
