package com.agentexec.engine.statemachine;

import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.transition.TransitionResult;

import java.time.Instant;

/**
 * One transition attempt recorded during a lifecycle run.
 */
public record HistoryEntry(
    String transitionId,
    String transitionName,
    ExecutionState fromState,
    ExecutionState toState,
    boolean success,
    long durationMs,
    Instant timestamp,
    String error,
    int retryAttempt
) {
    public static HistoryEntry from(TransitionResult result, String name, int retryAttempt) {
        return new HistoryEntry(result.transitionId(), name, result.fromState(), result.toState(),
            result.success(), result.durationMs(), result.timestamp(), result.error(), retryAttempt);
    }
}
