package com.agentexec.engine.statemachine;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionState;

import java.util.List;

/**
 * Outcome of driving a context through the full lifecycle.
 */
public record ExecutionResult(
    ExecutionState finalState,
    boolean success,
    ExecutionContext context,
    List<HistoryEntry> history,
    long totalDurationMs,
    int retryCount,
    String error
) {
    public ExecutionResult {
        history = List.copyOf(history);
    }
}
