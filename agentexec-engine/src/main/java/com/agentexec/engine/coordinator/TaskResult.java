package com.agentexec.engine.coordinator;

import com.agentexec.core.model.ExecutionState;

import java.util.Map;

/**
 * Outcome of one wave task.
 *
 * @param id               task id
 * @param success          true when the task's state machine completed
 * @param error            failure description, null on success
 * @param finalState       last state reached, null if the task never started
 * @param outputs          context outputs
 * @param providerMetadata pass-through metadata from the prompt executor
 */
public record TaskResult(
    String id,
    boolean success,
    String error,
    ExecutionState finalState,
    Map<String, Object> outputs,
    Map<String, Object> providerMetadata
) {
    public static TaskResult failed(String id, String error) {
        return new TaskResult(id, false, error, null, Map.of(), Map.of());
    }
}
