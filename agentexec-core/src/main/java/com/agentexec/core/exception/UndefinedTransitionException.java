package com.agentexec.core.exception;

import com.agentexec.core.model.ExecutionState;

import java.time.Instant;
import java.util.List;

/**
 * Raised when a transition is attempted from a state it is not defined for.
 * Always recoverable: the context is left untouched.
 */
public class UndefinedTransitionException extends ExecutionEngineException {

    public static final String ERROR_CODE = "UNDEFINED_TRANSITION";

    private final ExecutionState fromState;
    private final ExecutionState toState;
    private final String reason;
    private final List<ExecutionState> validTransitions;
    private final String taskId;
    private final Instant timestamp;

    public UndefinedTransitionException(ExecutionState fromState, ExecutionState toState, String reason,
                                        List<ExecutionState> validTransitions, String taskId) {
        super(ERROR_CODE, String.format(
            "Undefined transition from %s to %s: %s",
            fromState, toState, reason
        ));
        this.fromState = fromState;
        this.toState = toState;
        this.reason = reason;
        this.validTransitions = List.copyOf(validTransitions);
        this.taskId = taskId;
        this.timestamp = Instant.now();
    }

    public ExecutionState getFromState() {
        return fromState;
    }

    public ExecutionState getToState() {
        return toState;
    }

    public String getReason() {
        return reason;
    }

    public List<ExecutionState> getValidTransitions() {
        return validTransitions;
    }

    public String getTaskId() {
        return taskId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
