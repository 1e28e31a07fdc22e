package com.agentexec.core.model;

/**
 * Kind of work a step performs.
 */
public enum StepType {
    VALIDATION,
    EXECUTION,
    QUALITY_GATE,
    CHECKPOINT,
    TRANSITION;

    /**
     * Steps whose completion is always followed by an automatic checkpoint.
     */
    public boolean checkpointsOnCompletion() {
        return this == EXECUTION || this == QUALITY_GATE;
    }
}
