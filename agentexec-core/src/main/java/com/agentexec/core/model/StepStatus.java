package com.agentexec.core.model;

/**
 * Lifecycle status of a single step.
 */
public enum StepStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
