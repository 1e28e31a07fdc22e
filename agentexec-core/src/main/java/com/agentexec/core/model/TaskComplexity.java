package com.agentexec.core.model;

/**
 * Estimated complexity of a task, used to size research waves.
 */
public enum TaskComplexity {
    SIMPLE,
    MEDIUM,
    COMPLEX;

    /**
     * Number of parallel research roles dispatched for a task of this complexity.
     */
    public int researchAgentCount() {
        return switch (this) {
            case SIMPLE, MEDIUM -> 2;
            case COMPLEX -> 3;
        };
    }
}
