package com.agentexec.core.model;

public enum SessionStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED,
    /**
     * No progress within the stale threshold; eligible for resume.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABANDONED;
    }
}
