package com.agentexec.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recommended way to continue from a checkpoint.
 */
public enum ResumeAction {
    /** Continue from the checkpointed step. */
    RESUME,
    /** Start the step over from scratch. */
    RETRY,
    /** Skip the checkpointed step and move on. */
    SKIP,
    /** Stop; human attention needed. */
    ABORT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
