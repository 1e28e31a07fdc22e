package com.agentexec.core.contract;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which phase of a task a condition guards.
 */
public enum ConditionType {
    /** Must hold before the task runs. */
    PRECONDITION("precondition"),
    /** Must hold after the task ran. */
    POSTCONDITION("postcondition"),
    /** Must hold throughout. */
    INVARIANT("invariant");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
