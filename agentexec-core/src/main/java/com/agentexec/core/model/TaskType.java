package com.agentexec.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of agent task a contract can describe.
 */
public enum TaskType {
    IMPLEMENT_FEATURE("implement_feature"),
    FIX_BUG("fix_bug"),
    REFACTOR("refactor"),
    TEST("test"),
    REVIEW("review"),
    DEPLOY("deploy"),
    /**
     * Matches every task type when looking up applicable contracts.
     */
    CUSTOM("custom");

    private final String value;

    TaskType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolve a wire value; returns {@code null} for anything outside the fixed set.
     */
    @JsonCreator
    public static TaskType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TaskType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
