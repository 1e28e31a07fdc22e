package com.agentexec.engine.contract;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a validation issue. Only ERROR makes a contract invalid.
 */
public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
