package com.agentexec.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a contract's conditions are checked.
 */
public enum VerificationMethod {
    RUNTIME("runtime"),
    PROPERTY_TEST("property-test"),
    FORMAL("formal"),
    HYBRID("hybrid");

    private final String value;

    VerificationMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static VerificationMethod fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VerificationMethod method : values()) {
            if (method.value.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        return null;
    }
}
