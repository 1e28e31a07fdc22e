package com.agentexec.core.contract;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Conditions shared by most contracts.
 */
public final class StandardConditions {

    private StandardConditions() {
    }

    public static Condition hasInput(String key) {
        return Condition.precondition("pre-has-" + key, "Has " + key,
            ctx -> ctx.hasInput(key), "Input '" + key + "' is required");
    }

    public static Condition inputNotEmpty(String key) {
        return Condition.precondition("pre-" + key + "-not-empty", key + " not empty",
            ctx -> !isEmpty(ctx.getInput(key)), "Input '" + key + "' must not be empty");
    }

    public static Condition hasOutput(String key) {
        return Condition.postcondition("post-has-" + key, "Has " + key,
            ctx -> ctx.hasOutputs() && ctx.getOutputs().get(key) != null,
            "Output '" + key + "' was not produced");
    }

    public static Condition noError() {
        return Condition.postcondition("post-no-error", "No error",
            ctx -> !ctx.hasError(), "Execution finished with an error");
    }

    public static Condition validState() {
        return Condition.invariant("inv-valid-state", "Valid state",
            ctx -> ctx.getState() != null,
            "Context is in an unknown state");
    }

    /**
     * Fails when the context ran longer than {@code timeoutMs}, measured to its end time or now.
     */
    public static Condition withinTimeout(long timeoutMs) {
        return Condition.postcondition("post-within-timeout", "Within timeout",
            ctx -> {
                Instant end = ctx.getEndTime() != null ? ctx.getEndTime() : Instant.now();
                return Duration.between(ctx.getStartTime(), end).toMillis() <= timeoutMs;
            },
            "Execution exceeded " + timeoutMs + "ms");
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return value.toString().isBlank();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }
}
