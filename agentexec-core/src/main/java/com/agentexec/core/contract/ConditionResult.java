package com.agentexec.core.contract;

import java.time.Instant;

/**
 * Outcome of evaluating one condition against one context.
 */
public record ConditionResult(
    boolean passed,
    String conditionId,
    String conditionName,
    ConditionType type,
    String errorMessage,
    ConditionSeverity severity,
    Instant evaluatedAt,
    long durationMs
) {
    public boolean blocking() {
        return !passed && severity == ConditionSeverity.ERROR;
    }
}
