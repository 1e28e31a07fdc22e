package com.agentexec.core.contract;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of evaluating a contract's conditions against a context.
 * Warning-severity failures are reported but do not fail the evaluation.
 */
public record ContractEvaluationResult(
    boolean success,
    String contractId,
    List<ConditionResult> results,
    List<ConditionResult> failures,
    List<ConditionResult> warnings,
    Instant evaluatedAt,
    long durationMs
) {
    public static ContractEvaluationResult of(String contractId, List<ConditionResult> results,
                                              Instant start, long durationMs) {
        List<ConditionResult> failures = results.stream().filter(ConditionResult::blocking).toList();
        List<ConditionResult> warnings = results.stream()
            .filter(r -> !r.passed() && r.severity() == ConditionSeverity.WARNING)
            .toList();
        return new ContractEvaluationResult(failures.isEmpty(), contractId, List.copyOf(results),
            failures, warnings, start, durationMs);
    }
}
