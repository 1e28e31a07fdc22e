package com.agentexec.engine.contract;

import java.time.Instant;
import java.util.List;

/**
 * Full validation report for one contract. {@code valid} is true iff {@code errorCount == 0}.
 */
public record ValidationResult(
    boolean valid,
    String contractId,
    List<ValidationIssue> issues,
    int errorCount,
    int warningCount,
    int infoCount,
    Instant validatedAt
) {
    public static ValidationResult of(String contractId, List<ValidationIssue> issues) {
        int errors = count(issues, ValidationSeverity.ERROR);
        int warnings = count(issues, ValidationSeverity.WARNING);
        int infos = count(issues, ValidationSeverity.INFO);
        return new ValidationResult(errors == 0, contractId, List.copyOf(issues), errors, warnings, infos, Instant.now());
    }

    public List<ValidationIssue> issuesWithCode(String code) {
        return issues.stream().filter(i -> i.code().equals(code)).toList();
    }

    private static int count(List<ValidationIssue> issues, ValidationSeverity severity) {
        return (int) issues.stream().filter(i -> i.severity() == severity).count();
    }
}
