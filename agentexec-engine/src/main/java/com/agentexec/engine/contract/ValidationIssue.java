package com.agentexec.engine.contract;

/**
 * One finding of the contract validator.
 *
 * @param code       stable issue code, e.g. {@code DUPLICATE_CONDITION_ID}
 * @param message    human readable description
 * @param severity   error, warning or info
 * @param path       location in the contract, e.g. {@code preconditions[2].id}; may be null
 * @param suggestion optional hint for fixing the issue
 */
public record ValidationIssue(
    String code,
    String message,
    ValidationSeverity severity,
    String path,
    String suggestion
) {
    public static ValidationIssue error(String code, String message, String path) {
        return new ValidationIssue(code, message, ValidationSeverity.ERROR, path, null);
    }

    public static ValidationIssue warning(String code, String message, String path) {
        return new ValidationIssue(code, message, ValidationSeverity.WARNING, path, null);
    }

    public static ValidationIssue info(String code, String message, String path) {
        return new ValidationIssue(code, message, ValidationSeverity.INFO, path, null);
    }

    public ValidationIssue withSuggestion(String hint) {
        return new ValidationIssue(code, message, severity, path, hint);
    }
}
