package com.agentexec.engine.contract;

import com.agentexec.core.contract.AgentContract;
import com.agentexec.core.contract.Condition;
import com.agentexec.core.contract.ConditionType;
import com.agentexec.core.exception.ContractValidationException;
import com.agentexec.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lints contracts for structure, completeness and consistency.
 *
 * <p>Checks run in a fixed order: structure, per-condition, minimum counts, completeness,
 * consistency, registry cross-check, custom rules. Only ERROR issues make a contract invalid;
 * completeness and consistency findings are advisory.</p>
 */
public class ContractValidator {

    private static final Logger log = LoggerFactory.getLogger(ContractValidator.class);

    private static final Pattern ID_FORMAT = Pattern.compile("[A-Za-z0-9_-]+");

    private static final Map<TaskType, Recommendations> RECOMMENDED = Map.of(
        TaskType.IMPLEMENT_FEATURE, new Recommendations(
            List.of("has-specification", "has-context"),
            List.of("has-code", "has-tests", "no-errors")),
        TaskType.FIX_BUG, new Recommendations(
            List.of("has-bug-report", "has-reproduction"),
            List.of("bug-fixed", "no-regression", "no-errors")),
        TaskType.REFACTOR, new Recommendations(
            List.of("has-code", "tests-passing"),
            List.of("tests-passing", "no-behavior-change")),
        TaskType.TEST, new Recommendations(
            List.of("has-code-to-test"),
            List.of("has-tests", "coverage-met")),
        TaskType.REVIEW, new Recommendations(
            List.of("has-code-to-review"),
            List.of("has-feedback")),
        TaskType.DEPLOY, new Recommendations(
            List.of("tests-passing", "build-passing"),
            List.of("deployed", "health-check-passed")),
        TaskType.CUSTOM, new Recommendations(List.of(), List.of())
    );

    public ValidationResult validate(AgentContract contract) {
        return validate(contract, ValidationOptions.defaults());
    }

    public ValidationResult validate(AgentContract contract, ValidationOptions options) {
        Objects.requireNonNull(contract, "contract");
        ValidationOptions opts = options != null ? options : ValidationOptions.defaults();
        List<ValidationIssue> issues = new ArrayList<>();

        validateStructure(contract, issues);
        validateConditions(contract, issues);
        validateCounts(contract, opts, issues);
        if (opts.checkCompleteness()) {
            validateCompleteness(contract, issues);
        }
        if (opts.checkConsistency()) {
            validateConsistency(contract, issues);
        }
        if (opts.registry() != null) {
            validateAgainstRegistry(contract, opts.registry(), issues);
        }
        for (ValidationRule rule : opts.customRules()) {
            runCustomRule(rule, contract, issues);
        }

        ValidationResult result = ValidationResult.of(contract.getId(), issues);
        log.debug("Validated contract {}: valid={}, errors={}, warnings={}, infos={}",
            contract.getId(), result.valid(), result.errorCount(), result.warningCount(), result.infoCount());
        return result;
    }

    /**
     * Validate each contract independently, keyed by contract id in input order.
     */
    public Map<String, ValidationResult> validateAll(List<AgentContract> contracts, ValidationOptions options) {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        for (AgentContract contract : contracts) {
            results.put(contract.getId(), validate(contract, options));
        }
        return results;
    }

    /**
     * Validate and throw when any ERROR issue is found.
     *
     * @throws ContractValidationException listing every error as {@code [path] message}
     */
    public void assertValid(AgentContract contract, ValidationOptions options) {
        ValidationResult result = validate(contract, options);
        if (!result.valid()) {
            String errors = result.issues().stream()
                .filter(i -> i.severity() == ValidationSeverity.ERROR)
                .map(i -> i.path() != null ? "[" + i.path() + "] " + i.message() : i.message())
                .collect(Collectors.joining("; "));
            throw new ContractValidationException(contract.getId(), errors);
        }
    }

    // ========== Structure ==========

    private void validateStructure(AgentContract contract, List<ValidationIssue> issues) {
        String id = contract.getId();
        if (isBlank(id)) {
            issues.add(ValidationIssue.error("MISSING_ID", "Contract id is required", "id"));
        } else if (!ID_FORMAT.matcher(id).matches()) {
            issues.add(ValidationIssue.warning("INVALID_ID_FORMAT",
                    "Contract id '" + id + "' contains characters outside [A-Za-z0-9_-]", "id")
                .withSuggestion("Use letters, digits, hyphens and underscores only"));
        }
        if (isBlank(contract.getName())) {
            issues.add(ValidationIssue.error("MISSING_NAME", "Contract name is required", "name"));
        }
        if (contract.getTaskType() == null) {
            issues.add(ValidationIssue.error("INVALID_TASK_TYPE",
                "Task type is missing or not one of the supported task types", "taskType"));
        }
        if (contract.getVerificationMethod() == null) {
            issues.add(ValidationIssue.error("INVALID_VERIFICATION_METHOD",
                "Verification method is missing or not one of runtime, property-test, formal, hybrid",
                "verificationMethod"));
        }
    }

    // ========== Conditions ==========

    private void validateConditions(AgentContract contract, List<ValidationIssue> issues) {
        for (ConditionType type : ConditionType.values()) {
            List<Condition> conditions = contract.getConditions(type);
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < conditions.size(); i++) {
                Condition condition = conditions.get(i);
                String path = type.value() + "s[" + i + "]";
                if (condition == null) {
                    issues.add(ValidationIssue.error("MISSING_CONDITION_ID", "Condition is null", path));
                    continue;
                }
                if (isBlank(condition.getId())) {
                    issues.add(ValidationIssue.error("MISSING_CONDITION_ID", "Condition id is required", path + ".id"));
                } else if (!seen.add(condition.getId())) {
                    issues.add(ValidationIssue.error("DUPLICATE_CONDITION_ID",
                        "Duplicate " + type.value() + " id '" + condition.getId() + "'", path + ".id"));
                }
                if (isBlank(condition.getName())) {
                    issues.add(ValidationIssue.error("MISSING_CONDITION_NAME",
                        "Condition name is required", path + ".name"));
                }
                if (isBlank(condition.getErrorMessage())) {
                    issues.add(ValidationIssue.warning("MISSING_ERROR_MESSAGE",
                            "Condition '" + condition.getId() + "' has no error message", path + ".errorMessage")
                        .withSuggestion("Describe what failed so operators can act on it"));
                }
                if (condition.getType() != type) {
                    issues.add(ValidationIssue.warning("CONDITION_TYPE_MISMATCH",
                        "Condition '" + condition.getId() + "' has type " + describe(condition.getType())
                            + " but is listed as a " + type.value(), path + ".type"));
                }
            }
        }
    }

    private void validateCounts(AgentContract contract, ValidationOptions options, List<ValidationIssue> issues) {
        int pre = contract.getPreconditions().size();
        int post = contract.getPostconditions().size();
        if (pre < options.minPreconditions()) {
            issues.add(ValidationIssue.error("INSUFFICIENT_PRECONDITIONS",
                String.format("Contract has %d preconditions, at least %d required", pre, options.minPreconditions()),
                "preconditions"));
        }
        if (post < options.minPostconditions()) {
            issues.add(ValidationIssue.error("INSUFFICIENT_POSTCONDITIONS",
                String.format("Contract has %d postconditions, at least %d required", post, options.minPostconditions()),
                "postconditions"));
        }
        if (pre == 0 && post == 0 && contract.getInvariants().isEmpty()) {
            issues.add(ValidationIssue.warning("NO_CONDITIONS",
                    "Contract defines no preconditions, postconditions or invariants", null)
                .withSuggestion("Add at least one condition so the contract can reject bad runs"));
        }
    }

    // ========== Completeness ==========

    private void validateCompleteness(AgentContract contract, List<ValidationIssue> issues) {
        Recommendations recommendations = contract.getTaskType() != null ? RECOMMENDED.get(contract.getTaskType()) : null;
        if (recommendations == null) {
            return;
        }
        List<String> preIds = ids(contract.getPreconditions());
        List<String> postIds = ids(contract.getPostconditions());
        for (String fragment : recommendations.preconditions()) {
            if (!covered(fragment, preIds, "pre-")) {
                issues.add(ValidationIssue.info("MISSING_RECOMMENDED_PRECONDITION",
                    "Recommended precondition '" + fragment + "' not found for task type "
                        + contract.getTaskType().value(), "preconditions"));
            }
        }
        for (String fragment : recommendations.postconditions()) {
            if (!covered(fragment, postIds, "post-")) {
                issues.add(ValidationIssue.info("MISSING_RECOMMENDED_POSTCONDITION",
                    "Recommended postcondition '" + fragment + "' not found for task type "
                        + contract.getTaskType().value(), "postconditions"));
            }
        }
    }

    private static boolean covered(String fragment, List<String> ids, String prefix) {
        for (String id : ids) {
            String stripped = id.startsWith(prefix) ? id.substring(prefix.length()) : id;
            if (id.contains(fragment) || (!stripped.isEmpty() && fragment.contains(stripped))) {
                return true;
            }
        }
        return false;
    }

    // ========== Consistency ==========

    private void validateConsistency(AgentContract contract, List<ValidationIssue> issues) {
        List<String> preIds = ids(contract.getPreconditions());
        List<String> postIds = ids(contract.getPostconditions());
        for (String pre : preIds) {
            for (String post : postIds) {
                if (opposite(pre, post) || opposite(post, pre)) {
                    issues.add(ValidationIssue.warning("POTENTIAL_CONTRADICTION",
                            "Precondition '" + pre + "' and postcondition '" + post + "' look contradictory",
                            "postconditions")
                        .withSuggestion("Check that the postcondition does not negate what the precondition requires"));
                }
            }
        }
        List<Condition> invariants = contract.getInvariants();
        for (int i = 0; i < invariants.size(); i++) {
            Condition invariant = invariants.get(i);
            if (invariant == null || invariant.getId() == null) {
                continue;
            }
            String id = invariant.getId().toLowerCase(Locale.ROOT);
            if (id.startsWith("state-") && !id.equals("valid-state")) {
                issues.add(ValidationIssue.info("RESTRICTIVE_INVARIANT",
                        "Invariant '" + invariant.getId() + "' pins a specific state and may be too restrictive",
                        "invariants[" + i + "].id")
                    .withSuggestion("Invariants hold in every state; prefer valid-state"));
            }
        }
    }

    /**
     * Naming-opposite heuristic: {@code has-X} against {@code no-X} or {@code no-has-X}, and the mirror.
     */
    private static boolean opposite(String a, String b) {
        if (a.contains("has-")) {
            String stem = a.replaceFirst("has-", "");
            return b.contains("no-" + stem) || b.contains("no-" + a);
        }
        if (a.contains("no-")) {
            String stem = a.replaceFirst("no-", "");
            return b.contains("has-" + stem) || b.contains("has-" + a);
        }
        return false;
    }

    // ========== Registry ==========

    private void validateAgainstRegistry(AgentContract contract, ContractRegistry registry, List<ValidationIssue> issues) {
        registry.get(contract.getId()).ifPresent(existing -> {
            if (existing != contract) {
                issues.add(ValidationIssue.warning("DUPLICATE_CONTRACT_IN_REGISTRY",
                    "Contract '" + contract.getId() + "' is already registered; registering will update it", "id"));
            }
        });
        if (isBlank(contract.getName())) {
            return;
        }
        for (AgentContract other : registry.getAll()) {
            if (!Objects.equals(other.getId(), contract.getId())
                && contract.getName().equalsIgnoreCase(other.getName())) {
                issues.add(ValidationIssue.info("DUPLICATE_CONTRACT_NAME",
                    "Contract name '" + contract.getName() + "' is also used by '" + other.getId() + "'", "name"));
                break;
            }
        }
    }

    private void runCustomRule(ValidationRule rule, AgentContract contract, List<ValidationIssue> issues) {
        try {
            List<ValidationIssue> found = rule.validate(contract);
            if (found != null) {
                issues.addAll(found);
            }
        } catch (Exception e) {
            log.warn("Custom validation rule {} failed on contract {}: {}", rule.id(), contract.getId(), e.getMessage());
            issues.add(ValidationIssue.error("CUSTOM_RULE_ERROR",
                "Custom rule '" + rule.name() + "' failed: " + e.getMessage(), "customRules." + rule.id()));
        }
    }

    private static List<String> ids(List<Condition> conditions) {
        List<String> ids = new ArrayList<>();
        for (Condition condition : conditions) {
            if (condition != null && !isBlank(condition.getId())) {
                ids.add(condition.getId().toLowerCase(Locale.ROOT));
            }
        }
        return ids;
    }

    private static String describe(ConditionType type) {
        return type != null ? type.value() : "none";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Recommendations(List<String> preconditions, List<String> postconditions) {
    }
}
