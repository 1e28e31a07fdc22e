package com.agentexec.core.contract;

import com.agentexec.core.model.ExecutionContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed predicate over an execution context.
 *
 * <p>Id, name and message are not checked on construction; the contract validator reports
 * missing values so a malformed contract can still be inspected.</p>
 */
public final class Condition {

    private final String id;
    private final String name;
    private final ConditionType type;
    private final ConditionPredicate predicate;
    private final String errorMessage;
    private final ConditionSeverity severity;
    private final String description;
    private final List<String> tags;

    public Condition(String id, String name, ConditionType type, ConditionPredicate predicate,
                     String errorMessage, ConditionSeverity severity, String description, List<String> tags) {
        this.id = id;
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.errorMessage = errorMessage;
        this.severity = severity != null ? severity : ConditionSeverity.ERROR;
        this.description = description;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static Condition precondition(String id, String name, ConditionPredicate predicate, String errorMessage) {
        return new Condition(id, name, ConditionType.PRECONDITION, predicate, errorMessage, ConditionSeverity.ERROR, null, null);
    }

    public static Condition postcondition(String id, String name, ConditionPredicate predicate, String errorMessage) {
        return new Condition(id, name, ConditionType.POSTCONDITION, predicate, errorMessage, ConditionSeverity.ERROR, null, null);
    }

    public static Condition invariant(String id, String name, ConditionPredicate predicate, String errorMessage) {
        return new Condition(id, name, ConditionType.INVARIANT, predicate, errorMessage, ConditionSeverity.ERROR, null, null);
    }

    /**
     * Evaluate against a context. Never throws: an exception from the predicate is a failed result.
     */
    public ConditionResult evaluate(ExecutionContext context) {
        Instant start = Instant.now();
        boolean passed;
        String message;
        ConditionSeverity resultSeverity = severity;
        try {
            passed = predicate.test(context);
            message = passed ? null : errorMessage;
        } catch (Exception e) {
            passed = false;
            message = "Condition evaluation failed: " + e.getMessage();
            resultSeverity = ConditionSeverity.ERROR;
        }
        return new ConditionResult(passed, id, name, type, message, resultSeverity, start,
            Duration.between(start, Instant.now()).toMillis());
    }

    public Condition withSeverity(ConditionSeverity newSeverity) {
        return new Condition(id, name, type, predicate, errorMessage, newSeverity, description, tags);
    }

    public Condition withDescription(String newDescription) {
        return new Condition(id, name, type, predicate, errorMessage, severity, newDescription, tags);
    }

    public Condition withTags(List<String> newTags) {
        return new Condition(id, name, type, predicate, errorMessage, severity, description, newTags);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ConditionType getType() {
        return type;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public ConditionSeverity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return type.value() + ":" + id;
    }
}
