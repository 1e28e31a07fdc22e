package com.agentexec.core.contract;

import com.agentexec.core.exception.DuplicateConditionException;
import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.TaskType;
import com.agentexec.core.model.VerificationMethod;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a task type must satisfy: ordered precondition, postcondition and invariant sets.
 *
 * <p>Condition ids are unique per set, not across sets. The add methods enforce this; the
 * builder accepts lists as given so that malformed contracts can be validated and reported
 * rather than rejected outright.</p>
 */
public class AgentContract {

    private final String id;
    private final String name;
    private final TaskType taskType;
    private final VerificationMethod verificationMethod;
    private final List<Condition> preconditions;
    private final List<Condition> postconditions;
    private final List<Condition> invariants;
    private final String description;
    private final List<String> tags;
    private final boolean enabled;

    private AgentContract(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.taskType = builder.taskType;
        this.verificationMethod = builder.verificationMethod;
        this.preconditions = new ArrayList<>(builder.preconditions);
        this.postconditions = new ArrayList<>(builder.postconditions);
        this.invariants = new ArrayList<>(builder.invariants);
        this.description = builder.description;
        this.tags = List.copyOf(builder.tags);
        this.enabled = builder.enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Condition Sets ==========

    public List<Condition> getPreconditions() {
        return Collections.unmodifiableList(preconditions);
    }

    public List<Condition> getPostconditions() {
        return Collections.unmodifiableList(postconditions);
    }

    public List<Condition> getInvariants() {
        return Collections.unmodifiableList(invariants);
    }

    public List<Condition> getConditions(ConditionType type) {
        return switch (type) {
            case PRECONDITION -> getPreconditions();
            case POSTCONDITION -> getPostconditions();
            case INVARIANT -> getInvariants();
        };
    }

    public void addPrecondition(Condition condition) {
        addTo(preconditions, ConditionType.PRECONDITION, condition);
    }

    public void addPostcondition(Condition condition) {
        addTo(postconditions, ConditionType.POSTCONDITION, condition);
    }

    public void addInvariant(Condition condition) {
        addTo(invariants, ConditionType.INVARIANT, condition);
    }

    /**
     * Replace the condition with the same id in the given set.
     *
     * @return true if a condition was replaced
     */
    public boolean updateCondition(ConditionType type, Condition condition) {
        List<Condition> set = mutableSet(type);
        for (int i = 0; i < set.size(); i++) {
            if (condition.getId() != null && condition.getId().equals(set.get(i).getId())) {
                set.set(i, condition);
                return true;
            }
        }
        return false;
    }

    // ========== Evaluation ==========

    public ContractEvaluationResult evaluatePreconditions(ExecutionContext context) {
        return evaluate(preconditions, context, false);
    }

    public ContractEvaluationResult evaluatePostconditions(ExecutionContext context) {
        return evaluate(postconditions, context, false);
    }

    public ContractEvaluationResult evaluateInvariants(ExecutionContext context) {
        return evaluate(invariants, context, false);
    }

    /**
     * Evaluate preconditions, invariants and postconditions in that order.
     */
    public ContractEvaluationResult evaluateAll(ExecutionContext context, boolean stopOnFirstFailure) {
        List<Condition> all = new ArrayList<>(preconditions);
        all.addAll(invariants);
        all.addAll(postconditions);
        return evaluate(all, context, stopOnFirstFailure);
    }

    /**
     * Custom contracts apply to every task type.
     */
    public boolean appliesTo(TaskType type) {
        return taskType == TaskType.CUSTOM || taskType == type;
    }

    // ========== Accessors ==========

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public VerificationMethod getVerificationMethod() {
        return verificationMethod;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String toString() {
        return "AgentContract{id='" + id + "', taskType=" + taskType + ", pre=" + preconditions.size()
            + ", post=" + postconditions.size() + ", inv=" + invariants.size() + '}';
    }

    // ========== Internal Methods ==========

    private ContractEvaluationResult evaluate(List<Condition> conditions, ExecutionContext context,
                                              boolean stopOnFirstFailure) {
        Instant start = Instant.now();
        List<ConditionResult> results = new ArrayList<>();
        for (Condition condition : conditions) {
            ConditionResult result = condition.evaluate(context);
            results.add(result);
            if (stopOnFirstFailure && result.blocking()) {
                break;
            }
        }
        return ContractEvaluationResult.of(id, results, start, Duration.between(start, Instant.now()).toMillis());
    }

    private void addTo(List<Condition> set, ConditionType type, Condition condition) {
        for (Condition existing : set) {
            if (existing.getId() != null && existing.getId().equals(condition.getId())) {
                throw new DuplicateConditionException(id, type, condition.getId());
            }
        }
        set.add(condition);
    }

    private List<Condition> mutableSet(ConditionType type) {
        return switch (type) {
            case PRECONDITION -> preconditions;
            case POSTCONDITION -> postconditions;
            case INVARIANT -> invariants;
        };
    }

    /**
     * Builder for contracts.
     */
    public static class Builder {
        private String id;
        private String name;
        private TaskType taskType;
        private VerificationMethod verificationMethod = VerificationMethod.RUNTIME;
        private final List<Condition> preconditions = new ArrayList<>();
        private final List<Condition> postconditions = new ArrayList<>();
        private final List<Condition> invariants = new ArrayList<>();
        private String description;
        private final List<String> tags = new ArrayList<>();
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder verificationMethod(VerificationMethod verificationMethod) {
            this.verificationMethod = verificationMethod;
            return this;
        }

        public Builder precondition(Condition condition) {
            this.preconditions.add(condition);
            return this;
        }

        public Builder postcondition(Condition condition) {
            this.postconditions.add(condition);
            return this;
        }

        public Builder invariant(Condition condition) {
            this.invariants.add(condition);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public AgentContract build() {
            return new AgentContract(this);
        }
    }
}
