package com.agentexec.engine.contract;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for {@link ContractValidator#validate}.
 *
 * @param checkCompleteness report recommended conditions missing for the task type
 * @param checkConsistency  run the has/no contradiction and restrictive invariant heuristics
 * @param registry          registry to cross-check ids and names against, or {@code null}
 * @param customRules       extra rules run last
 * @param minPreconditions  fewer preconditions than this is an error
 * @param minPostconditions fewer postconditions than this is an error
 */
public record ValidationOptions(
    boolean checkCompleteness,
    boolean checkConsistency,
    ContractRegistry registry,
    List<ValidationRule> customRules,
    int minPreconditions,
    int minPostconditions
) {
    public ValidationOptions {
        customRules = customRules != null ? List.copyOf(customRules) : List.of();
    }

    public static ValidationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for validation options.
     */
    public static class Builder {
        private boolean checkCompleteness = true;
        private boolean checkConsistency = true;
        private ContractRegistry registry;
        private final List<ValidationRule> customRules = new ArrayList<>();
        private int minPreconditions = 0;
        private int minPostconditions = 0;

        public Builder checkCompleteness(boolean checkCompleteness) {
            this.checkCompleteness = checkCompleteness;
            return this;
        }

        public Builder checkConsistency(boolean checkConsistency) {
            this.checkConsistency = checkConsistency;
            return this;
        }

        public Builder registry(ContractRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder customRule(ValidationRule rule) {
            this.customRules.add(rule);
            return this;
        }

        public Builder minPreconditions(int minPreconditions) {
            this.minPreconditions = minPreconditions;
            return this;
        }

        public Builder minPostconditions(int minPostconditions) {
            this.minPostconditions = minPostconditions;
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(checkCompleteness, checkConsistency, registry, customRules,
                minPreconditions, minPostconditions);
        }
    }
}
