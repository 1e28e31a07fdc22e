package com.agentexec.engine.contract;

import com.agentexec.core.contract.AgentContract;

import java.util.List;
import java.util.function.Function;

/**
 * Caller-supplied validation rule. A rule that throws is reported as a CUSTOM_RULE_ERROR
 * issue; it never aborts validation.
 */
public interface ValidationRule {

    String id();

    String name();

    List<ValidationIssue> validate(AgentContract contract);

    static ValidationRule of(String id, String name, Function<AgentContract, List<ValidationIssue>> check) {
        return new ValidationRule() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public List<ValidationIssue> validate(AgentContract contract) {
                return check.apply(contract);
            }
        };
    }
}
