package com.agentexec.engine.contract;

import com.agentexec.core.contract.AgentContract;
import com.agentexec.core.contract.Condition;
import com.agentexec.core.contract.StandardConditions;
import com.agentexec.core.exception.ContractValidationException;
import com.agentexec.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractValidatorTest {

    private final ContractValidator validator = new ContractValidator();

    private static Condition pre(String id) {
        return Condition.precondition(id, "Pre " + id, ctx -> true, id + " failed");
    }

    private static Condition post(String id) {
        return Condition.postcondition(id, "Post " + id, ctx -> true, id + " failed");
    }

    private static AgentContract.Builder contract(String id) {
        return AgentContract.builder().id(id).name("Contract " + id).taskType(TaskType.CUSTOM);
    }

    // ========== Structure ==========

    @Nested
    class Structure {

        @Test
        void missingIdAndNameAreErrors() {
            AgentContract contract = AgentContract.builder().taskType(TaskType.CUSTOM)
                .precondition(pre("p1"))
                .build();

            ValidationResult result = validator.validate(contract);

            assertThat(result.valid()).isFalse();
            assertThat(result.issuesWithCode("MISSING_ID")).hasSize(1);
            assertThat(result.issuesWithCode("MISSING_NAME")).hasSize(1);
        }

        @Test
        void oddIdCharactersAreOnlyAWarning() {
            AgentContract contract = contract("bad id!").precondition(pre("p1")).build();

            ValidationResult result = validator.validate(contract);

            assertThat(result.valid()).isTrue();
            assertThat(result.issuesWithCode("INVALID_ID_FORMAT"))
                .singleElement()
                .satisfies(issue -> {
                    assertThat(issue.severity()).isEqualTo(ValidationSeverity.WARNING);
                    assertThat(issue.suggestion()).isNotBlank();
                });
        }

        @Test
        void missingTaskTypeAndMethodAreErrors() {
            AgentContract contract = AgentContract.builder().id("c1").name("c1")
                .verificationMethod(null)
                .precondition(pre("p1"))
                .build();

            ValidationResult result = validator.validate(contract);

            assertThat(result.issuesWithCode("INVALID_TASK_TYPE")).hasSize(1);
            assertThat(result.issuesWithCode("INVALID_VERIFICATION_METHOD")).hasSize(1);
        }
    }

    // ========== Conditions ==========

    @Test
    @DisplayName("Two preconditions sharing an id make the contract invalid")
    void duplicateConditionId() {
        AgentContract contract = contract("c1")
            .precondition(pre("same"))
            .precondition(pre("same"))
            .build();

        ValidationResult result = validator.validate(contract);

        assertThat(result.valid()).isFalse();
        assertThat(result.issuesWithCode("DUPLICATE_CONDITION_ID"))
            .singleElement()
            .satisfies(issue -> assertThat(issue.path()).isEqualTo("preconditions[1].id"));
    }

    @Test
    void sameIdAcrossDifferentSetsIsAllowed() {
        AgentContract contract = contract("c1")
            .precondition(pre("tests-passing"))
            .postcondition(post("tests-passing"))
            .build();

        assertThat(validator.validate(contract).issuesWithCode("DUPLICATE_CONDITION_ID")).isEmpty();
    }

    @Test
    void missingErrorMessageAndMisfiledTypeAreWarnings() {
        AgentContract contract = contract("c1")
            .precondition(Condition.precondition("p1", "P1", ctx -> true, null))
            .postcondition(pre("really-a-pre"))
            .build();

        ValidationResult result = validator.validate(contract);

        assertThat(result.valid()).isTrue();
        assertThat(result.issuesWithCode("MISSING_ERROR_MESSAGE")).hasSize(1);
        assertThat(result.issuesWithCode("CONDITION_TYPE_MISMATCH"))
            .singleElement()
            .satisfies(issue -> assertThat(issue.path()).isEqualTo("postconditions[0].type"));
    }

    @Test
    @DisplayName("A contract without conditions is valid but warned about")
    void noConditions() {
        ValidationResult result = validator.validate(contract("empty").build());

        assertThat(result.valid()).isTrue();
        assertThat(result.warningCount()).isEqualTo(1);
        assertThat(result.issuesWithCode("NO_CONDITIONS")).hasSize(1);
    }

    @Test
    void minimumCountsAreEnforced() {
        ValidationOptions options = ValidationOptions.builder()
            .minPreconditions(2)
            .minPostconditions(1)
            .build();

        ValidationResult result = validator.validate(contract("c1").precondition(pre("p1")).build(), options);

        assertThat(result.valid()).isFalse();
        assertThat(result.issuesWithCode("INSUFFICIENT_PRECONDITIONS")).hasSize(1);
        assertThat(result.issuesWithCode("INSUFFICIENT_POSTCONDITIONS")).hasSize(1);
    }

    // ========== Completeness and Consistency ==========

    @Test
    @DisplayName("Bug-fix contract whose postcondition negates its precondition")
    void contradictionBetweenPreAndPost() {
        AgentContract contract = AgentContract.builder()
            .id("c1")
            .name("Fix bug")
            .taskType(TaskType.FIX_BUG)
            .precondition(pre("has-bug-report"))
            .postcondition(post("no-has-bug-report"))
            .build();

        ValidationResult result = validator.validate(contract);

        assertThat(result.valid()).isTrue();
        assertThat(result.issuesWithCode("POTENTIAL_CONTRADICTION"))
            .singleElement()
            .satisfies(issue -> {
                assertThat(issue.severity()).isEqualTo(ValidationSeverity.WARNING);
                assertThat(issue.path()).isEqualTo("postconditions");
            });
        assertThat(result.issuesWithCode("MISSING_RECOMMENDED_PRECONDITION"))
            .singleElement()
            .satisfies(issue -> assertThat(issue.message()).contains("has-reproduction"));
        assertThat(result.issuesWithCode("MISSING_RECOMMENDED_POSTCONDITION")).hasSize(3);
    }

    @Test
    void recommendedConditionsMatchWithPrefixes() {
        AgentContract contract = AgentContract.builder()
            .id("feature")
            .name("Feature")
            .taskType(TaskType.IMPLEMENT_FEATURE)
            .precondition(pre("pre-has-specification"))
            .precondition(pre("context"))
            .postcondition(post("post-has-code"))
            .postcondition(post("post-has-tests"))
            .postcondition(post("post-no-errors"))
            .build();

        ValidationResult result = validator.validate(contract);

        assertThat(result.issuesWithCode("MISSING_RECOMMENDED_PRECONDITION")).isEmpty();
        assertThat(result.issuesWithCode("MISSING_RECOMMENDED_POSTCONDITION")).isEmpty();
    }

    @Test
    void stateSpecificInvariantIsFlagged() {
        AgentContract contract = contract("c1")
            .invariant(Condition.invariant("state-executing", "Always executing", ctx -> true, "not executing"))
            .invariant(StandardConditions.validState())
            .build();

        ValidationResult result = validator.validate(contract);

        assertThat(result.issuesWithCode("RESTRICTIVE_INVARIANT"))
            .singleElement()
            .satisfies(issue -> assertThat(issue.path()).isEqualTo("invariants[0].id"));
    }

    @Test
    void heuristicsCanBeSwitchedOff() {
        AgentContract contract = AgentContract.builder()
            .id("c1").name("Fix bug").taskType(TaskType.FIX_BUG)
            .precondition(pre("has-bug-report"))
            .postcondition(post("no-has-bug-report"))
            .build();
        ValidationOptions options = ValidationOptions.builder()
            .checkCompleteness(false)
            .checkConsistency(false)
            .build();

        ValidationResult result = validator.validate(contract, options);

        assertThat(result.issues()).isEmpty();
    }

    // ========== Registry and Custom Rules ==========

    @Test
    void registryCrossCheck() {
        ContractRegistry registry = new ContractRegistry();
        registry.register(contract("existing").precondition(pre("p1")).build());
        ValidationOptions options = ValidationOptions.builder().registry(registry).build();

        ValidationResult sameId = validator.validate(contract("existing").precondition(pre("p1")).build(), options);
        ValidationResult sameName = validator.validate(
            AgentContract.builder().id("other").name("contract EXISTING").taskType(TaskType.CUSTOM)
                .precondition(pre("p1")).build(),
            options);

        assertThat(sameId.issuesWithCode("DUPLICATE_CONTRACT_IN_REGISTRY")).hasSize(1);
        assertThat(sameName.issuesWithCode("DUPLICATE_CONTRACT_NAME")).hasSize(1);
        assertThat(sameName.valid()).isTrue();
    }

    @Test
    void registeredInstanceIsNotItsOwnDuplicate() {
        ContractRegistry registry = new ContractRegistry();
        AgentContract contract = contract("c1").precondition(pre("p1")).build();
        registry.register(contract);

        ValidationResult result = validator.validate(contract, ValidationOptions.builder().registry(registry).build());

        assertThat(result.issuesWithCode("DUPLICATE_CONTRACT_IN_REGISTRY")).isEmpty();
    }

    @Test
    @DisplayName("A throwing custom rule becomes an error issue instead of aborting")
    void throwingCustomRule() {
        ValidationRule broken = ValidationRule.of("needs-owner", "Needs owner", c -> {
            throw new IllegalStateException("owner lookup unavailable");
        });
        ValidationRule tagged = ValidationRule.of("tagged", "Tagged", c -> c.getTags().isEmpty()
            ? List.of(ValidationIssue.warning("UNTAGGED", "No tags", "tags"))
            : List.of());
        ValidationOptions options = ValidationOptions.builder().customRule(broken).customRule(tagged).build();

        ValidationResult result = validator.validate(contract("c1").precondition(pre("p1")).build(), options);

        assertThat(result.valid()).isFalse();
        assertThat(result.issuesWithCode("CUSTOM_RULE_ERROR"))
            .singleElement()
            .satisfies(issue -> {
                assertThat(issue.path()).isEqualTo("customRules.needs-owner");
                assertThat(issue.message()).isEqualTo("Custom rule 'Needs owner' failed: owner lookup unavailable");
            });
        assertThat(result.issuesWithCode("UNTAGGED")).hasSize(1);
    }

    @Test
    void validateAllKeepsInputOrder() {
        var results = validator.validateAll(List.of(
            contract("b").precondition(pre("p")).build(),
            contract("a").build()), ValidationOptions.defaults());

        assertThat(results).containsOnlyKeys("b", "a");
        assertThat(results.keySet()).containsExactly("b", "a");
    }

    @Test
    void assertValidListsErrorsWithPaths() {
        AgentContract contract = contract("c1")
            .precondition(pre("same"))
            .precondition(pre("same"))
            .build();

        assertThatThrownBy(() -> validator.assertValid(contract, ValidationOptions.defaults()))
            .isInstanceOf(ContractValidationException.class)
            .hasMessageContaining("'c1'")
            .hasMessageContaining("[preconditions[1].id] Duplicate precondition id 'same'");
    }
}
