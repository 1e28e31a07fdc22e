package com.agentexec.core.exception;

import com.agentexec.core.contract.ConditionType;

/**
 * Thrown when a condition id is added twice to the same condition set of a contract.
 */
public class DuplicateConditionException extends ExecutionEngineException {

    public static final String ERROR_CODE = "DUPLICATE_CONDITION_ID";

    public DuplicateConditionException(String contractId, ConditionType type, String conditionId) {
        super(ERROR_CODE, String.format(
            "Contract '%s' already has a %s with id '%s'",
            contractId, type.value(), conditionId
        ));
    }
}
