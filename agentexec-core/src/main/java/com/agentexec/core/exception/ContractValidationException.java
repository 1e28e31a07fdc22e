package com.agentexec.core.exception;

/**
 * Thrown by explicit contract assertions when validation finds errors.
 */
public class ContractValidationException extends ExecutionEngineException {

    public static final String ERROR_CODE = "CONTRACT_INVALID";

    public ContractValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ContractValidationException(String contractId, String errors) {
        super(ERROR_CODE, String.format("Contract validation failed for '%s': %s", contractId, errors));
    }
}
