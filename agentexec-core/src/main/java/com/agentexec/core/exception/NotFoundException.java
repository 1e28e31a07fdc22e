package com.agentexec.core.exception;

/**
 * Thrown when a context, contract, session or checkpoint is not found.
 */
public class NotFoundException extends ExecutionEngineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
