package com.agentexec.core.exception;

/**
 * Base exception for all execution engine errors.
 */
public class ExecutionEngineException extends RuntimeException {

    private final String errorCode;

    public ExecutionEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ExecutionEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
