package com.agentexec.core.exception;

/**
 * Thrown when the persistent store cannot be read or written.
 */
public class StorageException extends ExecutionEngineException {

    public static final String ERROR_CODE = "STORAGE_ERROR";

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
