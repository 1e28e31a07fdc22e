package com.agentexec.core.exception;

/**
 * Thrown when a document is created under a key that already exists.
 */
public class DuplicateCheckpointException extends ExecutionEngineException {

    public static final String ERROR_CODE = "CHECKPOINT_EXISTS";

    private final String key;

    public DuplicateCheckpointException(String key) {
        super(ERROR_CODE, String.format("Document already exists: %s", key));
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
