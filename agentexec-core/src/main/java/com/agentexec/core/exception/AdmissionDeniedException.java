package com.agentexec.core.exception;

/**
 * Thrown when a wave cannot be dispatched because no agent slot is available.
 */
public class AdmissionDeniedException extends ExecutionEngineException {

    public static final String ERROR_CODE = "ADMISSION_DENIED";

    public AdmissionDeniedException(String message) {
        super(ERROR_CODE, message);
    }
}
