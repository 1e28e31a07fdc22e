package com.agentexec.core.exception;

import com.agentexec.core.model.StepError;

/**
 * Thrown when a step's action fails. Carries the structured error recorded on the step.
 */
public class StepExecutionException extends ExecutionEngineException {

    public static final String ERROR_CODE = StepError.STEP_EXECUTION_FAILED;

    private final String stepId;
    private final StepError stepError;

    public StepExecutionException(String stepId, StepError stepError, Throwable cause) {
        super(ERROR_CODE, String.format("Step %s failed: %s", stepId, stepError.message()), cause);
        this.stepId = stepId;
        this.stepError = stepError;
    }

    public String getStepId() {
        return stepId;
    }

    public StepError getStepError() {
        return stepError;
    }
}
