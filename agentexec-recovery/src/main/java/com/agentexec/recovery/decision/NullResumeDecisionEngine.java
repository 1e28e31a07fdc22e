package com.agentexec.recovery.decision;

import com.agentexec.core.model.ResumeAction;
import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.StepCheckpoint;

import java.util.List;

/**
 * Fixed policy used when no richer analysis is configured: always resume from the
 * checkpointed step with confidence 0.7.
 */
public final class NullResumeDecisionEngine implements ResumeDecisionEngine {

    public static final double DEFAULT_CONFIDENCE = 0.7;

    @Override
    public ResumeDecision analyzeCheckpoint(StepCheckpoint checkpoint) {
        return new ResumeDecision(
            ResumeAction.RESUME,
            "Default policy: resume from the checkpointed step",
            checkpoint.stepId(),
            checkpoint.id(),
            List.of(),
            DEFAULT_CONFIDENCE,
            List.of()
        );
    }
}
