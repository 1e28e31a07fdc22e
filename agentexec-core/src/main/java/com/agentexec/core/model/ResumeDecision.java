package com.agentexec.core.model;

import java.util.List;

/**
 * Recommendation produced by analyzing a checkpoint.
 *
 * @param action       recommended action
 * @param reason       human readable justification
 * @param fromStep     id of the step to continue from
 * @param checkpointId checkpoint the decision was made for
 * @param skipSteps    step ids to skip when continuing
 * @param confidence   confidence in [0, 1]
 * @param alternatives other plausible actions, best first
 */
public record ResumeDecision(
    ResumeAction action,
    String reason,
    String fromStep,
    String checkpointId,
    List<String> skipSteps,
    double confidence,
    List<ResumeAlternative> alternatives
) {
    public ResumeDecision {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        skipSteps = skipSteps != null ? List.copyOf(skipSteps) : List.of();
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }
}
