package com.agentexec.recovery.decision;

import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.StepCheckpoint;

/**
 * Checkpoint chosen as the best place to continue, with the decision that won and its weighted score.
 */
public record ResumePoint(StepCheckpoint checkpoint, ResumeDecision decision, double score) {
}
