package com.agentexec.recovery.session;

import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.Step;

import java.util.List;

/**
 * What resuming from a checkpoint would restore. Building a preview changes nothing.
 */
public record RestorePreview(
    String checkpointId,
    String sessionId,
    Step step,
    List<Step> priorSteps,
    ResumeDecision decision
) {
}
