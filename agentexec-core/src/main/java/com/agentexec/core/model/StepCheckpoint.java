package com.agentexec.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a step and everything that ran before it.
 *
 * <p>Checkpoints are append-only: a newer checkpoint for the same step supersedes an older
 * one but never overwrites it. The checksum covers step, prior steps and context.</p>
 */
public record StepCheckpoint(
    String id,
    String sessionId,
    int waveNumber,
    String taskId,
    String stepId,
    int stepSequence,
    Step step,
    List<Step> priorSteps,
    Map<String, Object> context,
    String checksum,
    Instant createdAt,
    String label,
    long sizeBytes
) {
    public StepCheckpointSummary toSummary() {
        return new StepCheckpointSummary(id, sessionId, stepId, step != null ? step.name() : null,
            waveNumber, createdAt, label, sizeBytes, true, null);
    }
}
