package com.agentexec.core.model;

import java.time.Instant;

/**
 * Lightweight checkpoint listing entry without the step payload.
 * A record that failed to load or verify is listed with {@code valid=false} and the reason.
 */
public record StepCheckpointSummary(
    String id,
    String sessionId,
    String stepId,
    String stepName,
    int waveNumber,
    Instant createdAt,
    String label,
    long sizeBytes,
    boolean valid,
    String problem
) {
    public static StepCheckpointSummary invalid(String id, String sessionId, String problem) {
        return new StepCheckpointSummary(id, sessionId, null, null, 0, null, null, 0, false, problem);
    }
}
