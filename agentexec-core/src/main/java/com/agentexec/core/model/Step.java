package com.agentexec.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One schedulable unit inside a larger task.
 * Immutable; status changes produce a new instance.
 *
 * Invariants:
 * - attemptNumber <= maxAttempts while the step is retried
 * - completedAt is set only for terminal statuses
 */
public record Step(
    String id,
    String taskId,
    int waveNumber,
    int sequence,
    StepType type,
    String name,
    StepStatus status,
    Map<String, Object> input,
    Map<String, Object> output,
    StepError error,
    Instant startedAt,
    Instant completedAt,
    Long durationMs,
    int attemptNumber,
    int maxAttempts
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * Create a pending step with the conventional {@code wave-N-task-T-step-S} id.
     */
    public static Step create(String taskId, int waveNumber, int sequence, StepType type,
                              String name, Map<String, Object> input) {
        return new Step(
            stepId(waveNumber, taskId, sequence),
            taskId,
            waveNumber,
            sequence,
            type,
            name,
            StepStatus.PENDING,
            input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of(),
            null,
            null,
            null,
            null,
            null,
            0,
            DEFAULT_MAX_ATTEMPTS
        );
    }

    public static String stepId(int waveNumber, String taskId, int sequence) {
        return "wave-" + waveNumber + "-task-" + taskId + "-step-" + sequence;
    }

    /**
     * Mark the step as running a new attempt.
     */
    public Step withExecuting(Instant now) {
        return new Step(id, taskId, waveNumber, sequence, type, name, StepStatus.EXECUTING,
            input, output, null, now, null, null, attemptNumber + 1, maxAttempts);
    }

    public Step withCompleted(Map<String, Object> result, Instant now) {
        return new Step(id, taskId, waveNumber, sequence, type, name, StepStatus.COMPLETED,
            input, result, null, startedAt, now, elapsed(now), attemptNumber, maxAttempts);
    }

    public Step withFailed(StepError stepError, Instant now) {
        return new Step(id, taskId, waveNumber, sequence, type, name, StepStatus.FAILED,
            input, output, stepError, startedAt, now, elapsed(now), attemptNumber, maxAttempts);
    }

    public Step withSkipped(Instant now) {
        return new Step(id, taskId, waveNumber, sequence, type, name, StepStatus.SKIPPED,
            input, output, error, startedAt, now, elapsed(now), attemptNumber, maxAttempts);
    }

    /**
     * Fresh pending copy used when a failed step is skipped over on resume.
     */
    public Step asResumed() {
        return new Step(id + "-resumed", taskId, waveNumber, sequence, type, name, StepStatus.PENDING,
            input, null, null, null, null, null, attemptNumber, maxAttempts);
    }

    public Step withMaxAttempts(int newMaxAttempts) {
        return new Step(id, taskId, waveNumber, sequence, type, name, status,
            input, output, error, startedAt, completedAt, durationMs, attemptNumber, newMaxAttempts);
    }

    public boolean attemptsExhausted() {
        return attemptNumber >= maxAttempts;
    }

    private Long elapsed(Instant now) {
        return startedAt == null ? null : Duration.between(startedAt, now).toMillis();
    }
}
