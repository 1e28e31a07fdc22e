package com.agentexec.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A run of steps that checkpoints share. Resumed runs get a new session pointing at the parent.
 */
public record ExecutionSession(
    String id,
    String executionId,
    String name,
    SessionStatus status,
    int currentWave,
    String currentStepId,
    List<String> checkpointIds,
    int completedSteps,
    int failedSteps,
    String parentSessionId,
    String replayFromCheckpoint,
    Instant startedAt,
    Instant updatedAt
) {
    public static ExecutionSession start(String executionId, String name, Instant now) {
        return new ExecutionSession(newSessionId(now), executionId, name, SessionStatus.ACTIVE, 0, null,
            List.of(), 0, 0, null, null, now, now);
    }

    public static ExecutionSession resumed(ExecutionSession parent, String name, String checkpointId, Instant now) {
        return new ExecutionSession(newSessionId(now), parent.executionId(), name, SessionStatus.ACTIVE,
            parent.currentWave(), parent.currentStepId(), List.of(), 0, 0, parent.id(), checkpointId, now, now);
    }

    public static String newSessionId(Instant now) {
        return "session-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public ExecutionSession withStatus(SessionStatus newStatus, Instant now) {
        return new ExecutionSession(id, executionId, name, newStatus, currentWave, currentStepId, checkpointIds,
            completedSteps, failedSteps, parentSessionId, replayFromCheckpoint, startedAt, now);
    }

    public ExecutionSession withCurrentStep(Step step, Instant now) {
        return new ExecutionSession(id, executionId, name, status, step.waveNumber(), step.id(), checkpointIds,
            completedSteps, failedSteps, parentSessionId, replayFromCheckpoint, startedAt, now);
    }

    public ExecutionSession withStepCompleted(Instant now) {
        return new ExecutionSession(id, executionId, name, status, currentWave, currentStepId, checkpointIds,
            completedSteps + 1, failedSteps, parentSessionId, replayFromCheckpoint, startedAt, now);
    }

    public ExecutionSession withStepFailed(Instant now) {
        return new ExecutionSession(id, executionId, name, status, currentWave, currentStepId, checkpointIds,
            completedSteps, failedSteps + 1, parentSessionId, replayFromCheckpoint, startedAt, now);
    }

    public ExecutionSession withCheckpoint(String checkpointId, Instant now) {
        List<String> ids = new ArrayList<>(checkpointIds);
        ids.add(checkpointId);
        return new ExecutionSession(id, executionId, name, status, currentWave, currentStepId, List.copyOf(ids),
            completedSteps, failedSteps, parentSessionId, replayFromCheckpoint, startedAt, now);
    }

    public ExecutionSession withCheckpoints(List<String> retained, Instant now) {
        return new ExecutionSession(id, executionId, name, status, currentWave, currentStepId, List.copyOf(retained),
            completedSteps, failedSteps, parentSessionId, replayFromCheckpoint, startedAt, now);
    }
}
