package com.agentexec.engine.coordinator;

import java.util.List;

/**
 * Result of {@link WaveOrchestrator#executeWaves}. Tasks of waves that never ran are absent.
 */
public record WaveRunResult(List<TaskResult> tasks, List<WaveSummary> waves, int totalSuccess, int totalFailure) {

    public WaveRunResult {
        tasks = List.copyOf(tasks);
        waves = List.copyOf(waves);
    }
}
