package com.agentexec.engine.coordinator;

/**
 * Per-wave counts. Wave numbers start at 1.
 */
public record WaveSummary(int waveNumber, int taskCount, int successCount, int failureCount) {
}
