package com.agentexec.engine.resource;

import com.agentexec.core.model.ResourceSnapshot;

import java.util.List;

/**
 * Detailed admission verdict.
 *
 * @param canSpawn   whether another agent may start
 * @param snapshot   the metrics the verdict was based on, or {@code null} if they were not sampled
 * @param violations human-readable reasons for refusal
 */
public record ResourceCheckResult(boolean canSpawn, ResourceSnapshot snapshot, List<String> violations) {

    public ResourceCheckResult {
        violations = List.copyOf(violations);
    }
}
