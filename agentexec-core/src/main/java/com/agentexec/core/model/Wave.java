package com.agentexec.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A batch of tasks dispatched together under a concurrency ceiling.
 * Once every task has settled the wave is closed and never reopened.
 */
public record Wave(
    String id,
    int number,
    List<String> taskIds,
    int maxConcurrency,
    Set<String> dependsOn,
    Set<String> succeeded,
    Set<String> failed
) {
    public Wave {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        taskIds = List.copyOf(taskIds);
        dependsOn = dependsOn != null ? Set.copyOf(dependsOn) : Set.of();
        succeeded = succeeded != null ? Set.copyOf(succeeded) : Set.of();
        failed = failed != null ? Set.copyOf(failed) : Set.of();
    }

    public static Wave create(int number, List<String> taskIds, int maxConcurrency, Set<String> dependsOn) {
        return new Wave("wave-" + number, number, taskIds, maxConcurrency, dependsOn, Set.of(), Set.of());
    }

    /**
     * Record one task outcome. Outcomes for a closed wave or an unknown task are rejected.
     */
    public Wave recordOutcome(String taskId, boolean success) {
        if (!taskIds.contains(taskId)) {
            throw new IllegalArgumentException("Task " + taskId + " is not part of " + id);
        }
        if (allSettled()) {
            throw new IllegalStateException(id + " is closed");
        }
        Set<String> ok = new HashSet<>(succeeded);
        Set<String> ko = new HashSet<>(failed);
        if (success) {
            ok.add(taskId);
        } else {
            ko.add(taskId);
        }
        return new Wave(id, number, taskIds, maxConcurrency, dependsOn, ok, ko);
    }

    public boolean allSettled() {
        return succeeded.size() + failed.size() >= taskIds.size();
    }
}
