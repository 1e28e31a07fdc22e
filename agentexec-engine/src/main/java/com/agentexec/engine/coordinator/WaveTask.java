package com.agentexec.engine.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of work for {@link WaveOrchestrator}.
 *
 * @param id           unique task id
 * @param prompt       prompt run during the executing phase
 * @param dependencies ids of tasks that must have succeeded first
 * @param inputs       extra context inputs; {@code prompt} is added automatically
 */
public record WaveTask(String id, String prompt, List<String> dependencies, Map<String, Object> inputs) {

    public WaveTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id is required");
        }
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }

    public static WaveTask of(String id, String prompt, String... dependencies) {
        return new WaveTask(id, prompt, List.of(dependencies), Map.of());
    }
}
