package com.agentexec.engine.coordinator;

import com.agentexec.core.model.TaskComplexity;

import java.util.List;

/**
 * What a research wave investigates.
 *
 * @param feature         the feature under research
 * @param complexity      sizes the wave: two roles for simple and medium, three for complex
 * @param techStack       stack the feature is built on
 * @param timeline        delivery expectation
 * @param successCriteria acceptance criteria
 */
public record WaveRequest(
    String feature,
    TaskComplexity complexity,
    String techStack,
    String timeline,
    List<String> successCriteria
) {
    public WaveRequest {
        if (feature == null || feature.isBlank()) {
            throw new IllegalArgumentException("feature is required");
        }
        complexity = complexity != null ? complexity : TaskComplexity.MEDIUM;
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
    }
}
