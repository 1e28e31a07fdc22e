package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.ResearchRole;

import java.util.List;

/**
 * Output of the codebase role: existing patterns, conventions and integration points.
 */
public record CodebaseFindings(
    List<SimilarFeature> similarFeatures,
    Conventions conventions,
    List<IntegrationPoint> integrationPoints,
    List<String> existingDependencies,
    List<Evidence> evidence
) implements RoleOutput {

    public CodebaseFindings {
        similarFeatures = similarFeatures != null ? List.copyOf(similarFeatures) : List.of();
        conventions = conventions != null ? conventions : new Conventions("", "", "");
        integrationPoints = integrationPoints != null ? List.copyOf(integrationPoints) : List.of();
        existingDependencies = existingDependencies != null ? List.copyOf(existingDependencies) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    @Override
    public ResearchRole role() {
        return ResearchRole.CODEBASE;
    }

    public record SimilarFeature(String file, String pattern, boolean reusable) {
    }

    public record Conventions(String structure, String naming, String testing) {
    }

    public record IntegrationPoint(String location, String type, List<String> requirements) {
    }
}
