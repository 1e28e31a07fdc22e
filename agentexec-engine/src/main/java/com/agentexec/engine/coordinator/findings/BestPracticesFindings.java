package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.ResearchRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the best-practices role.
 */
public record BestPracticesFindings(
    @JsonProperty("bestPractices") List<Practice> practices,
    List<Pitfall> pitfalls,
    List<SecurityConsideration> securityConsiderations,
    List<Evidence> evidence
) implements RoleOutput {

    public BestPracticesFindings {
        practices = practices != null ? List.copyOf(practices) : List.of();
        pitfalls = pitfalls != null ? List.copyOf(pitfalls) : List.of();
        securityConsiderations = securityConsiderations != null ? List.copyOf(securityConsiderations) : List.of();
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    @Override
    public ResearchRole role() {
        return ResearchRole.BEST_PRACTICES;
    }

    public record Practice(String practice, String reason, String source) {
    }

    public record Pitfall(String pitfall, String consequence, String avoidance) {
    }

    public record SecurityConsideration(String risk, String mitigation) {
    }
}
