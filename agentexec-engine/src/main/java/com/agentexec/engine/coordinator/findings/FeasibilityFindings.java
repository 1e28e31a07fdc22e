package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.ResearchRole;

import java.util.List;

/**
 * Output of the feasibility role. A missing {@code feasible} flag reads as feasible.
 */
public record FeasibilityFindings(
    Boolean feasible,
    List<Approach> approaches,
    List<Risk> risks,
    String complexity,
    List<Evidence> evidence
) implements RoleOutput {

    public FeasibilityFindings {
        feasible = feasible != null ? feasible : Boolean.TRUE;
        approaches = approaches != null ? List.copyOf(approaches) : List.of();
        risks = risks != null ? List.copyOf(risks) : List.of();
        complexity = complexity != null ? complexity : "medium";
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static FeasibilityFindings unknown() {
        return new FeasibilityFindings(true, List.of(), List.of(), "medium", List.of());
    }

    @Override
    public ResearchRole role() {
        return ResearchRole.FEASIBILITY;
    }

    public record Approach(String name, List<String> pros, List<String> cons, double confidence) {
    }

    public record Risk(String risk, String mitigation) {
    }
}
