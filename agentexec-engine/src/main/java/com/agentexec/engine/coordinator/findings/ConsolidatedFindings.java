package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.RoleResult;

import java.time.Instant;
import java.util.List;

/**
 * Merged output of one research wave. Only successful, recognized roles contribute;
 * {@code codebasePatterns} and {@code bestPractices} are null when their role did not run or failed.
 */
public record ConsolidatedFindings(
    FeasibilityFindings feasibility,
    CodebaseFindings codebasePatterns,
    BestPracticesFindings bestPractices,
    List<Evidence> evidence,
    List<UnrecognizedOutput> unrecognized,
    List<RoleResult> roleResults,
    Instant timestamp
) {
    public ConsolidatedFindings {
        evidence = List.copyOf(evidence);
        unrecognized = List.copyOf(unrecognized);
        roleResults = List.copyOf(roleResults);
    }

    public long failedRoleCount() {
        return roleResults.stream().filter(r -> !r.success()).count();
    }
}
