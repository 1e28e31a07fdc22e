package com.agentexec.engine.coordinator;

import com.agentexec.engine.coordinator.findings.RoleOutput;

import java.util.Map;

/**
 * Settled outcome of one research role.
 */
public record RoleResult(
    String agentId,
    ResearchRole role,
    boolean success,
    RoleOutput output,
    String error,
    long durationMs,
    Map<String, Object> providerMetadata
) {
    public static RoleResult succeeded(ResearchTask task, RoleOutput output, long durationMs,
                                       Map<String, Object> providerMetadata) {
        return new RoleResult(task.agentId(), task.role(), true, output, null, durationMs,
            providerMetadata != null ? providerMetadata : Map.of());
    }

    public static RoleResult failed(ResearchTask task, String error, long durationMs) {
        return new RoleResult(task.agentId(), task.role(), false, null, error, durationMs, Map.of());
    }
}
