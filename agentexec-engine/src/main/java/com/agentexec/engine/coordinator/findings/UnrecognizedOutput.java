package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.ResearchRole;

import java.util.List;

/**
 * Role output whose shape could not be decoded. Kept verbatim for inspection and never
 * merged into the consolidated findings.
 *
 * @param role    role that produced it
 * @param agentId agent that produced it
 * @param content raw response content
 * @param reason  why decoding failed
 */
public record UnrecognizedOutput(ResearchRole role, String agentId, String content, String reason)
    implements RoleOutput {

    @Override
    public List<Evidence> evidence() {
        return List.of();
    }
}
