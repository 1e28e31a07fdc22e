package com.agentexec.engine.coordinator.findings;

import com.agentexec.engine.coordinator.ResearchRole;

import java.util.List;

/**
 * Decoded output of one research role. Each role has its own shape;
 * anything that does not match is an {@link UnrecognizedOutput}.
 */
public interface RoleOutput {

    ResearchRole role();

    List<Evidence> evidence();
}
