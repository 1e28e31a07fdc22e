package com.agentexec.engine.coordinator;

import com.agentexec.core.spi.RoleConfig;

/**
 * One role's unit of work inside a research wave.
 */
public record ResearchTask(String agentId, ResearchRole role, String prompt, RoleConfig config) {
}
