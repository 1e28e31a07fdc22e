package com.agentexec.core.spi;

import java.time.Duration;
import java.util.Map;

/**
 * Per-role settings handed to the prompt executor.
 *
 * @param role         role name, e.g. {@code feasibility}
 * @param agentId      id the agent is registered under
 * @param systemPrompt role instructions
 * @param timeout      maximum time the provider call may take
 * @param metadata     pass-through values for the executor
 */
public record RoleConfig(
    String role,
    String agentId,
    String systemPrompt,
    Duration timeout,
    Map<String, Object> metadata
) {
}
