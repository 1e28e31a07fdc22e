package com.agentexec.engine.coordinator;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Research roles dispatched in a wave, in dispatch order.
 */
public enum ResearchRole {
    /** Always dispatched. */
    FEASIBILITY("feasibility", "research-feasibility"),
    /** Dispatched when at least two agents are planned. */
    CODEBASE("codebase", "research-codebase"),
    /** Dispatched for complex tasks only. */
    BEST_PRACTICES("best-practices", "research-practices");

    private final String value;
    private final String agentPrefix;

    ResearchRole(String value, String agentPrefix) {
        this.value = value;
        this.agentPrefix = agentPrefix;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Agent id for this role within the wave identified by {@code waveToken}.
     */
    public String agentId(String waveToken) {
        return agentPrefix + "-" + waveToken;
    }

    /**
     * The first {@code agentCount} roles.
     */
    public static List<ResearchRole> forAgentCount(int agentCount) {
        return Arrays.stream(values()).limit(Math.max(1, agentCount)).toList();
    }
}
