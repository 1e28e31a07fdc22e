package com.agentexec.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of a decision taken while driving a session.
 */
public record DecisionLogEntry(
    String id,
    String sessionId,
    String category,
    String decision,
    String rationale,
    Map<String, Object> details,
    Instant timestamp
) {
    public static final String CATEGORY_RECOVERY = "RECOVERY";
}
