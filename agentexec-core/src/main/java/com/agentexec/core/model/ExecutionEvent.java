package com.agentexec.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable notification of something that happened inside the engine.
 *
 * @param type      what happened
 * @param subjectId id of the context, agent, checkpoint or wave concerned
 * @param sessionId owning session, if any
 * @param payload   plain-data details
 * @param timestamp when it happened
 */
public record ExecutionEvent(
    ExecutionEventType type,
    String subjectId,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static ExecutionEvent of(ExecutionEventType type, String subjectId, Map<String, Object> payload) {
        return of(type, subjectId, null, payload);
    }

    public static ExecutionEvent of(ExecutionEventType type, String subjectId, String sessionId,
                                    Map<String, Object> payload) {
        return new ExecutionEvent(type, subjectId, sessionId,
            payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of(),
            Instant.now());
    }
}
