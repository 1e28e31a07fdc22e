package com.agentexec.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures logs carry the session, task, step and agent they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(sessionId, taskId, stepId, attempt)) {
 *     log.info("Executing step"); // includes sessionId, taskId, stepId, attempt
 * }
 * </pre>
 *
 * Closing removes only the keys this context set, so nested contexts restore cleanly.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String STEP_ID = "stepId";
    public static final String AGENT_ID = "agentId";
    public static final String WAVE_ID = "waveId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final String[] keys;
    private final String[] previous;

    private LoggingContext(String... keyValues) {
        int pairs = keyValues.length / 2;
        this.keys = new String[pairs];
        this.previous = new String[pairs];
        for (int i = 0; i < pairs; i++) {
            String key = keyValues[i * 2];
            String value = keyValues[i * 2 + 1];
            keys[i] = key;
            previous[i] = MDC.get(key);
            if (value != null) {
                MDC.put(key, value);
            }
        }
        ensureTraceId();
    }

    /**
     * Logging context for a unit of work driven by a state machine.
     */
    public static LoggingContext forTask(String sessionId, String taskId, int attempt) {
        return new LoggingContext(SESSION_ID, sessionId, TASK_ID, taskId, ATTEMPT, String.valueOf(attempt));
    }

    /**
     * Logging context for one step of a session.
     */
    public static LoggingContext forStep(String sessionId, String taskId, String stepId, int attempt) {
        return new LoggingContext(SESSION_ID, sessionId, TASK_ID, taskId, STEP_ID, stepId,
            ATTEMPT, String.valueOf(attempt));
    }

    /**
     * Logging context for a registered agent.
     */
    public static LoggingContext forAgent(String agentId) {
        return new LoggingContext(AGENT_ID, agentId);
    }

    /**
     * Logging context for a wave.
     */
    public static LoggingContext forWave(String waveId) {
        return new LoggingContext(WAVE_ID, waveId);
    }

    public static String getSessionId() {
        return MDC.get(SESSION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (int i = keys.length - 1; i >= 0; i--) {
            if (previous[i] != null) {
                MDC.put(keys[i], previous[i]);
            } else {
                MDC.remove(keys[i]);
            }
        }
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
