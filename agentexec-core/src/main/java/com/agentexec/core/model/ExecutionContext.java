package com.agentexec.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Mutable execution record owned by exactly one state machine for its lifetime.
 *
 * <p>Only transitions (and the actions they run) mutate the state field. Outputs stay
 * {@code null} until the executing phase produces something, which lets guards tell
 * "nothing produced" apart from "produced an empty result".</p>
 */
public class ExecutionContext {

    private final String contextId;
    private final String taskId;
    private final String sessionId;
    private final Map<String, Object> inputs;
    private final Map<String, Object> state = new HashMap<>();
    private Map<String, Object> outputs;
    private ExecutionState currentState;
    private String error;
    private int attempt;
    private final Instant startTime;
    private Instant endTime;

    private ExecutionContext(String contextId, String taskId, String sessionId,
                             Map<String, Object> inputs, Instant startTime) {
        this.contextId = contextId;
        this.taskId = taskId;
        this.sessionId = sessionId;
        this.inputs = new LinkedHashMap<>(inputs != null ? inputs : Map.of());
        this.currentState = ExecutionState.IDLE;
        this.startTime = startTime;
    }

    /**
     * Create a context for newly admitted work. Every context starts in IDLE.
     */
    public static ExecutionContext create(String taskId, Map<String, Object> inputs) {
        return create(taskId, null, inputs);
    }

    public static ExecutionContext create(String taskId, String sessionId, Map<String, Object> inputs) {
        Objects.requireNonNull(taskId, "taskId");
        return new ExecutionContext(UUID.randomUUID().toString(), taskId, sessionId, inputs, Instant.now());
    }

    public String getContextId() {
        return contextId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ExecutionState getState() {
        return currentState;
    }

    public void setState(ExecutionState newState) {
        this.currentState = Objects.requireNonNull(newState, "state");
    }

    public Map<String, Object> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public Object getInput(String key) {
        return inputs.get(key);
    }

    public boolean hasInput(String key) {
        return inputs.get(key) != null;
    }

    /**
     * Outputs produced so far, or {@code null} when none have been produced.
     */
    public Map<String, Object> getOutputs() {
        return outputs == null ? null : Collections.unmodifiableMap(outputs);
    }

    public boolean hasOutputs() {
        return outputs != null;
    }

    public void putOutput(String key, Object value) {
        if (outputs == null) {
            outputs = new LinkedHashMap<>();
        }
        outputs.put(key, value);
    }

    public void setOutputs(Map<String, Object> newOutputs) {
        this.outputs = newOutputs == null ? null : new LinkedHashMap<>(newOutputs);
    }

    /**
     * Scratch state shared between actions of the same machine.
     */
    public Map<String, Object> getStateData() {
        return state;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    public void setError(String error) {
        this.error = error;
    }

    public void clearError() {
        this.error = null;
    }

    public int getAttempt() {
        return attempt;
    }

    public int incrementAttempt() {
        return ++attempt;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    /**
     * Plain-data view of this context, safe to serialize.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("contextId", contextId);
        snapshot.put("taskId", taskId);
        snapshot.put("sessionId", sessionId);
        snapshot.put("state", currentState.name());
        snapshot.put("inputs", new LinkedHashMap<>(inputs));
        snapshot.put("outputs", outputs == null ? null : new LinkedHashMap<>(outputs));
        snapshot.put("error", error);
        snapshot.put("attempt", attempt);
        snapshot.put("startTime", startTime.toString());
        snapshot.put("endTime", endTime == null ? null : endTime.toString());
        return snapshot;
    }

    @Override
    public String toString() {
        return "ExecutionContext{" + "contextId='" + contextId + '\'' + ", taskId='" + taskId + '\''
            + ", state=" + currentState + ", attempt=" + attempt + '}';
    }
}
