package com.agentexec.recovery.session;

import com.agentexec.core.exception.CheckpointCorruptException;
import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.exception.StepExecutionException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.model.DecisionLogEntry;
import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionSession;
import com.agentexec.core.model.ResumeAction;
import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.ResumeOptions;
import com.agentexec.core.model.ResumeResult;
import com.agentexec.core.model.SessionStatus;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.core.model.StepCheckpointSummary;
import com.agentexec.core.model.StepError;
import com.agentexec.core.model.StepStatus;
import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.repository.DocumentSummary;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.logging.LoggingContext;
import com.agentexec.recovery.checkpoint.CheckpointRepository;
import com.agentexec.recovery.decision.ResumeDecisionEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs steps inside sessions, checkpointing as it goes, and replays sessions from checkpoints.
 *
 * Persistent layout in the document store:
 * <ul>
 *   <li>{@code sessions/<sessionId>} - the session</li>
 *   <li>{@code session-steps/<sessionId>} - latest version of every step the session ran, in first-run order</li>
 *   <li>{@code decisions/<sessionId>/<entryId>} - decision log</li>
 * </ul>
 * Checkpoints themselves live in the {@link CheckpointRepository}.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    static final String SESSION_PREFIX = "sessions/";
    static final String STEPS_PREFIX = "session-steps/";
    static final String DECISION_PREFIX = "decisions/";

    public static final String FAILURE_CHECKPOINT_LABEL = "Failure checkpoint";

    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() {
    };

    private final CheckpointRepository checkpoints;
    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final ResumeDecisionEngine decisionEngine;
    private final ExecutionEventBus eventBus;
    private final int checkpointInterval;
    private final Clock clock;
    private final Object lock = new Object();

    /**
     * @param checkpointInterval checkpoint every Nth completed step in a session; 0 checkpoints only
     *                           step types that always checkpoint
     */
    public StepExecutor(CheckpointRepository checkpoints, DocumentStore store, ObjectMapper objectMapper,
                        ResumeDecisionEngine decisionEngine, ExecutionEventBus eventBus,
                        int checkpointInterval, Clock clock) {
        if (checkpointInterval < 0) {
            throw new IllegalArgumentException("checkpointInterval must be >= 0, got " + checkpointInterval);
        }
        this.checkpoints = checkpoints;
        this.store = store;
        this.objectMapper = objectMapper;
        this.decisionEngine = decisionEngine;
        this.eventBus = eventBus;
        this.checkpointInterval = checkpointInterval;
        this.clock = clock;
    }

    // ========== Sessions ==========

    public ExecutionSession startSession(String executionId, String name) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        ExecutionSession session = ExecutionSession.start(executionId,
            name != null ? name : "Execution " + executionId, clock.instant());
        saveSession(session);
        writeSteps(session.id(), List.of());
        publish(ExecutionEventType.SESSION_STARTED, session.id(), session.id(),
            Map.of("executionId", executionId, "name", session.name()));
        log.info("Started session {} for execution {}", session.id(), executionId);
        return session;
    }

    public Optional<ExecutionSession> getSession(String sessionId) {
        return store.get(SESSION_PREFIX + sessionId).map(node -> read(node, ExecutionSession.class));
    }

    public ExecutionSession requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    public List<ExecutionSession> listSessions() {
        List<ExecutionSession> sessions = new ArrayList<>();
        for (DocumentSummary doc : store.list(SESSION_PREFIX)) {
            store.get(doc.key()).ifPresent(node -> sessions.add(read(node, ExecutionSession.class)));
        }
        return sessions;
    }

    public ExecutionSession updateSessionStatus(String sessionId, SessionStatus status) {
        synchronized (lock) {
            ExecutionSession updated = requireSession(sessionId).withStatus(status, clock.instant());
            saveSession(updated);
            log.info("Session {} is now {}", sessionId, status);
            return updated;
        }
    }

    /**
     * Mark a session abandoned and announce it. Returns the updated session.
     */
    public ExecutionSession abandonSession(String sessionId, String reason) {
        ExecutionSession abandoned = updateSessionStatus(sessionId, SessionStatus.ABANDONED);
        publish(ExecutionEventType.SESSION_ABANDONED, sessionId, sessionId, Map.of("reason", reason));
        return abandoned;
    }

    /**
     * Steps the session has run, latest version of each, in first-run order.
     */
    public List<Step> getSteps(String sessionId) {
        return store.get(STEPS_PREFIX + sessionId)
            .map(node -> readSteps(node.path("steps")))
            .orElse(List.of());
    }

    // ========== Step execution ==========

    /**
     * Run one attempt of a step.
     *
     * @return the completed step
     * @throws StepExecutionException if the action throws; the failed step is recorded and checkpointed first
     */
    public Step executeStep(String sessionId, Step step, StepAction action) {
        ExecutionSession session = requireSession(sessionId);
        if (session.status().isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is " + session.status());
        }

        Step executing = step.withExecuting(clock.instant());
        synchronized (lock) {
            saveSession(requireSession(sessionId).withCurrentStep(executing, clock.instant()));
            recordStep(sessionId, executing);
        }

        try (var ctx = LoggingContext.forStep(sessionId, step.taskId(), step.id(), executing.attemptNumber())) {
            log.debug("Executing step {} (attempt {}/{})", step.id(), executing.attemptNumber(), executing.maxAttempts());

            Map<String, Object> output;
            try {
                output = action.run(executing);
            } catch (Exception e) {
                StepError error = StepError.from(e);
                Step failed = executing.withFailed(error, clock.instant());
                synchronized (lock) {
                    saveSession(requireSession(sessionId).withStepFailed(clock.instant()));
                    recordStep(sessionId, failed);
                }
                StepExecutionException failure = new StepExecutionException(step.id(), error, e);
                try {
                    createCheckpoint(sessionId, failed, FAILURE_CHECKPOINT_LABEL);
                } catch (StorageException storageError) {
                    log.warn("Could not checkpoint failed step {}: {}", step.id(), storageError.getMessage());
                    failure.addSuppressed(storageError);
                }
                log.warn("Step {} failed (recoverable={}): {}", step.id(), error.recoverable(), error.message());
                throw failure;
            }

            Step completed = executing.withCompleted(output != null ? output : Map.of(), clock.instant());
            ExecutionSession updated;
            synchronized (lock) {
                updated = requireSession(sessionId).withStepCompleted(clock.instant());
                saveSession(updated);
                recordStep(sessionId, completed);
            }
            if (shouldCheckpoint(completed, updated.completedSteps())) {
                createCheckpoint(sessionId, completed, null);
            }
            log.debug("Step {} completed in {}ms", step.id(), completed.durationMs());
            return completed;
        }
    }

    private boolean shouldCheckpoint(Step step, int completedSteps) {
        if (step.type() != null && step.type().checkpointsOnCompletion()) {
            return true;
        }
        return checkpointInterval > 0 && completedSteps % checkpointInterval == 0;
    }

    // ========== Checkpoints ==========

    /**
     * Checkpoint a step the session has already recorded.
     *
     * @throws NotFoundException if the session has no step with this id
     */
    public StepCheckpoint createCheckpoint(String sessionId, String stepId, String label) {
        Step step = getSteps(sessionId).stream()
            .filter(s -> s.id().equals(stepId))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Step", stepId));
        return createCheckpoint(sessionId, step, label);
    }

    /**
     * Checkpoint a step. The checkpoint captures every other step the session has recorded and
     * the session counters.
     */
    public StepCheckpoint createCheckpoint(String sessionId, Step step, String label) {
        StepCheckpoint checkpoint;
        synchronized (lock) {
            ExecutionSession session = requireSession(sessionId);
            List<Step> prior = getSteps(sessionId).stream()
                .filter(s -> !s.id().equals(step.id()))
                .toList();
            checkpoint = checkpoints.save(sessionId, session.currentWave(), step, prior, contextOf(session), label);
            saveSession(requireSession(sessionId).withCheckpoint(checkpoint.id(), clock.instant()));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stepId", step.id());
        payload.put("stepStatus", step.status().name());
        payload.put("sizeBytes", checkpoint.sizeBytes());
        if (label != null) {
            payload.put("label", label);
        }
        publish(ExecutionEventType.CHECKPOINT_CREATED, checkpoint.id(), sessionId, payload);
        log.info("Created checkpoint {} for step {}{}", checkpoint.id(), step.id(),
            label != null ? " (" + label + ")" : "");
        return checkpoint;
    }

    /**
     * Checkpoint summaries for a session, oldest first. Unreadable checkpoints are listed as invalid.
     */
    public List<StepCheckpointSummary> listStepCheckpoints(String sessionId) {
        List<StepCheckpointSummary> listed = checkpoints.list(sessionId);
        List<String> order = getSession(sessionId).map(ExecutionSession::checkpointIds).orElse(List.of());
        if (order.isEmpty()) {
            return listed;
        }
        List<StepCheckpointSummary> sorted = new ArrayList<>(listed);
        sorted.sort(Comparator.comparingInt(summary -> {
            int index = order.indexOf(summary.id());
            return index >= 0 ? index : Integer.MAX_VALUE;
        }));
        return sorted;
    }

    /**
     * @throws NotFoundException          if there is no such checkpoint
     * @throws CheckpointCorruptException if it fails verification
     */
    public StepCheckpoint loadStepCheckpoint(String checkpointId) {
        return checkpoints.load(checkpointId);
    }

    /**
     * Preview what resuming from a checkpoint would restore, with the engine's recommendation.
     */
    public RestorePreview restoreCheckpoint(String checkpointId) {
        StepCheckpoint checkpoint = checkpoints.load(checkpointId);
        return new RestorePreview(checkpoint.id(), checkpoint.sessionId(), checkpoint.step(),
            checkpoint.priorSteps(), decisionEngine.analyzeCheckpoint(checkpoint));
    }

    /**
     * Keep only the {@code keep} most recent checkpoints of a session.
     *
     * @return number of checkpoints deleted
     */
    public int compactCheckpoints(String sessionId, int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0, got " + keep);
        }
        synchronized (lock) {
            List<StepCheckpointSummary> all = listStepCheckpoints(sessionId);
            int excess = all.size() - keep;
            if (excess <= 0) {
                return 0;
            }
            for (StepCheckpointSummary summary : all.subList(0, excess)) {
                checkpoints.delete(sessionId, summary.id());
            }
            List<String> retained = all.subList(excess, all.size()).stream()
                .map(StepCheckpointSummary::id)
                .toList();
            getSession(sessionId).ifPresent(s -> saveSession(s.withCheckpoints(retained, clock.instant())));
            log.info("Compacted session {}: removed {} checkpoints, kept {}", sessionId, excess, retained.size());
            return excess;
        }
    }

    // ========== Replay ==========

    public ResumeResult resumeFromCheckpoint(String checkpointId) {
        return replayFromStep(ResumeOptions.from(checkpointId));
    }

    /**
     * Start a child session from a checkpoint. The checkpoint's prior steps are restored into the
     * new session. With {@code skipFailedStep}, a failed checkpointed step is replaced by a fresh
     * pending copy with id {@code <stepId>-resumed}.
     *
     * Missing or corrupt checkpoints yield a failed result rather than an exception.
     */
    public ResumeResult replayFromStep(ResumeOptions options) {
        StepCheckpoint checkpoint;
        try {
            checkpoint = checkpoints.load(options.checkpointId());
        } catch (NotFoundException | CheckpointCorruptException e) {
            log.warn("Cannot resume from {}: {}", options.checkpointId(), e.getMessage());
            return ResumeResult.failure(e.getMessage());
        }

        List<String> warnings = new ArrayList<>();
        Instant now = clock.instant();
        String name = options.sessionName() != null ? options.sessionName() : "Resumed: " + checkpoint.sessionId();

        Step resumeFrom = checkpoint.step();
        boolean skipped = false;
        if (options.skipFailedStep()) {
            if (resumeFrom.status() == StepStatus.FAILED) {
                resumeFrom = resumeFrom.asResumed();
                skipped = true;
            } else {
                warnings.add("Step " + resumeFrom.id() + " did not fail; nothing to skip");
            }
        }

        Optional<ExecutionSession> parent = getSession(checkpoint.sessionId());
        ExecutionSession session;
        if (parent.isPresent()) {
            session = ExecutionSession.resumed(parent.get(), name, checkpoint.id(), now);
        } else {
            warnings.add("Parent session " + checkpoint.sessionId() + " not found");
            session = new ExecutionSession(ExecutionSession.newSessionId(now), checkpoint.sessionId(), name,
                SessionStatus.ACTIVE, checkpoint.waveNumber(), null, List.of(), 0, 0,
                checkpoint.sessionId(), checkpoint.id(), now, now);
        }
        session = session.withCurrentStep(resumeFrom, now);

        ResumeDecision decision = decisionEngine.analyzeCheckpoint(checkpoint);
        if (decision.action() == ResumeAction.ABORT) {
            warnings.add("Recommended action is abort: " + decision.reason());
        }

        synchronized (lock) {
            saveSession(session);
            writeSteps(session.id(), checkpoint.priorSteps());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("checkpointId", checkpoint.id());
        details.put("parentSessionId", checkpoint.sessionId());
        details.put("resumeFromStep", resumeFrom.id());
        details.put("skippedFailedStep", skipped);
        details.put("recommendedAction", decision.action().value());
        details.put("confidence", decision.confidence());
        recordDecision(session.id(), DecisionLogEntry.CATEGORY_RECOVERY,
            "Resumed from checkpoint " + checkpoint.id(),
            "Checkpoint was at step " + checkpoint.step().name() + " in wave " + checkpoint.waveNumber(),
            details);

        publish(ExecutionEventType.SESSION_RESUMED, session.id(), session.id(), details);
        log.info("Resumed session {} from checkpoint {} at step {}", session.id(), checkpoint.id(), resumeFrom.id());

        return new ResumeResult(true, session, resumeFrom, checkpoint.priorSteps(), decision,
            List.copyOf(warnings), null);
    }

    // ========== Decision log ==========

    public DecisionLogEntry recordDecision(String sessionId, String category, String decision,
                                           String rationale, Map<String, Object> details) {
        DecisionLogEntry entry = new DecisionLogEntry(UUID.randomUUID().toString(), sessionId, category,
            decision, rationale, details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of(), clock.instant());
        store.create(DECISION_PREFIX + sessionId + "/" + entry.id(), objectMapper.valueToTree(entry));
        log.debug("Decision [{}] {}: {}", category, sessionId, decision);
        return entry;
    }

    public List<DecisionLogEntry> getDecisionLog(String sessionId) {
        List<DecisionLogEntry> entries = new ArrayList<>();
        for (DocumentSummary doc : store.list(DECISION_PREFIX + sessionId + "/")) {
            store.get(doc.key()).ifPresent(node -> entries.add(read(node, DecisionLogEntry.class)));
        }
        entries.sort(Comparator.comparing(DecisionLogEntry::timestamp));
        return entries;
    }

    // ========== Internals ==========

    private Map<String, Object> contextOf(ExecutionSession session) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("sessionId", session.id());
        context.put("executionId", session.executionId());
        context.put("currentWave", session.currentWave());
        context.put("completedSteps", session.completedSteps());
        context.put("failedSteps", session.failedSteps());
        return context;
    }

    private void recordStep(String sessionId, Step step) {
        List<Step> steps = new ArrayList<>(getSteps(sessionId));
        int index = -1;
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(step.id())) {
                index = i;
                break;
            }
        }
        if (index >= 0) {
            steps.set(index, step);
        } else {
            steps.add(step);
        }
        writeSteps(sessionId, steps);
    }

    private void writeSteps(String sessionId, List<Step> steps) {
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("sessionId", sessionId);
        doc.set("steps", objectMapper.valueToTree(steps));
        store.put(STEPS_PREFIX + sessionId, doc);
    }

    private void saveSession(ExecutionSession session) {
        store.put(SESSION_PREFIX + session.id(), objectMapper.valueToTree(session));
    }

    private List<Step> readSteps(JsonNode node) {
        try {
            return objectMapper.readerFor(STEP_LIST).readValue(node);
        } catch (IOException e) {
            throw new StorageException("Failed to read session steps", e);
        }
    }

    private <T> T read(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to read " + type.getSimpleName(), e);
        }
    }

    private void publish(ExecutionEventType type, String subjectId, String sessionId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ExecutionEvent.of(type, subjectId, sessionId, payload));
        }
    }
}
