package com.agentexec.recovery.session;

import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.exception.StepExecutionException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.model.DecisionLogEntry;
import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionSession;
import com.agentexec.core.model.ResumeAction;
import com.agentexec.core.model.ResumeOptions;
import com.agentexec.core.model.ResumeResult;
import com.agentexec.core.model.SessionStatus;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.core.model.StepCheckpointSummary;
import com.agentexec.core.model.StepStatus;
import com.agentexec.core.model.StepType;
import com.agentexec.core.test.FailureInjector;
import com.agentexec.core.test.TimeController;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.json.JsonSupport;
import com.agentexec.engine.persistence.InMemoryDocumentStore;
import com.agentexec.recovery.checkpoint.CheckpointRepository;
import com.agentexec.recovery.decision.PatternResumeDecisionEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepExecutorTest {

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private final List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
    private TimeController clock;
    private InMemoryDocumentStore store;
    private ExecutionEventBus eventBus;

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryDocumentStore(clock);
        eventBus = new ExecutionEventBus();
        eventBus.subscribeAll(events::add);
    }

    private StepExecutor executor(int checkpointInterval) {
        return new StepExecutor(new CheckpointRepository(store, mapper, clock), store, mapper,
            new PatternResumeDecisionEngine(clock), eventBus, checkpointInterval, clock);
    }

    private static Step step(int sequence, StepType type) {
        return Step.create("task-1", 0, sequence, type, "Step " + sequence, Map.of("n", sequence));
    }

    private static StepAction ok(String key) {
        return s -> Map.of(key, s.id());
    }

    private List<ExecutionEventType> eventTypes() {
        return events.stream().map(ExecutionEvent::type).toList();
    }

    // ========== Sessions ==========

    @Test
    @DisplayName("Starting a session persists it and announces it")
    void startSession() {
        StepExecutor executor = executor(0);

        ExecutionSession session = executor.startSession("exec-1", null);

        assertThat(session.id()).startsWith("session-1709287200000-");
        assertThat(session.name()).isEqualTo("Execution exec-1");
        assertThat(executor.requireSession(session.id())).isEqualTo(session);
        assertThat(executor.getSteps(session.id())).isEmpty();
        assertThat(eventTypes()).containsExactly(ExecutionEventType.SESSION_STARTED);
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> executor(0).requireSession("session-x"))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Session not found: session-x");
    }

    // ========== Step execution ==========

    @Nested
    @DisplayName("executeStep")
    class ExecuteStep {

        @Test
        @DisplayName("Execution steps complete and checkpoint automatically")
        void executionStepCheckpoints() {
            StepExecutor executor = executor(0);
            ExecutionSession session = executor.startSession("exec-1", "Feature");

            Step completed = executor.executeStep(session.id(), step(1, StepType.EXECUTION), ok("result"));

            assertThat(completed.status()).isEqualTo(StepStatus.COMPLETED);
            assertThat(completed.attemptNumber()).isEqualTo(1);
            assertThat(completed.output()).containsEntry("result", completed.id());

            ExecutionSession updated = executor.requireSession(session.id());
            assertThat(updated.completedSteps()).isEqualTo(1);
            assertThat(updated.currentStepId()).isEqualTo(completed.id());
            assertThat(updated.checkpointIds()).hasSize(1);
            assertThat(eventTypes()).containsExactly(
                ExecutionEventType.SESSION_STARTED, ExecutionEventType.CHECKPOINT_CREATED);
        }

        @Test
        @DisplayName("Validation steps checkpoint only at the configured interval")
        void intervalCheckpoints() {
            StepExecutor none = executor(0);
            ExecutionSession first = none.startSession("exec-1", null);
            none.executeStep(first.id(), step(1, StepType.VALIDATION), ok("v"));
            assertThat(none.listStepCheckpoints(first.id())).isEmpty();

            StepExecutor everySecond = executor(2);
            ExecutionSession second = everySecond.startSession("exec-2", null);
            for (int i = 1; i <= 4; i++) {
                everySecond.executeStep(second.id(), step(i, StepType.VALIDATION), ok("v"));
            }
            assertThat(everySecond.listStepCheckpoints(second.id()))
                .extracting(StepCheckpointSummary::stepId)
                .containsExactly(Step.stepId(0, "task-1", 2), Step.stepId(0, "task-1", 4));
        }

        @Test
        @DisplayName("A failing action records the failure, checkpoints it and throws")
        void failureIsRecordedAndCheckpointed() {
            StepExecutor executor = executor(0);
            ExecutionSession session = executor.startSession("exec-1", null);
            FailureInjector injector = FailureInjector.alwaysFail("connection refused by provider");
            Step step = step(1, StepType.VALIDATION);

            assertThatThrownBy(() -> executor.executeStep(session.id(), step, s -> {
                injector.maybeThrow();
                return Map.of();
            }))
                .isInstanceOf(StepExecutionException.class)
                .hasMessage("Step " + step.id() + " failed: connection refused by provider")
                .satisfies(e -> assertThat(((StepExecutionException) e).getStepError().recoverable()).isTrue());

            ExecutionSession updated = executor.requireSession(session.id());
            assertThat(updated.failedSteps()).isEqualTo(1);
            assertThat(executor.getSteps(session.id())).singleElement()
                .satisfies(s -> assertThat(s.status()).isEqualTo(StepStatus.FAILED));
            assertThat(executor.listStepCheckpoints(session.id())).singleElement()
                .satisfies(summary -> assertThat(summary.label()).isEqualTo(StepExecutor.FAILURE_CHECKPOINT_LABEL));
        }

        @Test
        @DisplayName("A checkpoint write failure does not hide the step's own error")
        void failureCheckpointErrorIsSuppressed() {
            store = new InMemoryDocumentStore(clock) {
                @Override
                public void create(String key, JsonNode document) {
                    if (key.startsWith("checkpoints/")) {
                        throw new StorageException("Failed to create document " + key, new IOException("disk full"));
                    }
                    super.create(key, document);
                }
            };
            StepExecutor executor = executor(0);
            ExecutionSession session = executor.startSession("exec-1", null);
            Step step = step(1, StepType.VALIDATION);

            assertThatThrownBy(() -> executor.executeStep(session.id(), step, s -> {
                FailureInjector.alwaysFail("model refused the request").maybeThrow();
                return Map.of();
            }))
                .isInstanceOf(StepExecutionException.class)
                .hasMessage("Step " + step.id() + " failed: model refused the request")
                .satisfies(e -> assertThat(e.getSuppressed()).singleElement()
                    .isInstanceOf(StorageException.class));

            assertThat(executor.requireSession(session.id()).failedSteps()).isEqualTo(1);
        }

        @Test
        @DisplayName("Retrying a failed step increments its attempt and replaces the recorded step")
        void retryIncrementsAttempt() {
            StepExecutor executor = executor(0);
            ExecutionSession session = executor.startSession("exec-1", null);
            FailureInjector injector = FailureInjector.builder().failFirst(1).withMessage("rate limit hit").build();
            StepAction flaky = s -> {
                injector.maybeThrow();
                return Map.of("ok", true);
            };

            Step failed = null;
            try {
                executor.executeStep(session.id(), step(1, StepType.VALIDATION), flaky);
            } catch (StepExecutionException e) {
                failed = executor.getSteps(session.id()).get(0);
            }
            Step retried = executor.executeStep(session.id(), failed, flaky);

            assertThat(retried.attemptNumber()).isEqualTo(2);
            assertThat(retried.status()).isEqualTo(StepStatus.COMPLETED);
            assertThat(executor.getSteps(session.id())).containsExactly(retried);
            assertThat(injector.getInvocationCount()).isEqualTo(2);
        }

        @Test
        void abandonedSessionRejectsSteps() {
            StepExecutor executor = executor(0);
            ExecutionSession session = executor.startSession("exec-1", null);
            executor.abandonSession(session.id(), "test");

            assertThatThrownBy(() -> executor.executeStep(session.id(), step(1, StepType.EXECUTION), ok("x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ABANDONED");
            assertThat(eventTypes()).contains(ExecutionEventType.SESSION_ABANDONED);
        }
    }

    // ========== Checkpoints ==========

    @Test
    @DisplayName("Checkpoint captures the steps that ran before it")
    void checkpointCapturesPriorSteps() {
        StepExecutor executor = executor(0);
        ExecutionSession session = executor.startSession("exec-1", null);
        Step first = executor.executeStep(session.id(), step(1, StepType.VALIDATION), ok("a"));
        Step second = executor.executeStep(session.id(), step(2, StepType.VALIDATION), ok("b"));

        StepCheckpoint checkpoint = executor.createCheckpoint(session.id(), second.id(), "manual");
        StepCheckpoint loaded = executor.loadStepCheckpoint(checkpoint.id());

        assertThat(loaded.stepId()).isEqualTo(second.id());
        assertThat(loaded.priorSteps()).containsExactly(first);
        assertThat(loaded.context()).containsEntry("completedSteps", 2);
        assertThat(loaded.label()).isEqualTo("manual");
    }

    @Test
    void checkpointForUnknownStepIsNotFound() {
        StepExecutor executor = executor(0);
        ExecutionSession session = executor.startSession("exec-1", null);

        assertThatThrownBy(() -> executor.createCheckpoint(session.id(), "nope", null))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Step not found: nope");
    }

    @Test
    @DisplayName("Checkpoints created within the same millisecond list in creation order")
    void listFollowsCreationOrder() {
        StepExecutor executor = executor(0);
        ExecutionSession session = executor.startSession("exec-1", null);
        Step done = executor.executeStep(session.id(), step(1, StepType.VALIDATION), ok("a"));

        StepCheckpoint a = executor.createCheckpoint(session.id(), done, "a");
        StepCheckpoint b = executor.createCheckpoint(session.id(), done, "b");
        StepCheckpoint c = executor.createCheckpoint(session.id(), done, "c");

        assertThat(executor.listStepCheckpoints(session.id()))
            .extracting(StepCheckpointSummary::id)
            .containsExactly(a.id(), b.id(), c.id());
    }

    @Test
    @DisplayName("Restore preview does not change any session")
    void restorePreviewIsReadOnly() {
        StepExecutor executor = executor(0);
        ExecutionSession session = executor.startSession("exec-1", null);
        Step done = executor.executeStep(session.id(), step(1, StepType.EXECUTION), ok("a"));
        String checkpointId = executor.requireSession(session.id()).checkpointIds().get(0);
        ExecutionSession before = executor.requireSession(session.id());

        RestorePreview preview = executor.restoreCheckpoint(checkpointId);

        assertThat(preview.step()).isEqualTo(done);
        assertThat(preview.sessionId()).isEqualTo(session.id());
        assertThat(preview.decision().action()).isEqualTo(ResumeAction.RESUME);
        assertThat(preview.decision().confidence()).isEqualTo(0.95);
        assertThat(executor.listSessions()).containsExactly(before);
    }

    @Test
    @DisplayName("Compaction keeps the most recent checkpoints")
    void compactKeepsMostRecent() {
        StepExecutor executor = executor(0);
        ExecutionSession session = executor.startSession("exec-1", null);
        for (int i = 1; i <= 5; i++) {
            executor.executeStep(session.id(), step(i, StepType.EXECUTION), ok("x"));
            clock.advanceMillis(5);
        }
        List<String> all = executor.requireSession(session.id()).checkpointIds();

        int removed = executor.compactCheckpoints(session.id(), 2);

        assertThat(removed).isEqualTo(3);
        assertThat(executor.listStepCheckpoints(session.id()))
            .extracting(StepCheckpointSummary::id)
            .containsExactly(all.get(3), all.get(4));
        assertThat(executor.requireSession(session.id()).checkpointIds()).containsExactly(all.get(3), all.get(4));
        assertThat(executor.compactCheckpoints(session.id(), 5)).isZero();
        assertThatThrownBy(() -> executor.compactCheckpoints(session.id(), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Replay ==========

    @Nested
    @DisplayName("replayFromStep")
    class Replay {

        private StepExecutor executor;
        private ExecutionSession session;
        private Step first;
        private String failureCheckpoint;

        @BeforeEach
        void runUntilFailure() {
            executor = executor(0);
            session = executor.startSession("exec-1", "Feature");
            first = executor.executeStep(session.id(), step(1, StepType.VALIDATION), ok("a"));
            try {
                executor.executeStep(session.id(), step(2, StepType.EXECUTION), s -> {
                    throw new IllegalStateException("connection reset while calling provider");
                });
            } catch (StepExecutionException expected) {
                failureCheckpoint = executor.requireSession(session.id()).checkpointIds().get(0);
            }
        }

        @Test
        @DisplayName("Skipping the failed step resumes from a fresh pending copy in a child session")
        void skipFailedStep() {
            ResumeResult result = executor.replayFromStep(ResumeOptions.from(failureCheckpoint).skippingFailedStep());

            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).isEmpty();
            assertThat(result.resumeFromStep().id()).isEqualTo(Step.stepId(0, "task-1", 2) + "-resumed");
            assertThat(result.resumeFromStep().status()).isEqualTo(StepStatus.PENDING);
            assertThat(result.resumeFromStep().error()).isNull();
            assertThat(result.restoredSteps()).containsExactly(first);
            assertThat(result.decision().action()).isEqualTo(ResumeAction.RESUME);

            ExecutionSession child = result.session();
            assertThat(child.id()).isNotEqualTo(session.id());
            assertThat(child.parentSessionId()).isEqualTo(session.id());
            assertThat(child.replayFromCheckpoint()).isEqualTo(failureCheckpoint);
            assertThat(child.executionId()).isEqualTo("exec-1");
            assertThat(child.currentStepId()).isEqualTo(result.resumeFromStep().id());
            assertThat(executor.getSteps(child.id())).containsExactly(first);
            assertThat(eventTypes()).contains(ExecutionEventType.SESSION_RESUMED);
        }

        @Test
        @DisplayName("Each replay is written to the child session's decision log")
        void replayIsLogged() {
            ResumeResult result = executor.replayFromStep(ResumeOptions.from(failureCheckpoint).skippingFailedStep());

            assertThat(executor.getDecisionLog(result.session().id())).singleElement().satisfies(entry -> {
                assertThat(entry.category()).isEqualTo(DecisionLogEntry.CATEGORY_RECOVERY);
                assertThat(entry.decision()).isEqualTo("Resumed from checkpoint " + failureCheckpoint);
                assertThat(entry.rationale()).isEqualTo("Checkpoint was at step Step 2 in wave 0");
                assertThat(entry.details()).containsEntry("skippedFailedStep", true);
            });
            assertThat(executor.getDecisionLog(session.id())).isEmpty();
        }

        @Test
        @DisplayName("Without skipping, the failed step itself is the resume point")
        void resumeWithoutSkipping() {
            ResumeResult result = executor.resumeFromCheckpoint(failureCheckpoint);

            assertThat(result.success()).isTrue();
            assertThat(result.resumeFromStep().id()).isEqualTo(Step.stepId(0, "task-1", 2));
            assertThat(result.resumeFromStep().status()).isEqualTo(StepStatus.FAILED);
        }

        @Test
        void skippingACompletedStepWarns() {
            executor.createCheckpoint(session.id(), first.id(), null);
            String completedCheckpoint = executor.requireSession(session.id()).checkpointIds().get(1);

            ResumeResult result = executor.replayFromStep(ResumeOptions.from(completedCheckpoint).skippingFailedStep());

            assertThat(result.resumeFromStep()).isEqualTo(first);
            assertThat(result.warnings()).containsExactly("Step " + first.id() + " did not fail; nothing to skip");
        }

        @Test
        @DisplayName("Missing checkpoints yield a failed result instead of throwing")
        void missingCheckpoint() {
            ResumeResult result = executor.replayFromStep(ResumeOptions.from("checkpoint-nope"));

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Checkpoint not found: checkpoint-nope");
            assertThat(result.session()).isNull();
        }

        @Test
        void childSessionCanContinue() {
            ResumeResult result = executor.replayFromStep(ResumeOptions.from(failureCheckpoint).skippingFailedStep());
            String childId = result.session().id();

            Step done = executor.executeStep(childId, result.resumeFromStep(), ok("done"));

            assertThat(done.status()).isEqualTo(StepStatus.COMPLETED);
            assertThat(executor.getSteps(childId)).containsExactly(first, done);
            assertThat(executor.requireSession(childId).status()).isEqualTo(SessionStatus.ACTIVE);
        }
    }
}
