package com.agentexec.recovery;

import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionSession;
import com.agentexec.core.model.SessionStatus;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepType;
import com.agentexec.core.test.TimeController;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.json.JsonSupport;
import com.agentexec.engine.persistence.InMemoryDocumentStore;
import com.agentexec.recovery.checkpoint.CheckpointRepository;
import com.agentexec.recovery.decision.PatternResumeDecisionEngine;
import com.agentexec.recovery.session.StepExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaleSessionReaperTest {

    private TimeController clock;
    private StepExecutor stepExecutor;
    private StaleSessionReaper reaper;
    private final List<ExecutionEvent> abandoned = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-03-01T10:00:00Z"));
        ObjectMapper mapper = JsonSupport.objectMapper();
        InMemoryDocumentStore store = new InMemoryDocumentStore(clock);
        ExecutionEventBus eventBus = new ExecutionEventBus();
        eventBus.subscribe(ExecutionEventType.SESSION_ABANDONED, abandoned::add);
        PatternResumeDecisionEngine decisionEngine = new PatternResumeDecisionEngine(clock);
        stepExecutor = new StepExecutor(new CheckpointRepository(store, mapper, clock), store, mapper,
            decisionEngine, eventBus, 1, clock);
        reaper = new StaleSessionReaper(stepExecutor, decisionEngine,
            Duration.ofMinutes(30), Duration.ofSeconds(60), clock);
    }

    @AfterEach
    void tearDown() {
        reaper.stop();
    }

    @Test
    @DisplayName("Only active sessions idle past the threshold are abandoned")
    void abandonsStaleSessions() {
        ExecutionSession stale = stepExecutor.startSession("exec-stale", null);
        stepExecutor.executeStep(stale.id(),
            Step.create("task-1", 0, 1, StepType.EXECUTION, "Implement", Map.of()), s -> Map.of("ok", true));
        clock.advanceMinutes(20);
        ExecutionSession fresh = stepExecutor.startSession("exec-fresh", null);
        ExecutionSession finished = stepExecutor.startSession("exec-done", null);
        stepExecutor.updateSessionStatus(finished.id(), SessionStatus.COMPLETED);
        clock.advanceMinutes(15);

        List<String> reaped = reaper.scan();

        assertThat(reaped).containsExactly(stale.id());
        assertThat(stepExecutor.requireSession(stale.id()).status()).isEqualTo(SessionStatus.ABANDONED);
        assertThat(stepExecutor.requireSession(fresh.id()).status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(stepExecutor.requireSession(finished.id()).status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(abandoned).singleElement().satisfies(event -> {
            assertThat(event.sessionId()).isEqualTo(stale.id());
            assertThat(String.valueOf(event.payload().get("reason"))).startsWith("No progress since");
        });
    }

    @Test
    @DisplayName("Abandoned sessions are not reaped twice")
    void scanIsIdempotent() {
        stepExecutor.startSession("exec-1", null);
        clock.advanceMinutes(45);

        assertThat(reaper.scan()).hasSize(1);
        assertThat(reaper.scan()).isEmpty();
        assertThat(abandoned).hasSize(1);
    }

    @Test
    void startAndStop() {
        assertThat(reaper.isRunning()).isFalse();

        reaper.start();
        assertThat(reaper.isRunning()).isTrue();

        reaper.stop();
        assertThat(reaper.isRunning()).isFalse();
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new StaleSessionReaper(stepExecutor, new PatternResumeDecisionEngine(clock),
            Duration.ZERO, Duration.ofSeconds(1), clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
