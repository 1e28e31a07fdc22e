package com.agentexec.engine.statemachine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.test.FailureInjector;
import com.agentexec.core.transition.StandardTransitions;
import com.agentexec.core.transition.Transition;
import com.agentexec.core.transition.TransitionResult;
import com.agentexec.engine.events.ExecutionEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateMachineExecutorTest {

    private ExecutionEventBus bus;
    private List<ExecutionEventType> events;

    @BeforeEach
    void setUp() {
        bus = new ExecutionEventBus();
        events = new ArrayList<>();
        bus.subscribeAll(e -> events.add(e.type()));
    }

    private ExecutionHandlers producing(String content) {
        return ExecutionHandlers.builder()
            .onExecuting(ctx -> ctx.putOutput("content", content))
            .build();
    }

    // ========== Full lifecycle ==========

    @Test
    void execute_happyPathReachesCompleted() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "write code"));

        ExecutionResult result = machine.execute(ctx, producing("done"));

        assertThat(result.success()).isTrue();
        assertThat(result.finalState()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(result.retryCount()).isZero();
        assertThat(result.history()).hasSize(5);
        assertThat(ctx.getEndTime()).isNotNull();
        assertThat(ctx.getAttempt()).isEqualTo(1);
        assertThat(events).filteredOn(t -> t == ExecutionEventType.STATE_CHANGED).hasSize(5);
    }

    @Test
    @DisplayName("Failed verification loops back to EXECUTING until it passes")
    void execute_retriesUntilVerified() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "write code"));
        AtomicInteger verifications = new AtomicInteger();
        ExecutionHandlers handlers = ExecutionHandlers.builder()
            .onExecuting(c -> c.putOutput("content", "attempt " + c.getAttempt()))
            .onVerifying(c -> verifications.incrementAndGet() >= 3)
            .build();

        ExecutionResult result = machine.execute(ctx, handlers);

        assertThat(result.success()).isTrue();
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(ctx.getAttempt()).isEqualTo(3);
        assertThat(ctx.getOutputs()).containsEntry("content", "attempt 3");
        assertThat(result.history()).extracting(HistoryEntry::transitionId)
            .contains(StandardTransitions.RETRY_FROM_VERIFICATION);
    }

    @Test
    void execute_failsAfterMaxRetries() {
        StateMachineConfig config = StateMachineConfig.builder().maxRetries(2).build();
        StateMachineExecutor machine = new StateMachineExecutor(config, bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "write code"));
        ExecutionHandlers handlers = ExecutionHandlers.builder()
            .onExecuting(c -> c.putOutput("content", "wrong"))
            .onVerifying(c -> false)
            .build();

        ExecutionResult result = machine.execute(ctx, handlers);

        assertThat(result.success()).isFalse();
        assertThat(result.finalState()).isEqualTo(ExecutionState.FAILED);
        assertThat(result.error()).isEqualTo("Max retries (2) exceeded");
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(ctx.getError()).isEqualTo("Max retries (2) exceeded");
    }

    @Test
    void execute_handlerExceptionFailsContext() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "write code"));
        ExecutionHandlers handlers = ExecutionHandlers.builder()
            .onExecuting(FailureInjector.alwaysFail("provider timeout").failingAction())
            .build();

        ExecutionResult result = machine.execute(ctx, handlers);

        assertThat(result.finalState()).isEqualTo(ExecutionState.FAILED);
        assertThat(result.error()).isEqualTo("provider timeout");
    }

    @Test
    void execute_requiresIdleContext() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "x"));
        ctx.setState(ExecutionState.EXECUTING);

        ExecutionResult result = machine.execute(ctx, ExecutionHandlers.none());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Execution must start from IDLE state");
        assertThat(ctx.getState()).isEqualTo(ExecutionState.EXECUTING);
    }

    // ========== Single transitions ==========

    @Test
    void executeTransition_unknownIdIsUndefined() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "x"));

        TransitionResult result = machine.executeTransition(ctx, "does-not-exist");

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(TransitionResult.UNDEFINED_TRANSITION);
    }

    @Test
    void executeTransition_byIdMovesContext() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "x"));

        TransitionResult result = machine.executeTransition(ctx, StandardTransitions.START_PLANNING);

        assertThat(result.success()).isTrue();
        assertThat(ctx.getState()).isEqualTo(ExecutionState.PLANNING);
        assertThat(events).containsExactly(ExecutionEventType.STATE_CHANGED);
    }

    @Test
    void failTransitions_absentWhenFailFromAnyDisabled() {
        StateMachineConfig config = StateMachineConfig.builder().allowFailFromAny(false).build();
        StateMachineExecutor machine = new StateMachineExecutor(config, bus);

        assertThat(machine.getTransition(StandardTransitions.failId(ExecutionState.PLANNING))).isEmpty();
        assertThat(machine.getAvailableTransitions(ExecutionState.PLANNING))
            .extracting(Transition::getTo)
            .containsExactly(ExecutionState.EXECUTING);
    }

    @Test
    void registerTransition_rejectsEdgesOutsideLifecycle() {
        StateMachineExecutor machine = new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        Transition skip = Transition.builder("skip", ExecutionState.IDLE, ExecutionState.COMPLETED)
            .name("Skip")
            .build();

        assertThatThrownBy(() -> machine.registerTransition(skip))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(machine.isValidTransition(ExecutionState.VERIFYING, ExecutionState.EXECUTING)).isTrue();
        assertThat(machine.isValidTransition(ExecutionState.COMPLETED, ExecutionState.FAILED)).isFalse();
    }

    @Test
    void onStateChangeCallback_exceptionsDoNotBreakTransitions() {
        StateMachineConfig config = StateMachineConfig.builder()
            .onStateChange((from, to, ctx) -> {
                throw new IllegalStateException("listener bug");
            })
            .build();
        StateMachineExecutor machine = new StateMachineExecutor(config, bus);
        ExecutionContext ctx = ExecutionContext.create("t1", Map.of("prompt", "x"));

        ExecutionResult result = machine.execute(ctx, producing("ok"));

        assertThat(result.success()).isTrue();
    }

    // ========== Logging ==========

    @Test
    @DisplayName("Building a machine logs one line, not one per standard transition")
    void construction_logsOnce() {
        Logger logger = (Logger) LoggerFactory.getLogger(StateMachineExecutor.class);
        Level previous = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        try {
            new StateMachineExecutor(StateMachineConfig.defaults(), bus);
            new StateMachineExecutor(StateMachineConfig.defaults(), bus);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previous);
        }

        assertThat(appender.list).hasSize(2)
            .allSatisfy(e -> assertThat(e.getFormattedMessage()).startsWith("State machine ready with"));
    }
}
