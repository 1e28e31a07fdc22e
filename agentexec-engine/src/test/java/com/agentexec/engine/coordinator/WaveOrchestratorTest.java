package com.agentexec.engine.coordinator;

import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.model.ResourceSnapshot;
import com.agentexec.core.spi.PromptExecutor;
import com.agentexec.core.spi.PromptResponse;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.resource.ResourceManager;
import com.agentexec.engine.resource.ResourceThresholds;
import com.agentexec.engine.statemachine.StateMachineConfig;
import com.agentexec.engine.statemachine.StateMachineExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaveOrchestratorTest {

    private ExecutorService pool;
    private ExecutionEventBus bus;
    private ResourceManager resources;
    private List<String> executedPrompts;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        bus = new ExecutionEventBus();
        resources = new ResourceManager(3, ResourceThresholds.defaults(), () -> ResourceSnapshot.of(10, 10, 10), bus);
        executedPrompts = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private WaveOrchestrator orchestrator(PromptExecutor executor, AdmissionPolicy admission) {
        return new WaveOrchestrator(resources, executor,
            () -> new StateMachineExecutor(StateMachineConfig.builder().maxRetries(1).build(), bus),
            pool, bus, admission, Duration.ofSeconds(30));
    }

    private WaveOrchestrator orchestrator() {
        return orchestrator(echo(), new AdmissionPolicy(3, Duration.ofMillis(10)));
    }

    /** Echoes the prompt; a prompt starting with "boom" throws. */
    private PromptExecutor echo() {
        return (prompt, config) -> {
            executedPrompts.add(prompt);
            if (prompt.startsWith("boom")) {
                throw new IllegalStateException("provider error for " + prompt);
            }
            return PromptResponse.of("done: " + prompt);
        };
    }

    // ========== Splitting ==========

    @Test
    void splitIntoWavesKeepsOrder() {
        List<WaveTask> tasks = List.of(WaveTask.of("a", "p"), WaveTask.of("b", "p"), WaveTask.of("c", "p"),
            WaveTask.of("d", "p"), WaveTask.of("e", "p"));

        List<List<WaveTask>> waves = orchestrator().splitIntoWaves(tasks, 2);

        assertThat(waves).hasSize(3);
        assertThat(waves.get(0)).extracting(WaveTask::id).containsExactly("a", "b");
        assertThat(waves.get(2)).extracting(WaveTask::id).containsExactly("e");
        assertThat(orchestrator().splitIntoWaves(List.of(), 3)).isEmpty();
    }

    @Test
    void splitRejectsNonPositiveSize() {
        assertThatThrownBy(() -> orchestrator().splitIntoWaves(List.of(WaveTask.of("a", "p")), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("waveSize must be at least 1");
    }

    // ========== Execution ==========

    @Test
    void allTasksCompleteAndSlotsAreReleased() {
        WaveRunResult result = orchestrator().executeWaves(
            List.of(WaveTask.of("a", "write a"), WaveTask.of("b", "write b"), WaveTask.of("c", "write c"),
                WaveTask.of("d", "write d")),
            new WaveOptions(2, false));

        assertThat(result.totalSuccess()).isEqualTo(4);
        assertThat(result.totalFailure()).isZero();
        assertThat(result.waves()).extracting(WaveSummary::taskCount).containsExactly(2, 2);
        assertThat(result.tasks()).allSatisfy(t -> {
            assertThat(t.finalState()).isEqualTo(ExecutionState.COMPLETED);
            assertThat(t.outputs()).containsKey("content");
        });
        assertThat(result.tasks().get(0).outputs()).containsEntry("content", "done: write a");
        assertThat(resources.getActiveAgentCount()).isZero();
    }

    @Test
    void defaultWaveSizeIsTheConcurrencyLimit() {
        WaveRunResult result = orchestrator().executeWaves(
            List.of(WaveTask.of("a", "p"), WaveTask.of("b", "p"), WaveTask.of("c", "p"), WaveTask.of("d", "p")),
            WaveOptions.defaults());

        assertThat(result.waves()).extracting(WaveSummary::taskCount).containsExactly(3, 1);
    }

    @Test
    @DisplayName("A failed wave stops the run unless continueOnError is set")
    void failureStopsLaterWaves() {
        List<WaveTask> tasks = List.of(WaveTask.of("a", "boom a"), WaveTask.of("b", "write b"));

        WaveRunResult stopped = orchestrator().executeWaves(tasks, new WaveOptions(1, false));

        assertThat(stopped.tasks()).extracting(TaskResult::id).containsExactly("a");
        assertThat(stopped.tasks().get(0).error()).startsWith("Task execution failed:")
            .contains("provider error for boom a");
        assertThat(stopped.waves()).hasSize(1);
        assertThat(executedPrompts).doesNotContain("write b");

        WaveRunResult continued = orchestrator().executeWaves(tasks, new WaveOptions(1, true));

        assertThat(continued.tasks()).extracting(TaskResult::id).containsExactly("a", "b");
        assertThat(continued.totalSuccess()).isEqualTo(1);
        assertThat(continued.totalFailure()).isEqualTo(1);
    }

    @Test
    void dependentsOfFailedTasksDoNotRun() {
        List<WaveTask> tasks = List.of(
            WaveTask.of("a", "boom a"),
            WaveTask.of("b", "write b", "a"),
            WaveTask.of("c", "write c", "missing"));

        WaveRunResult result = orchestrator().executeWaves(tasks, new WaveOptions(1, true));

        assertThat(result.tasks().get(1).error()).isEqualTo(WaveOrchestrator.DEPENDENCIES_NOT_SATISFIED);
        assertThat(result.tasks().get(2).error()).isEqualTo(WaveOrchestrator.DEPENDENCIES_NOT_SATISFIED);
        assertThat(executedPrompts).containsExactly("boom a");
    }

    @Test
    void dependencyInsideOneWaveRunsFirst() {
        List<WaveTask> tasks = List.of(
            WaveTask.of("a", "write a"),
            WaveTask.of("b", "write b", "a"));

        WaveRunResult result = orchestrator().executeWaves(tasks, new WaveOptions(2, false));

        assertThat(result.totalSuccess()).isEqualTo(2);
        assertThat(executedPrompts).containsExactly("write a", "write b");
    }

    @Test
    void taskFailsWhenNoSlotFreesUp() {
        resources.registerAgent("x");
        resources.registerAgent("y");
        resources.registerAgent("z");

        WaveRunResult result = orchestrator(echo(), new AdmissionPolicy(2, Duration.ofMillis(5)))
            .executeWaves(List.of(WaveTask.of("a", "write a")), WaveOptions.defaults());

        assertThat(result.tasks()).singleElement()
            .satisfies(t -> assertThat(t.error()).isEqualTo(WaveOrchestrator.RESOURCE_LIMIT_EXCEEDED));
        assertThat(executedPrompts).isEmpty();
        assertThat(resources.getActiveAgents()).containsExactlyInAnyOrder("x", "y", "z");
    }

    @Test
    void duplicateTaskIdsAreRejected() {
        assertThatThrownBy(() -> orchestrator().executeWaves(
                List.of(WaveTask.of("a", "p"), WaveTask.of("a", "q")), WaveOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate task id: a");
    }

    // ========== Concurrent runs ==========

    @Test
    @DisplayName("Two runs of the same task id share the concurrency limit and release their own slots")
    void concurrentRunsOfSameTaskRespectTheLimit() throws Exception {
        resources = new ResourceManager(1, ResourceThresholds.defaults(), () -> ResourceSnapshot.of(10, 10, 10), bus);
        CountDownLatch firstRunning = new CountDownLatch(1);
        CountDownLatch secondDenied = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        bus.subscribeAll(e -> {
            if (e.type() == ExecutionEventType.ADMISSION_DENIED) {
                secondDenied.countDown();
            }
        });
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<Integer> activeWhileRunning = new CopyOnWriteArrayList<>();
        PromptExecutor gated = (prompt, config) -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            activeWhileRunning.add(resources.getActiveAgentCount());
            try {
                firstRunning.countDown();
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inFlight.decrementAndGet();
            }
            return PromptResponse.of("done: " + prompt);
        };
        WaveOrchestrator orchestrator = orchestrator(gated, new AdmissionPolicy(500, Duration.ofMillis(10)));
        ExecutorService callers = Executors.newFixedThreadPool(2);

        try {
            Future<WaveRunResult> first = callers.submit(() ->
                orchestrator.executeWaves(List.of(WaveTask.of("t1", "first")), WaveOptions.defaults()));
            assertThat(firstRunning.await(5, TimeUnit.SECONDS)).isTrue();
            Future<WaveRunResult> second = callers.submit(() ->
                orchestrator.executeWaves(List.of(WaveTask.of("t1", "second")), WaveOptions.defaults()));
            assertThat(secondDenied.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            assertThat(first.get(10, TimeUnit.SECONDS).totalSuccess()).isEqualTo(1);
            assertThat(second.get(10, TimeUnit.SECONDS).totalSuccess()).isEqualTo(1);
        } finally {
            callers.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(activeWhileRunning).containsExactly(1, 1);
        assertThat(resources.getActiveAgentCount()).isZero();
    }

    @Test
    void eachRunGetsItsOwnAgentId() {
        WaveTask task = WaveTask.of("t1", "p");

        assertThat(WaveOrchestrator.agentIdFor(task)).startsWith("agent-t1-")
            .isNotEqualTo(WaveOrchestrator.agentIdFor(task));
    }
}
