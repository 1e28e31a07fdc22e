package com.agentexec.engine.coordinator;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.Wave;
import com.agentexec.core.spi.PromptExecutor;
import com.agentexec.core.spi.PromptResponse;
import com.agentexec.core.spi.RoleConfig;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.logging.LoggingContext;
import com.agentexec.engine.resource.ResourceManager;
import com.agentexec.engine.statemachine.ExecutionHandlers;
import com.agentexec.engine.statemachine.ExecutionResult;
import com.agentexec.engine.statemachine.StateMachineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs a task list as consecutive waves, each wave's tasks concurrently.
 *
 * <p>Every task waits for an agent slot (bounded retries with backoff), runs through its own
 * state machine with the prompt executed in the EXECUTING phase, and releases its slot when
 * done. A task whose dependencies did not succeed fails without running. A dependency on an
 * earlier task of the same wave waits for that task. After a wave with failures the run stops
 * unless {@link WaveOptions#continueOnError()}.</p>
 */
public class WaveOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WaveOrchestrator.class);

    static final String DEPENDENCIES_NOT_SATISFIED = "Dependencies not satisfied";
    static final String RESOURCE_LIMIT_EXCEEDED = "Resource limit exceeded - could not acquire slot";

    private final ResourceManager resourceManager;
    private final PromptExecutor promptExecutor;
    private final Supplier<StateMachineExecutor> stateMachines;
    private final Executor executor;
    private final ExecutionEventBus eventBus;
    private final AdmissionPolicy admission;
    private final Duration taskTimeout;

    public WaveOrchestrator(ResourceManager resourceManager, PromptExecutor promptExecutor,
                            Supplier<StateMachineExecutor> stateMachines, Executor executor,
                            ExecutionEventBus eventBus, AdmissionPolicy admission, Duration taskTimeout) {
        this.resourceManager = Objects.requireNonNull(resourceManager, "resourceManager");
        this.promptExecutor = Objects.requireNonNull(promptExecutor, "promptExecutor");
        this.stateMachines = Objects.requireNonNull(stateMachines, "stateMachines");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.eventBus = eventBus != null ? eventBus : new ExecutionEventBus();
        this.admission = admission != null ? admission : AdmissionPolicy.defaults();
        this.taskTimeout = taskTimeout;
    }

    /**
     * Split tasks into consecutive waves of at most {@code waveSize} tasks.
     */
    public List<List<WaveTask>> splitIntoWaves(List<WaveTask> tasks, int waveSize) {
        if (waveSize < 1) {
            throw new IllegalArgumentException("waveSize must be at least 1");
        }
        List<List<WaveTask>> waves = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i += waveSize) {
            waves.add(List.copyOf(tasks.subList(i, Math.min(i + waveSize, tasks.size()))));
        }
        return waves;
    }

    public WaveRunResult executeWaves(List<WaveTask> tasks, WaveOptions options) {
        WaveOptions opts = options != null ? options : WaveOptions.defaults();
        requireUniqueIds(tasks);
        int waveSize = opts.waveSize() != null ? opts.waveSize() : resourceManager.getMaxConcurrent();
        List<List<WaveTask>> waves = splitIntoWaves(tasks, waveSize);

        List<TaskResult> results = new ArrayList<>();
        List<WaveSummary> summaries = new ArrayList<>();
        Map<String, Boolean> outcomes = new HashMap<>();

        for (int i = 0; i < waves.size(); i++) {
            List<WaveTask> waveTasks = waves.get(i);
            Wave wave = Wave.create(i + 1, waveTasks.stream().map(WaveTask::id).toList(), waveSize,
                i == 0 ? Set.of() : Set.of("wave-" + i));

            try (var ctx = LoggingContext.forWave(wave.id())) {
                log.info("Starting {} with {} tasks", wave.id(), waveTasks.size());
                eventBus.publish(ExecutionEvent.of(ExecutionEventType.WAVE_STARTED, wave.id(),
                    Map.of("tasks", wave.taskIds())));

                for (TaskResult result : runWave(waveTasks, outcomes)) {
                    wave = wave.recordOutcome(result.id(), result.success());
                    outcomes.put(result.id(), result.success());
                    results.add(result);
                }
                summaries.add(new WaveSummary(wave.number(), waveTasks.size(),
                    wave.succeeded().size(), wave.failed().size()));

                log.info("Finished {}: {} succeeded, {} failed", wave.id(), wave.succeeded().size(), wave.failed().size());
                eventBus.publish(ExecutionEvent.of(ExecutionEventType.WAVE_COMPLETED, wave.id(), Map.of(
                    "succeeded", wave.succeeded().size(),
                    "failed", wave.failed().size())));

                if (!wave.failed().isEmpty() && !opts.continueOnError()) {
                    log.warn("Stopping after {}: {} task(s) failed", wave.id(), wave.failed().size());
                    break;
                }
            }
        }

        int success = (int) results.stream().filter(TaskResult::success).count();
        return new WaveRunResult(results, summaries, success, results.size() - success);
    }

    private List<TaskResult> runWave(List<WaveTask> waveTasks, Map<String, Boolean> priorOutcomes) {
        Map<String, CompletableFuture<TaskResult>> futures = new LinkedHashMap<>();
        for (WaveTask task : waveTasks) {
            List<CompletableFuture<TaskResult>> sameWave = new ArrayList<>();
            boolean unsatisfied = false;
            for (String dependency : task.dependencies()) {
                CompletableFuture<TaskResult> pending = futures.get(dependency);
                if (pending != null) {
                    sameWave.add(pending);
                } else if (!Boolean.TRUE.equals(priorOutcomes.get(dependency))) {
                    unsatisfied = true;
                }
            }

            CompletableFuture<TaskResult> future;
            if (unsatisfied) {
                log.info("Task {} skipped: dependencies {} not satisfied", task.id(), task.dependencies());
                future = CompletableFuture.completedFuture(TaskResult.failed(task.id(), DEPENDENCIES_NOT_SATISFIED));
            } else if (sameWave.isEmpty()) {
                future = CompletableFuture.supplyAsync(() -> runTask(task), executor);
            } else {
                future = CompletableFuture.allOf(sameWave.toArray(new CompletableFuture[0]))
                    .thenApplyAsync(ignored -> sameWave.stream().allMatch(f -> f.join().success())
                        ? runTask(task)
                        : TaskResult.failed(task.id(), DEPENDENCIES_NOT_SATISFIED), executor);
            }
            futures.put(task.id(), future);
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        return futures.values().stream().map(CompletableFuture::join).toList();
    }

    TaskResult runTask(WaveTask task) {
        String agentId = agentIdFor(task);
        if (!acquireSlot(agentId)) {
            log.warn("Task {} could not acquire an agent slot after {} attempts", task.id(), admission.maxAttempts());
            return TaskResult.failed(task.id(), RESOURCE_LIMIT_EXCEEDED);
        }
        try (var ctx = LoggingContext.forAgent(agentId)) {
            Map<String, Object> inputs = new LinkedHashMap<>(task.inputs());
            if (task.prompt() != null) {
                inputs.put("prompt", task.prompt());
            }
            ExecutionContext context = ExecutionContext.create(task.id(), inputs);
            AtomicReference<Map<String, Object>> providerMetadata = new AtomicReference<>(Map.of());

            ExecutionHandlers handlers = ExecutionHandlers.builder()
                .onExecuting(c -> {
                    RoleConfig config = new RoleConfig("executor", agentId, null, taskTimeout,
                        Map.of("taskId", task.id(), "attempt", c.getAttempt()));
                    PromptResponse response = promptExecutor.execute(task.prompt(), config);
                    if (response == null || response.content() == null) {
                        throw new IllegalStateException("Prompt executor returned no content");
                    }
                    c.putOutput("content", response.content());
                    c.putOutput("usage", response.usage());
                    if (response.providerMetadata() != null) {
                        providerMetadata.set(response.providerMetadata());
                    }
                })
                .onVerifying(c -> c.hasOutputs() && c.getOutputs().get("content") instanceof String
                    && !((String) c.getOutputs().get("content")).isBlank())
                .build();

            ExecutionResult result = stateMachines.get().execute(context, handlers);
            Map<String, Object> outputs = context.getOutputs() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context.getOutputs()))
                : Map.of();
            return new TaskResult(task.id(), result.success(),
                result.success() ? null : "Task execution failed: " + result.error(),
                result.finalState(), outputs, providerMetadata.get());
        } catch (RuntimeException e) {
            log.warn("Task {} failed: {}", task.id(), e.getMessage());
            return TaskResult.failed(task.id(), "Task execution failed: " + e.getMessage());
        } finally {
            resourceManager.unregisterAgent(agentId);
        }
    }

    static String agentIdFor(WaveTask task) {
        return "agent-" + task.id() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private boolean acquireSlot(String agentId) {
        for (int attempt = 1; attempt <= admission.maxAttempts(); attempt++) {
            if (resourceManager.tryAcquire(agentId)) {
                return true;
            }
            if (attempt < admission.maxAttempts()) {
                try {
                    Thread.sleep(admission.backoff().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private static void requireUniqueIds(List<WaveTask> tasks) {
        Set<String> seen = new HashSet<>();
        for (WaveTask task : tasks) {
            if (!seen.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id: " + task.id());
            }
        }
    }
}
