package com.agentexec.engine.coordinator;

import com.agentexec.core.exception.AdmissionDeniedException;
import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.spi.PromptExecutor;
import com.agentexec.core.spi.PromptResponse;
import com.agentexec.core.spi.RoleConfig;
import com.agentexec.engine.coordinator.findings.BestPracticesFindings;
import com.agentexec.engine.coordinator.findings.CodebaseFindings;
import com.agentexec.engine.coordinator.findings.ConsolidatedFindings;
import com.agentexec.engine.coordinator.findings.Evidence;
import com.agentexec.engine.coordinator.findings.FeasibilityFindings;
import com.agentexec.engine.coordinator.findings.RoleOutput;
import com.agentexec.engine.coordinator.findings.UnrecognizedOutput;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.logging.LoggingContext;
import com.agentexec.engine.resource.ResourceManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one research wave: parallel roles for a feature, fanned out and fanned back in.
 *
 * <p>The wave fails fast with {@link AdmissionDeniedException} when the resource manager
 * refuses a new agent. Otherwise every role agent is registered before dispatch and
 * unregistered when the wave returns, whatever happened. A failing role is logged and left
 * out of the consolidation; its siblings still run to completion.</p>
 */
public class WaveCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WaveCoordinator.class);

    // Shared by all coordinators; keeps agent ids distinct for waves started in the same millisecond.
    private static final AtomicLong WAVE_SEQUENCE = new AtomicLong();

    private final ResourceManager resourceManager;
    private final PromptExecutor promptExecutor;
    private final Executor executor;
    private final RoleOutputDecoder decoder;
    private final ExecutionEventBus eventBus;
    private final Duration roleTimeout;
    private final Clock clock;

    public WaveCoordinator(ResourceManager resourceManager, PromptExecutor promptExecutor, Executor executor,
                           ObjectMapper objectMapper, ExecutionEventBus eventBus, Duration roleTimeout, Clock clock) {
        this.resourceManager = Objects.requireNonNull(resourceManager, "resourceManager");
        this.promptExecutor = Objects.requireNonNull(promptExecutor, "promptExecutor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.decoder = new RoleOutputDecoder(objectMapper);
        this.eventBus = eventBus != null ? eventBus : new ExecutionEventBus();
        this.roleTimeout = roleTimeout;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Execute a research wave and consolidate what the roles found.
     *
     * @throws AdmissionDeniedException if no agent may be spawned
     */
    public ConsolidatedFindings executeWave(WaveRequest request) {
        Objects.requireNonNull(request, "request");
        int agentCount = request.complexity().researchAgentCount();

        if (!resourceManager.canSpawnAgent()) {
            throw new AdmissionDeniedException("Cannot spawn research agents: " + denialReason());
        }

        String waveToken = clock.millis() + "-" + WAVE_SEQUENCE.incrementAndGet();
        String waveId = "research-wave-" + waveToken;
        List<ResearchTask> tasks = buildTasks(request, agentCount, waveToken);

        try (var ctx = LoggingContext.forWave(waveId)) {
            for (ResearchTask task : tasks) {
                resourceManager.registerAgent(task.agentId());
            }
            log.info("Research wave started for '{}': {} roles", request.feature(), tasks.size());
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.WAVE_STARTED, waveId,
                Map.of("roles", tasks.stream().map(t -> t.role().value()).toList())));

            List<RoleResult> results = dispatch(tasks);
            ConsolidatedFindings findings = consolidate(results);

            log.info("Research wave completed: {}/{} roles succeeded, {} unrecognized",
                results.size() - findings.failedRoleCount(), results.size(), findings.unrecognized().size());
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.WAVE_COMPLETED, waveId, Map.of(
                "succeeded", results.size() - findings.failedRoleCount(),
                "failed", findings.failedRoleCount())));
            return findings;
        } finally {
            for (ResearchTask task : tasks) {
                resourceManager.unregisterAgent(task.agentId());
            }
        }
    }

    List<ResearchTask> buildTasks(WaveRequest request, int agentCount, String waveToken) {
        List<ResearchTask> tasks = new ArrayList<>();
        for (ResearchRole role : ResearchRole.forAgentCount(agentCount)) {
            String agentId = role.agentId(waveToken);
            String prompt = switch (role) {
                case FEASIBILITY -> feasibilityPrompt(request);
                case CODEBASE -> codebasePrompt(request);
                case BEST_PRACTICES -> bestPracticesPrompt(request);
            };
            RoleConfig config = new RoleConfig(role.value(), agentId,
                "You are the " + role.value() + " research agent. Answer with a single JSON object.",
                roleTimeout, Map.of("complexity", request.complexity().name().toLowerCase(Locale.ROOT)));
            tasks.add(new ResearchTask(agentId, role, prompt, config));
        }
        return tasks;
    }

    private List<RoleResult> dispatch(List<ResearchTask> tasks) {
        List<CompletableFuture<RoleResult>> futures = tasks.stream()
            .map(task -> CompletableFuture.supplyAsync(() -> runRole(task), executor))
            .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private RoleResult runRole(ResearchTask task) {
        long start = clock.millis();
        try (var ctx = LoggingContext.forAgent(task.agentId())) {
            try {
                PromptResponse response = promptExecutor.execute(task.prompt(), task.config());
                if (response == null) {
                    throw new IllegalStateException("Prompt executor returned no response");
                }
                RoleOutput output = decoder.decode(task.role(), task.agentId(), response.content());
                log.debug("Role {} finished in {}ms", task.role().value(), clock.millis() - start);
                return RoleResult.succeeded(task, output, clock.millis() - start, response.providerMetadata());
            } catch (Exception e) {
                log.warn("Research agent {} failed: {}", task.agentId(), e.getMessage());
                eventBus.publish(ExecutionEvent.of(ExecutionEventType.ROLE_FAILED, task.agentId(), Map.of(
                    "role", task.role().value(),
                    "error", String.valueOf(e.getMessage()))));
                return RoleResult.failed(task, e.getMessage(), clock.millis() - start);
            }
        }
    }

    ConsolidatedFindings consolidate(List<RoleResult> results) {
        FeasibilityFindings feasibility = FeasibilityFindings.unknown();
        CodebaseFindings codebase = null;
        BestPracticesFindings practices = null;
        List<Evidence> evidence = new ArrayList<>();
        List<UnrecognizedOutput> unrecognized = new ArrayList<>();

        for (RoleResult result : results) {
            if (!result.success()) {
                continue;
            }
            RoleOutput output = result.output();
            if (output instanceof UnrecognizedOutput) {
                unrecognized.add((UnrecognizedOutput) output);
                continue;
            }
            if (output instanceof FeasibilityFindings) {
                feasibility = (FeasibilityFindings) output;
            } else if (output instanceof CodebaseFindings) {
                codebase = (CodebaseFindings) output;
            } else if (output instanceof BestPracticesFindings) {
                practices = (BestPracticesFindings) output;
            }
            evidence.addAll(output.evidence());
        }
        return new ConsolidatedFindings(feasibility, codebase, practices, evidence, unrecognized, results,
            clock.instant());
    }

    private String denialReason() {
        if (resourceManager.getActiveAgentCount() >= resourceManager.getMaxConcurrent()) {
            return String.format("concurrency limit reached (%d/%d active)",
                resourceManager.getActiveAgentCount(), resourceManager.getMaxConcurrent());
        }
        return String.join(", ", resourceManager.checkResources().violations());
    }

    private static String feasibilityPrompt(WaveRequest request) {
        return """
            Assess whether this feature can be built: %s

            Stack: %s
            Timeline: %s
            Success criteria: %s

            Cover feasibility, two or three candidate approaches with pros and cons,
            risks with mitigations, and an overall complexity estimate.

            Reply with JSON:
            {"feasible": boolean,
             "approaches": [{"name": string, "pros": [string], "cons": [string], "confidence": number}],
             "risks": [{"risk": string, "mitigation": string}],
             "complexity": "simple" | "medium" | "complex",
             "evidence": [{"claim": string, "source": string, "confidence": number}]}
            """.formatted(request.feature(), orUnknown(request.techStack()), orUnknown(request.timeline()),
            request.successCriteria().isEmpty() ? "none given" : String.join(", ", request.successCriteria()));
    }

    private static String codebasePrompt(WaveRequest request) {
        return """
            Survey the existing codebase for: %s

            Find similar features, the conventions in use for structure, naming and testing,
            the places the feature would integrate, and dependencies already available.

            Reply with JSON:
            {"similarFeatures": [{"file": string, "pattern": string, "reusable": boolean}],
             "conventions": {"structure": string, "naming": string, "testing": string},
             "integrationPoints": [{"location": string, "type": string, "requirements": [string]}],
             "existingDependencies": [string],
             "evidence": [{"claim": string, "source": string, "confidence": number}]}
            """.formatted(request.feature());
    }

    private static String bestPracticesPrompt(WaveRequest request) {
        return """
            Collect best practices for: %s

            Include library and framework guidance, common pitfalls and security concerns.

            Reply with JSON:
            {"bestPractices": [{"practice": string, "reason": string, "source": string}],
             "pitfalls": [{"pitfall": string, "consequence": string, "avoidance": string}],
             "securityConsiderations": [{"risk": string, "mitigation": string}],
             "evidence": [{"claim": string, "source": string, "confidence": number}]}
            """.formatted(request.feature());
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : "unspecified";
    }
}
