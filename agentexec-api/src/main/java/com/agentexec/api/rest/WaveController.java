package com.agentexec.api.rest;

import com.agentexec.core.model.TaskComplexity;
import com.agentexec.engine.coordinator.WaveCoordinator;
import com.agentexec.engine.coordinator.WaveOptions;
import com.agentexec.engine.coordinator.WaveOrchestrator;
import com.agentexec.engine.coordinator.WaveRequest;
import com.agentexec.engine.coordinator.WaveRunResult;
import com.agentexec.engine.coordinator.WaveTask;
import com.agentexec.engine.coordinator.findings.ConsolidatedFindings;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for research waves and dependency-ordered task waves. Both calls block until
 * every role or task has settled.
 */
@RestController
@RequestMapping("/api/v1/waves")
public class WaveController {

    private final WaveCoordinator waveCoordinator;
    private final WaveOrchestrator waveOrchestrator;

    public WaveController(WaveCoordinator waveCoordinator, WaveOrchestrator waveOrchestrator) {
        this.waveCoordinator = waveCoordinator;
        this.waveOrchestrator = waveOrchestrator;
    }

    @PostMapping("/research")
    public ResponseEntity<ConsolidatedFindings> research(@RequestBody ResearchRequest request) {
        WaveRequest waveRequest = new WaveRequest(
            request.feature(),
            request.complexity(),
            request.techStack(),
            request.timeline(),
            request.successCriteria()
        );
        return ResponseEntity.ok(waveCoordinator.executeWave(waveRequest));
    }

    @PostMapping("/run")
    public ResponseEntity<WaveRunResult> run(@RequestBody RunWavesRequest request) {
        if (request.tasks() == null || request.tasks().isEmpty()) {
            throw new IllegalArgumentException("At least one task is required");
        }
        List<WaveTask> tasks = request.tasks().stream()
            .map(t -> new WaveTask(t.id(), t.prompt(), t.dependencies(), t.inputs()))
            .toList();
        WaveOptions options = new WaveOptions(request.waveSize(), request.continueOnError());
        return ResponseEntity.ok(waveOrchestrator.executeWaves(tasks, options));
    }

    // ========== DTOs ==========

    public record ResearchRequest(
        String feature,
        TaskComplexity complexity,
        String techStack,
        String timeline,
        List<String> successCriteria
    ) {}

    public record TaskRequest(String id, String prompt, List<String> dependencies, Map<String, Object> inputs) {}

    public record RunWavesRequest(List<TaskRequest> tasks, Integer waveSize, boolean continueOnError) {}
}
