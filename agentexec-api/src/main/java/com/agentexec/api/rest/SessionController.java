package com.agentexec.api.rest;

import com.agentexec.api.config.EngineProperties;
import com.agentexec.core.model.DecisionLogEntry;
import com.agentexec.core.model.ExecutionSession;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.core.model.StepCheckpointSummary;
import com.agentexec.recovery.session.StepExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for execution sessions, their checkpoints and decision log.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final StepExecutor stepExecutor;
    private final EngineProperties properties;

    public SessionController(StepExecutor stepExecutor, EngineProperties properties) {
        this.stepExecutor = stepExecutor;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<ExecutionSession> startSession(@RequestBody StartSessionRequest request) {
        ExecutionSession session = stepExecutor.startSession(request.executionId(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping
    public ResponseEntity<List<ExecutionSession>> listSessions() {
        return ResponseEntity.ok(stepExecutor.listSessions());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ExecutionSession> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(stepExecutor.requireSession(sessionId));
    }

    @GetMapping("/{sessionId}/steps")
    public ResponseEntity<List<Step>> getSteps(@PathVariable String sessionId) {
        stepExecutor.requireSession(sessionId);
        return ResponseEntity.ok(stepExecutor.getSteps(sessionId));
    }

    @PostMapping("/{sessionId}/abandon")
    public ResponseEntity<ExecutionSession> abandon(
            @PathVariable String sessionId,
            @RequestBody(required = false) AbandonRequest request) {

        String reason = request != null && request.reason() != null ? request.reason() : "Abandoned by operator";
        return ResponseEntity.ok(stepExecutor.abandonSession(sessionId, reason));
    }

    // ========== Checkpoints ==========

    /**
     * Checkpoints in creation order. Records that fail verification are listed with valid=false.
     */
    @GetMapping("/{sessionId}/checkpoints")
    public ResponseEntity<List<StepCheckpointSummary>> listCheckpoints(@PathVariable String sessionId) {
        stepExecutor.requireSession(sessionId);
        return ResponseEntity.ok(stepExecutor.listStepCheckpoints(sessionId));
    }

    @PostMapping("/{sessionId}/checkpoints")
    public ResponseEntity<StepCheckpoint> createCheckpoint(
            @PathVariable String sessionId,
            @RequestBody CreateCheckpointRequest request) {

        if (request.stepId() == null || request.stepId().isBlank()) {
            throw new IllegalArgumentException("stepId is required");
        }
        StepCheckpoint checkpoint = stepExecutor.createCheckpoint(sessionId, request.stepId(), request.label());
        return ResponseEntity.status(HttpStatus.CREATED).body(checkpoint);
    }

    /**
     * Delete all but the newest {@code keep} checkpoints; defaults to the configured retention.
     */
    @PostMapping("/{sessionId}/checkpoints/compact")
    public ResponseEntity<Map<String, Object>> compactCheckpoints(
            @PathVariable String sessionId,
            @RequestParam(required = false) Integer keep) {

        int retained = keep != null ? keep : properties.getCheckpoints().getRetention();
        int deleted = stepExecutor.compactCheckpoints(sessionId, retained);
        return ResponseEntity.ok(Map.of("deleted", deleted, "kept", retained));
    }

    @GetMapping("/{sessionId}/decisions")
    public ResponseEntity<List<DecisionLogEntry>> getDecisionLog(@PathVariable String sessionId) {
        stepExecutor.requireSession(sessionId);
        return ResponseEntity.ok(stepExecutor.getDecisionLog(sessionId));
    }

    // ========== DTOs ==========

    public record StartSessionRequest(String executionId, String name) {}

    public record AbandonRequest(String reason) {}

    public record CreateCheckpointRequest(String stepId, String label) {}
}
