package com.agentexec.api.rest;

import com.agentexec.core.exception.AdmissionDeniedException;
import com.agentexec.core.model.ResourceSnapshot;
import com.agentexec.engine.resource.ResourceCheckResult;
import com.agentexec.engine.resource.ResourceManager;
import com.agentexec.engine.service.ExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for agent admission.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final ResourceManager resourceManager;
    private final ExecutionService executionService;

    public AgentController(ResourceManager resourceManager, ExecutionService executionService) {
        this.resourceManager = resourceManager;
        this.executionService = executionService;
    }

    /**
     * Current admission verdict with the active agent set.
     */
    @GetMapping
    public ResponseEntity<AdmissionStatusResponse> getStatus() {
        ResourceCheckResult check = resourceManager.checkResources();
        return ResponseEntity.ok(new AdmissionStatusResponse(
            check.canSpawn(),
            resourceManager.getActiveAgentCount(),
            resourceManager.getMaxConcurrent(),
            resourceManager.getActiveAgents(),
            check.violations(),
            check.snapshot()
        ));
    }

    /**
     * Admit an agent if a slot is free.
     */
    @PostMapping("/{agentId}")
    public ResponseEntity<Map<String, Object>> register(@PathVariable String agentId) {
        if (!resourceManager.tryAcquire(agentId)) {
            List<String> violations = resourceManager.checkResources().violations();
            throw new AdmissionDeniedException("Cannot admit agent " + agentId + ": " + String.join("; ", violations));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(Map.of("agentId", agentId, "active", resourceManager.getActiveAgentCount()));
    }

    @DeleteMapping("/{agentId}")
    public ResponseEntity<Void> unregister(@PathVariable String agentId) {
        executionService.unregisterAgent(agentId);
        return ResponseEntity.noContent().build();
    }

    // ========== DTOs ==========

    public record AdmissionStatusResponse(
        boolean canSpawn,
        int activeAgents,
        int maxConcurrent,
        Set<String> agentIds,
        List<String> violations,
        ResourceSnapshot snapshot
    ) {}
}
