package com.agentexec.api.rest;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.transition.TransitionResult;
import com.agentexec.engine.service.ExecutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for execution contexts and their state transitions.
 */
@RestController
@RequestMapping("/api/v1/contexts")
public class ContextController {

    private final ExecutionService executionService;

    public ContextController(ExecutionService executionService) {
        this.executionService = executionService;
    }

    @PostMapping
    public ResponseEntity<ContextResponse> createContext(@RequestBody CreateContextRequest request) {
        ExecutionContext context = executionService.createContext(
            request.taskId(), request.sessionId(), request.inputs());
        return ResponseEntity.status(HttpStatus.CREATED).body(ContextResponse.from(context));
    }

    @GetMapping
    public ResponseEntity<List<ContextResponse>> listContexts() {
        return ResponseEntity.ok(executionService.listContexts().stream()
            .map(ContextResponse::from)
            .toList());
    }

    @GetMapping("/{contextId}")
    public ResponseEntity<ContextResponse> getContext(@PathVariable String contextId) {
        return ResponseEntity.ok(ContextResponse.from(executionService.getContext(contextId)));
    }

    /**
     * Apply a named transition. A transition that is undefined for the current state is a bad
     * request; one refused by a guard or action is reported in the body with 409.
     */
    @PostMapping("/{contextId}/transitions/{transitionId}")
    public ResponseEntity<TransitionResult> executeTransition(
            @PathVariable String contextId,
            @PathVariable String transitionId) {

        TransitionResult result = executionService.executeDefined(transitionId, contextId);
        return result.success()
            ? ResponseEntity.ok(result)
            : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }

    // ========== DTOs ==========

    public record CreateContextRequest(String taskId, String sessionId, Map<String, Object> inputs) {}

    public record ContextResponse(
        String contextId,
        String taskId,
        String sessionId,
        ExecutionState state,
        Map<String, Object> inputs,
        Map<String, Object> outputs,
        String error,
        int attempt,
        Instant startTime,
        Instant endTime
    ) {
        static ContextResponse from(ExecutionContext context) {
            return new ContextResponse(
                context.getContextId(),
                context.getTaskId(),
                context.getSessionId(),
                context.getState(),
                context.getInputs(),
                context.getOutputs(),
                context.getError(),
                context.getAttempt(),
                context.getStartTime(),
                context.getEndTime()
            );
        }
    }
}
