package com.agentexec.api.rest;

import com.agentexec.core.model.ResumeOptions;
import com.agentexec.core.model.ResumeResult;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.recovery.session.RestorePreview;
import com.agentexec.recovery.session.StepExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for loading, previewing and replaying from a checkpoint.
 */
@RestController
@RequestMapping("/api/v1/checkpoints")
public class CheckpointController {

    private final StepExecutor stepExecutor;

    public CheckpointController(StepExecutor stepExecutor) {
        this.stepExecutor = stepExecutor;
    }

    /**
     * Load a checkpoint after verifying its checksum.
     */
    @GetMapping("/{checkpointId}")
    public ResponseEntity<StepCheckpoint> getCheckpoint(@PathVariable String checkpointId) {
        return ResponseEntity.ok(stepExecutor.loadStepCheckpoint(checkpointId));
    }

    /**
     * What a resume would restore, with the recommended action. Changes nothing.
     */
    @GetMapping("/{checkpointId}/preview")
    public ResponseEntity<RestorePreview> preview(@PathVariable String checkpointId) {
        return ResponseEntity.ok(stepExecutor.restoreCheckpoint(checkpointId));
    }

    /**
     * Start a child session from the checkpoint. A checkpoint that cannot be used is
     * reported in the body with 422.
     */
    @PostMapping("/{checkpointId}/resume")
    public ResponseEntity<ResumeResult> resume(
            @PathVariable String checkpointId,
            @RequestBody(required = false) ResumeRequest request) {

        ResumeOptions options = request != null
            ? new ResumeOptions(checkpointId, request.skipFailedStep(), request.sessionName())
            : ResumeOptions.from(checkpointId);
        ResumeResult result = stepExecutor.replayFromStep(options);
        return result.success()
            ? ResponseEntity.status(HttpStatus.CREATED).body(result)
            : ResponseEntity.unprocessableEntity().body(result);
    }

    // ========== DTOs ==========

    public record ResumeRequest(boolean skipFailedStep, String sessionName) {}
}
