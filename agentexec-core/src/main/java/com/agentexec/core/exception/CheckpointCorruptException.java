package com.agentexec.core.exception;

/**
 * Thrown when a stored checkpoint cannot be decoded or fails its checksum.
 */
public class CheckpointCorruptException extends ExecutionEngineException {

    public static final String ERROR_CODE = "CHECKPOINT_CORRUPT";

    private final String checkpointId;

    public CheckpointCorruptException(String checkpointId, String reason) {
        super(ERROR_CODE, String.format("Checkpoint %s is corrupt: %s", checkpointId, reason));
        this.checkpointId = checkpointId;
    }

    public CheckpointCorruptException(String checkpointId, String reason, Throwable cause) {
        super(ERROR_CODE, String.format("Checkpoint %s is corrupt: %s", checkpointId, reason), cause);
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
