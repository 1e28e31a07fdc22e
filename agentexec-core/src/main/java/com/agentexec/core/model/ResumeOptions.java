package com.agentexec.core.model;

/**
 * Options for replaying from a checkpoint.
 *
 * @param checkpointId   checkpoint to replay from
 * @param skipFailedStep when the checkpointed step failed, replace it with a fresh pending copy
 * @param sessionName    name for the new session, or {@code null} for a derived one
 */
public record ResumeOptions(String checkpointId, boolean skipFailedStep, String sessionName) {

    public static ResumeOptions from(String checkpointId) {
        return new ResumeOptions(checkpointId, false, null);
    }

    public ResumeOptions skippingFailedStep() {
        return new ResumeOptions(checkpointId, true, sessionName);
    }
}
