package com.agentexec.core.model;

import java.util.List;

/**
 * Outcome of a replay. On failure only {@code success=false} and {@code error} are meaningful.
 */
public record ResumeResult(
    boolean success,
    ExecutionSession session,
    Step resumeFromStep,
    List<Step> restoredSteps,
    ResumeDecision decision,
    List<String> warnings,
    String error
) {
    public static ResumeResult failure(String error) {
        return new ResumeResult(false, null, null, List.of(), null, List.of(), error);
    }
}
