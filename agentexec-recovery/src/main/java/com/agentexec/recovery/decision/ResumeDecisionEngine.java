package com.agentexec.recovery.decision;

import com.agentexec.core.model.ResumeAlternative;
import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.StepCheckpoint;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Recommends how to continue from a checkpoint.
 *
 * Implementations must be deterministic for a given checkpoint and free of side effects.
 */
public interface ResumeDecisionEngine {

    /**
     * Analyze a checkpoint and recommend a resume action.
     */
    ResumeDecision analyzeCheckpoint(StepCheckpoint checkpoint);

    /**
     * Human readable rendering of a decision, one fact per line.
     */
    default String explainDecision(ResumeDecision decision) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add("Recommended action: " + decision.action().name()
            + " (" + Math.round(decision.confidence() * 100) + "% confidence)");
        lines.add("Reason: " + decision.reason());
        if (decision.fromStep() != null) {
            lines.add("Continue from: " + decision.fromStep());
        }
        if (!decision.skipSteps().isEmpty()) {
            lines.add("Skip: " + String.join(", ", decision.skipSteps()));
        }
        for (ResumeAlternative alternative : decision.alternatives()) {
            lines.add(String.format(Locale.ROOT, "Alternative %s (%d%%): %s",
                alternative.action().name(), Math.round(alternative.confidence() * 100), alternative.reason()));
        }
        return lines.toString();
    }
}
