package com.agentexec.recovery.decision;

import com.agentexec.core.model.ResumeAction;
import com.agentexec.core.model.ResumeAlternative;
import com.agentexec.core.model.ResumeDecision;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.core.model.StepError;
import com.agentexec.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resume recommendations driven by the checkpointed step's status and, for failed steps,
 * by matching the recorded error against a table of known failure patterns.
 *
 * Patterns are tried in order against the error message, code and exception class;
 * the first match wins. Confidence drops once the step has used up its attempts.
 */
public class PatternResumeDecisionEngine implements ResumeDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternResumeDecisionEngine.class);

    private static final Duration RECENT = Duration.ofHours(1);
    private static final double RECENT_BONUS = 1.1;

    private static final List<ErrorPattern> PATTERNS = List.of(
        new ErrorPattern("network_error",
            "ECONNREFUSED|ECONNRESET|ETIMEDOUT|network|ConnectException|UnknownHostException|connection.?(refused|reset)",
            ResumeAction.RESUME, 0.9, "Transient network error, resume from the current step"),
        new ErrorPattern("rate_limit", "rate.?limit|\\b429\\b|too.?many.?requests",
            ResumeAction.RESUME, 0.85, "Rate limited, back off and resume from the current step"),
        new ErrorPattern("timeout", "timeout|timed.?out",
            ResumeAction.RESUME, 0.85, "Operation timed out, resume with a longer timeout"),
        new ErrorPattern("type_error", "TypeError|type.?error|ClassCastException|is.?not.?a.?function",
            ResumeAction.SKIP, 0.7, "Type error points at a code defect, skip the step or fix the code"),
        new ErrorPattern("reference_error", "ReferenceError|is.?not.?defined|NoSuchMethodError|ClassNotFoundException",
            ResumeAction.SKIP, 0.7, "Missing reference or dependency, skip the step or fix it"),
        new ErrorPattern("syntax_error", "SyntaxError|syntax.?error",
            ResumeAction.ABORT, 0.9, "Syntax error must be fixed before resuming"),
        new ErrorPattern("test_failure", "test.?fail|assertion|expected",
            ResumeAction.RESUME, 0.8, "Test failure, resume after fixing the implementation"),
        new ErrorPattern("build_error", "build.?fail|compilation.?(error|fail)|typecheck",
            ResumeAction.ABORT, 0.8, "Build is broken and must be fixed before resuming"),
        new ErrorPattern("resource_exhausted", "ENOMEM|OutOfMemoryError|out.?of.?memory|heap|resource",
            ResumeAction.RESUME, 0.75, "Resources exhausted, wait for capacity and resume"),
        new ErrorPattern("permission_error", "EACCES|AccessDeniedException|permission.?denied|unauthorized|forbidden",
            ResumeAction.ABORT, 0.85, "Permission error needs a configuration fix")
    );

    private final Clock clock;

    public PatternResumeDecisionEngine() {
        this(Clock.systemUTC());
    }

    public PatternResumeDecisionEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ResumeDecision analyzeCheckpoint(StepCheckpoint checkpoint) {
        Step step = checkpoint.step();
        if (step == null) {
            return decision(ResumeAction.RESUME, "Checkpoint carries no step, attempting resume",
                checkpoint, null, 0.5, List.of(alt(ResumeAction.ABORT, "Stop and investigate", 0.5)));
        }

        if (step.status() == StepStatus.COMPLETED) {
            return decision(ResumeAction.RESUME, "Step completed, resume from the next step",
                checkpoint, step, 0.95,
                List.of(alt(ResumeAction.RETRY, "Start the wave over", 0.5)));
        }

        if (step.status() == StepStatus.PENDING || step.status() == StepStatus.EXECUTING) {
            return decision(ResumeAction.RESUME, "Step was interrupted, resume it",
                checkpoint, step, 0.9,
                List.of(
                    alt(ResumeAction.SKIP, "Skip this step and continue", 0.6),
                    alt(ResumeAction.RETRY, "Start the wave over", 0.4)));
        }

        if (step.status() == StepStatus.FAILED && step.error() != null) {
            return analyzeFailure(checkpoint, step, step.error());
        }

        return decision(ResumeAction.RESUME, "Unable to determine the best action, attempting resume",
            checkpoint, step, 0.5,
            List.of(
                alt(ResumeAction.RETRY, "Start over from the beginning", 0.5),
                alt(ResumeAction.ABORT, "Stop and investigate", 0.3)));
    }

    /**
     * Pick the checkpoint to continue from. Each checkpoint's decision confidence is weighted by
     * action (resume 1.0, skip 0.8, retry 0.6, abort 0.4), with a bonus for checkpoints younger
     * than an hour. Ties go to the earlier entry in the list.
     */
    public Optional<ResumePoint> findBestResumePoint(List<StepCheckpoint> checkpoints) {
        ResumePoint best = null;
        for (StepCheckpoint checkpoint : checkpoints) {
            ResumeDecision decision = analyzeCheckpoint(checkpoint);
            double score = decision.confidence() * weight(decision.action());
            if (checkpoint.createdAt() != null
                    && Duration.between(checkpoint.createdAt(), clock.instant()).compareTo(RECENT) < 0) {
                score *= RECENT_BONUS;
            }
            if (best == null || score > best.score()) {
                best = new ResumePoint(checkpoint, decision, score);
            }
        }
        if (best != null) {
            log.debug("Best resume point {} ({} with score {})",
                best.checkpoint().id(), best.decision().action(), best.score());
        }
        return Optional.ofNullable(best);
    }

    private ResumeDecision analyzeFailure(StepCheckpoint checkpoint, Step step, StepError error) {
        for (ErrorPattern pattern : PATTERNS) {
            if (!pattern.matches(error)) {
                continue;
            }
            log.debug("Step {} failure matched pattern {}", step.id(), pattern.name());

            double confidence = pattern.confidence();
            int attempts = Math.max(step.attemptNumber(), 1);
            int maxAttempts = step.maxAttempts() > 0 ? step.maxAttempts() : Step.DEFAULT_MAX_ATTEMPTS;
            List<ResumeAlternative> alternatives = new ArrayList<>();

            if (attempts >= maxAttempts) {
                confidence = Math.max(0.3, confidence - 0.3);
                if (pattern.action() == ResumeAction.RESUME) {
                    alternatives.add(alt(ResumeAction.SKIP,
                        "Max attempts (" + maxAttempts + ") reached, consider skipping", 0.6));
                    alternatives.add(alt(ResumeAction.ABORT,
                        "Max attempts reached, manual intervention may be needed", 0.5));
                }
            } else {
                if (pattern.action() == ResumeAction.RESUME) {
                    alternatives.add(alt(ResumeAction.SKIP, "Skip if the error persists after retry", 0.4));
                }
                if (pattern.action() != ResumeAction.ABORT) {
                    alternatives.add(alt(ResumeAction.ABORT, "Stop and investigate if the issue continues", 0.3));
                }
            }

            if (!error.recoverable() && pattern.action() == ResumeAction.RESUME) {
                confidence = Math.max(0.4, confidence - 0.2);
            }

            return new ResumeDecision(
                pattern.action(),
                pattern.reason(),
                step.id(),
                checkpoint.id(),
                pattern.action() == ResumeAction.SKIP ? List.of(step.id()) : List.of(),
                confidence,
                alternatives
            );
        }

        if (error.recoverable()) {
            return decision(ResumeAction.RESUME, "Error is marked recoverable, attempting resume",
                checkpoint, step, 0.65,
                List.of(
                    alt(ResumeAction.SKIP, "Skip this step if resume fails", 0.5),
                    alt(ResumeAction.ABORT, "Stop and investigate the error", 0.4)));
        }

        return decision(ResumeAction.ABORT, "Non-recoverable error: " + error.message(),
            checkpoint, step, 0.7,
            List.of(
                alt(ResumeAction.SKIP, "Skip this step and continue", 0.4),
                alt(ResumeAction.RETRY, "Start over after fixing the issue", 0.3)));
    }

    private static double weight(ResumeAction action) {
        return switch (action) {
            case RESUME -> 1.0;
            case SKIP -> 0.8;
            case RETRY -> 0.6;
            case ABORT -> 0.4;
        };
    }

    private static ResumeDecision decision(ResumeAction action, String reason, StepCheckpoint checkpoint,
                                           Step step, double confidence, List<ResumeAlternative> alternatives) {
        return new ResumeDecision(action, reason, step != null ? step.id() : checkpoint.stepId(),
            checkpoint.id(), List.of(), confidence, alternatives);
    }

    private static ResumeAlternative alt(ResumeAction action, String reason, double confidence) {
        return new ResumeAlternative(action, reason, confidence);
    }

    private record ErrorPattern(String name, Pattern regex, ResumeAction action, double confidence, String reason) {

        ErrorPattern(String name, String regex, ResumeAction action, double confidence, String reason) {
            this(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), action, confidence, reason);
        }

        boolean matches(StepError error) {
            return find(error.message()) || find(error.code()) || find(exceptionType(error));
        }

        private boolean find(String text) {
            return text != null && regex.matcher(text).find();
        }

        private static String exceptionType(StepError error) {
            Object type = error.context() != null ? error.context().get("exception") : null;
            return type != null ? type.toString() : null;
        }
    }
}
