package com.agentexec.engine.statemachine;

import com.agentexec.core.contract.Condition;
import com.agentexec.core.contract.ConditionResult;
import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.transition.Transition;
import com.agentexec.core.transition.TransitionAction;
import com.agentexec.core.transition.TransitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs one transition against one context.
 *
 * Protocol:
 * 1. Wrong source state: fail with UNDEFINED_TRANSITION, context untouched.
 * 2. Guards in order, stopping at the first that does not pass: fail, no action runs.
 * 3. Pre-actions in order; a throw triggers rollback, state stays at the source.
 * 4. State moves to the target.
 * 5. Post-actions in order; a throw reverts the state to the source and triggers rollback.
 * 6. Success.
 *
 * Never throws: every failure comes back as a {@link TransitionResult}. A rollback failure
 * is reported in {@code rollbackError} and never replaces the original error.
 */
public class TransitionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransitionExecutor.class);

    private final Clock clock;

    public TransitionExecutor() {
        this(Clock.systemUTC());
    }

    public TransitionExecutor(Clock clock) {
        this.clock = clock;
    }

    public TransitionResult execute(Transition transition, ExecutionContext context) {
        Instant start = clock.instant();
        ExecutionState sourceState = context.getState();

        if (!transition.canTransitionFrom(sourceState)) {
            String reason = String.format("Transition '%s' requires state '%s'", transition.getName(), transition.getFrom());
            log.debug("Undefined transition {} for task {} in state {}", transition.getId(), context.getTaskId(), sourceState);
            return TransitionResult.failed(transition.getId(), sourceState, transition.getTo(), start, elapsed(start),
                    TransitionResult.UNDEFINED_TRANSITION, reason)
                .withValidTransitions(List.of(transition.getFrom()));
        }

        String guardFailure = evaluateGuards(transition, context);
        if (guardFailure != null) {
            log.debug("Guards rejected {} for task {}: {}", transition.getId(), context.getTaskId(), guardFailure);
            return TransitionResult.failed(transition.getId(), sourceState, transition.getTo(), start, elapsed(start),
                TransitionResult.GUARD_FAILED, guardFailure);
        }

        Exception preFailure = runActions(transition.getPreActions(), context);
        if (preFailure != null) {
            context.setState(sourceState);
            log.warn("Pre-action of {} failed for task {}: {}", transition.getId(), context.getTaskId(), preFailure.getMessage());
            return rollback(transition, context, preFailure,
                TransitionResult.failed(transition.getId(), sourceState, transition.getTo(), start, elapsed(start),
                    TransitionResult.PRE_ACTION_FAILED, messageOf(preFailure)));
        }

        context.setState(transition.getTo());

        Exception postFailure = runActions(transition.getPostActions(), context);
        if (postFailure != null) {
            context.setState(sourceState);
            log.warn("Post-action of {} failed for task {}, state reverted to {}: {}",
                transition.getId(), context.getTaskId(), sourceState, postFailure.getMessage());
            return rollback(transition, context, postFailure,
                TransitionResult.failed(transition.getId(), sourceState, transition.getTo(), start, elapsed(start),
                    TransitionResult.POST_ACTION_FAILED, messageOf(postFailure)));
        }

        return TransitionResult.succeeded(transition.getId(), sourceState, transition.getTo(), start, elapsed(start));
    }

    /**
     * Evaluate guards in order.
     *
     * @return {@code null} if every guard passed, otherwise the failure message
     */
    public String evaluateGuards(Transition transition, ExecutionContext context) {
        for (Condition guard : transition.getGuards()) {
            ConditionResult result = guard.evaluate(context);
            if (!result.passed()) {
                String message = "Guard conditions not met for transition '" + transition.getName() + "'";
                return result.errorMessage() != null ? message + ": " + result.errorMessage() : message;
            }
        }
        return null;
    }

    // ========== Internal Methods ==========

    private Exception runActions(List<TransitionAction> actions, ExecutionContext context) {
        for (TransitionAction action : actions) {
            try {
                action.apply(context);
            } catch (Exception e) {
                return e;
            }
        }
        return null;
    }

    private TransitionResult rollback(Transition transition, ExecutionContext context, Exception cause,
                                      TransitionResult failure) {
        if (transition.getRollback() == null) {
            return failure.withRollback(false, null);
        }
        try {
            transition.getRollback().rollback(context, cause);
            log.info("Rolled back {} for task {}", transition.getId(), context.getTaskId());
            return failure.withRollback(true, null);
        } catch (Exception rollbackError) {
            log.error("Rollback of {} failed for task {}: {}", transition.getId(), context.getTaskId(),
                rollbackError.getMessage());
            return failure.withRollback(false, messageOf(rollbackError));
        }
    }

    private long elapsed(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
