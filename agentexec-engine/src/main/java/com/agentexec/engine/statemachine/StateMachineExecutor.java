package com.agentexec.engine.statemachine;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ExecutionState;
import com.agentexec.core.transition.StandardTransitions;
import com.agentexec.core.transition.Transition;
import com.agentexec.core.transition.TransitionAction;
import com.agentexec.core.transition.TransitionResult;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives execution contexts through the agent lifecycle.
 *
 * <p>Holds the transition registry (indexed by source state, highest priority first) and
 * runs either single transitions or the full IDLE to COMPLETED flow with the bounded
 * VERIFYING to EXECUTING retry loop. One executor serves many contexts; each context must
 * only be driven by one thread at a time.</p>
 */
public class StateMachineExecutor {

    private static final Logger log = LoggerFactory.getLogger(StateMachineExecutor.class);

    private final StateMachineConfig config;
    private final TransitionExecutor transitionExecutor;
    private final ExecutionEventBus eventBus;
    private final Clock clock;
    private final Map<ExecutionState, List<Transition>> transitionsByFrom = new ConcurrentHashMap<>();
    private final Map<String, Transition> transitionsById = new ConcurrentHashMap<>();

    public StateMachineExecutor(StateMachineConfig config, ExecutionEventBus eventBus) {
        this(config, eventBus, Clock.systemUTC());
    }

    public StateMachineExecutor(StateMachineConfig config, ExecutionEventBus eventBus, Clock clock) {
        this.config = config;
        this.eventBus = eventBus != null ? eventBus : new ExecutionEventBus();
        this.clock = clock;
        this.transitionExecutor = new TransitionExecutor(clock);

        for (Transition transition : StandardTransitions.all()) {
            if (transition.getTo() != ExecutionState.FAILED || config.allowFailFromAny()) {
                register(transition);
            }
        }
        config.customTransitions().forEach(this::register);
        log.debug("State machine ready with {} transitions ({} custom)",
            transitionsById.size(), config.customTransitions().size());
    }

    // ========== Registry ==========

    /**
     * Register a transition, replacing any transition with the same id.
     *
     * @throws IllegalArgumentException if the lifecycle does not allow {@code from -> to}
     */
    public synchronized void registerTransition(Transition transition) {
        register(transition);
        log.debug("Registered transition {}", transition);
    }

    private synchronized void register(Transition transition) {
        if (!transition.getFrom().canTransitionTo(transition.getTo())) {
            throw new IllegalArgumentException(String.format(
                "Transition %s is not allowed by the lifecycle (%s -> %s)",
                transition.getId(), transition.getFrom(), transition.getTo()));
        }
        Transition previous = transitionsById.put(transition.getId(), transition);
        if (previous != null) {
            removeFromIndex(previous);
        }
        List<Transition> list = new ArrayList<>(transitionsByFrom.getOrDefault(transition.getFrom(), List.of()));
        list.add(transition);
        list.sort(Comparator.comparingInt(Transition::getPriority).reversed());
        transitionsByFrom.put(transition.getFrom(), List.copyOf(list));
    }

    public Optional<Transition> getTransition(String transitionId) {
        return Optional.ofNullable(transitionsById.get(transitionId));
    }

    /**
     * Transitions that may fire from a state, highest priority first.
     */
    public List<Transition> getAvailableTransitions(ExecutionState state) {
        return transitionsByFrom.getOrDefault(state, List.of());
    }

    public boolean isValidTransition(ExecutionState from, ExecutionState to) {
        return from.canTransitionTo(to);
    }

    /**
     * First transition from the context's state whose guards all pass.
     */
    public Optional<Transition> findTransition(ExecutionContext context) {
        for (Transition transition : getAvailableTransitions(context.getState())) {
            if (transitionExecutor.evaluateGuards(transition, context) == null) {
                return Optional.of(transition);
            }
        }
        return Optional.empty();
    }

    // ========== Single Transitions ==========

    /**
     * Execute a registered transition by id.
     */
    public TransitionResult executeTransition(ExecutionContext context, String transitionId) {
        Transition transition = transitionId != null ? transitionsById.get(transitionId) : null;
        if (transition == null) {
            Instant now = clock.instant();
            TransitionResult result = TransitionResult.failed(transitionId, context.getState(), null, now, 0,
                    TransitionResult.UNDEFINED_TRANSITION, "Unknown transition: " + transitionId)
                .withValidTransitions(new ArrayList<>(context.getState().validTargets()));
            notify(result, context);
            return result;
        }
        return run(transition, context);
    }

    /**
     * Move the context to a target state using the best registered transition for that move.
     * When several match, the highest-priority one whose guards pass is used; if none pass,
     * the highest-priority one runs so that the guard failure is reported.
     */
    public TransitionResult executeTransition(ExecutionContext context, ExecutionState target) {
        ExecutionState current = context.getState();
        if (!current.canTransitionTo(target)) {
            TransitionResult result = undefined(current, target,
                String.format("Cannot transition from %s to %s", current, target));
            notify(result, context);
            return result;
        }

        List<Transition> candidates = getAvailableTransitions(current).stream()
            .filter(t -> t.getTo() == target)
            .toList();
        if (candidates.isEmpty()) {
            TransitionResult result = undefined(current, target,
                String.format("No transition registered from %s to %s", current, target));
            notify(result, context);
            return result;
        }

        Transition chosen = candidates.size() == 1 ? candidates.get(0) : candidates.stream()
            .filter(t -> transitionExecutor.evaluateGuards(t, context) == null)
            .findFirst()
            .orElse(candidates.get(0));
        return run(chosen, context);
    }

    // ========== Full Lifecycle ==========

    /**
     * Run a context from IDLE to a terminal state, invoking the phase handlers.
     *
     * <p>A verifier returning false (or throwing) takes the retry transition back to
     * EXECUTING, up to {@code maxRetries} times; after that the context fails with
     * "Max retries (n) exceeded". Any handler exception fails the context.</p>
     */
    public ExecutionResult execute(ExecutionContext context, ExecutionHandlers handlers) {
        Instant start = clock.instant();
        List<HistoryEntry> history = new ArrayList<>();
        int retryCount = 0;

        if (context.getState() != ExecutionState.IDLE) {
            return buildResult(context, history, start, 0,
                "Execution must start from IDLE state, not " + context.getState());
        }

        try (var logCtx = LoggingContext.forTask(context.getSessionId(), context.getTaskId(), context.getAttempt())) {
            log.info("Starting lifecycle for task {}", context.getTaskId());

            String error = step(context, ExecutionState.PLANNING, history, 0);
            if (error == null) {
                error = runHandler(handlers.onPlanning(), context);
            }
            if (error == null) {
                error = step(context, ExecutionState.EXECUTING, history, 0);
            }

            boolean verified = false;
            while (error == null && !verified) {
                context.incrementAttempt();
                error = runHandler(handlers.onExecuting(), context);
                if (error != null) {
                    break;
                }
                error = step(context, ExecutionState.VERIFYING, history, retryCount);
                if (error != null) {
                    break;
                }
                verified = verify(handlers, context);
                if (!verified) {
                    if (retryCount >= config.maxRetries()) {
                        error = "Max retries (" + config.maxRetries() + ") exceeded";
                        break;
                    }
                    retryCount++;
                    log.info("Verification failed for task {}, retry {}/{}",
                        context.getTaskId(), retryCount, config.maxRetries());
                    error = step(context, ExecutionState.EXECUTING, history, retryCount);
                }
            }

            if (error == null) {
                error = step(context, ExecutionState.COMMITTING, history, retryCount);
            }
            if (error == null) {
                error = runHandler(handlers.onCommitting(), context);
            }
            if (error == null) {
                error = step(context, ExecutionState.COMPLETED, history, retryCount);
            }

            if (error != null) {
                transitionToFailed(context, error, history, retryCount);
            }
            ExecutionResult result = buildResult(context, history, start, retryCount, error);
            log.info("Lifecycle for task {} finished in {} after {} retries", context.getTaskId(),
                result.finalState(), retryCount);
            return result;
        }
    }

    // ========== Internal Methods ==========

    private String step(ExecutionContext context, ExecutionState target, List<HistoryEntry> history, int retryAttempt) {
        TransitionResult result = executeTransition(context, target);
        String name = result.transitionId() == null
            ? "to " + target
            : getTransition(result.transitionId()).map(Transition::getName).orElse(result.transitionId());
        history.add(HistoryEntry.from(result, name, retryAttempt));
        return result.success() ? null : result.error();
    }

    private String runHandler(TransitionAction handler, ExecutionContext context) {
        try {
            handler.apply(context);
            return null;
        } catch (Exception e) {
            log.warn("Handler failed in {} for task {}: {}", context.getState(), context.getTaskId(), e.getMessage());
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }

    private boolean verify(ExecutionHandlers handlers, ExecutionContext context) {
        if (handlers.onVerifying() == null) {
            return true;
        }
        try {
            return handlers.onVerifying().test(context);
        } catch (Exception e) {
            log.warn("Verifier threw for task {}: {}", context.getTaskId(), e.getMessage());
            return false;
        }
    }

    private void transitionToFailed(ExecutionContext context, String error, List<HistoryEntry> history, int retryAttempt) {
        context.setError(error);
        ExecutionState current = context.getState();
        if (current.isTerminal()) {
            return;
        }
        Transition fail = transitionsById.get(StandardTransitions.failId(current));
        if (fail == null) {
            log.warn("No failure transition registered from {}; task {} left in place", current, context.getTaskId());
            return;
        }
        TransitionResult result = run(fail, context);
        history.add(HistoryEntry.from(result, fail.getName(), retryAttempt));
    }

    private TransitionResult run(Transition transition, ExecutionContext context) {
        TransitionResult result = transitionExecutor.execute(transition, context);
        notify(result, context);
        return result;
    }

    private void notify(TransitionResult result, ExecutionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", context.getTaskId());
        payload.put("transitionId", result.transitionId());
        payload.put("from", String.valueOf(result.fromState()));
        payload.put("to", String.valueOf(result.toState()));
        payload.put("durationMs", result.durationMs());

        if (result.success()) {
            if (result.durationMs() > config.slowTransitionThreshold().toMillis()) {
                log.warn("Transition {} took {}ms (threshold {}ms)", result.transitionId(), result.durationMs(),
                    config.slowTransitionThreshold().toMillis());
            }
            safely(() -> config.onStateChange().onStateChange(result.fromState(), result.toState(), context));
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.STATE_CHANGED, context.getContextId(),
                context.getSessionId(), payload));
        } else {
            payload.put("errorCode", result.errorCode());
            payload.put("error", result.error());
            safely(() -> config.onError().accept(result.error(), context));
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.TRANSITION_FAILED, context.getContextId(),
                context.getSessionId(), payload));
        }
    }

    private void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("State machine callback threw: {}", e.getMessage(), e);
        }
    }

    private TransitionResult undefined(ExecutionState from, ExecutionState to, String reason) {
        return TransitionResult.failed(null, from, to, clock.instant(), 0, TransitionResult.UNDEFINED_TRANSITION, reason)
            .withValidTransitions(new ArrayList<>(from.validTargets()));
    }

    private ExecutionResult buildResult(ExecutionContext context, List<HistoryEntry> history, Instant start,
                                        int retryCount, String error) {
        boolean success = error == null && context.getState() == ExecutionState.COMPLETED;
        return new ExecutionResult(context.getState(), success, context, history,
            Duration.between(start, clock.instant()).toMillis(), retryCount, error);
    }

    private void removeFromIndex(Transition transition) {
        List<Transition> list = new ArrayList<>(transitionsByFrom.getOrDefault(transition.getFrom(), List.of()));
        list.removeIf(t -> t.getId().equals(transition.getId()));
        transitionsByFrom.put(transition.getFrom(), List.copyOf(list));
    }
}
