package com.agentexec.core.transition;

import com.agentexec.core.contract.Condition;
import com.agentexec.core.model.ExecutionState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The default lifecycle: IDLE -> PLANNING -> EXECUTING -> VERIFYING -> COMMITTING -> COMPLETED,
 * the VERIFYING -> EXECUTING retry loop, and one transition to FAILED per non-terminal state.
 */
public final class StandardTransitions {

    public static final String START_PLANNING = "idle-to-planning";
    public static final String START_EXECUTION = "planning-to-executing";
    public static final String START_VERIFICATION = "executing-to-verifying";
    public static final String START_COMMIT = "verifying-to-committing";
    public static final String COMPLETE = "committing-to-completed";
    public static final String RETRY_FROM_VERIFICATION = "verifying-to-executing";

    private StandardTransitions() {
    }

    public static Transition startPlanning() {
        return Transition.builder(START_PLANNING, ExecutionState.IDLE, ExecutionState.PLANNING)
            .name("Start Planning")
            .guard(Condition.precondition("has-task-input", "Has prompt or task",
                ctx -> ctx.hasInput("prompt") || ctx.hasInput("task"),
                "A prompt or task input is required to start planning"))
            .build();
    }

    public static Transition startExecution() {
        return Transition.builder(START_EXECUTION, ExecutionState.PLANNING, ExecutionState.EXECUTING)
            .name("Start Execution")
            .build();
    }

    public static Transition startVerification() {
        return Transition.builder(START_VERIFICATION, ExecutionState.EXECUTING, ExecutionState.VERIFYING)
            .name("Start Verification")
            .guard(Condition.precondition("has-outputs", "Has outputs",
                ctx -> ctx.hasOutputs(), "Execution produced no outputs"))
            .build();
    }

    public static Transition startCommit() {
        return Transition.builder(START_COMMIT, ExecutionState.VERIFYING, ExecutionState.COMMITTING)
            .name("Start Commit")
            .guard(Condition.precondition("no-error", "No error",
                ctx -> !ctx.hasError(), "Cannot commit with an error on the context"))
            .build();
    }

    public static Transition complete() {
        return Transition.builder(COMPLETE, ExecutionState.COMMITTING, ExecutionState.COMPLETED)
            .name("Complete")
            .postAction(ctx -> {
                if (ctx.getEndTime() == null) {
                    ctx.setEndTime(Instant.now());
                }
            })
            .build();
    }

    public static Transition retryFromVerification() {
        return Transition.builder(RETRY_FROM_VERIFICATION, ExecutionState.VERIFYING, ExecutionState.EXECUTING)
            .name("Retry Execution")
            .description("Verification failed; execute again")
            .retry(true)
            .build();
    }

    /**
     * Transition from {@code state} to FAILED, stamping the end time.
     */
    public static Transition fail(ExecutionState state) {
        if (state.isTerminal()) {
            throw new IllegalArgumentException("No failure transition from terminal state " + state);
        }
        return Transition.builder(failId(state), state, ExecutionState.FAILED)
            .name("Fail from " + state)
            .postAction(ctx -> ctx.setEndTime(Instant.now()))
            .build();
    }

    public static String failId(ExecutionState state) {
        return state.name().toLowerCase(Locale.ROOT) + "-to-failed";
    }

    /**
     * Every standard transition, failure family included.
     */
    public static List<Transition> all() {
        List<Transition> transitions = new ArrayList<>(List.of(
            startPlanning(),
            startExecution(),
            startVerification(),
            startCommit(),
            complete(),
            retryFromVerification()
        ));
        for (ExecutionState state : ExecutionState.values()) {
            if (!state.isTerminal()) {
                transitions.add(fail(state));
            }
        }
        return transitions;
    }
}
