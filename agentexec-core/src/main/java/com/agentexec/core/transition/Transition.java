package com.agentexec.core.transition;

import com.agentexec.core.contract.Condition;
import com.agentexec.core.model.ExecutionState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable definition of a guarded move between two execution states.
 *
 * Invariants:
 * - canTransitionFrom(s) is true iff s == from
 * - guards, pre-actions and post-actions keep registration order
 */
public final class Transition {

    private final String id;
    private final String name;
    private final ExecutionState from;
    private final ExecutionState to;
    private final List<Condition> guards;
    private final List<TransitionAction> preActions;
    private final List<TransitionAction> postActions;
    private final RollbackAction rollback;
    private final String description;
    private final int priority;
    private final boolean retry;

    private Transition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name != null ? builder.name : builder.id;
        this.from = Objects.requireNonNull(builder.from, "from");
        this.to = Objects.requireNonNull(builder.to, "to");
        this.guards = List.copyOf(builder.guards);
        this.preActions = List.copyOf(builder.preActions);
        this.postActions = List.copyOf(builder.postActions);
        this.rollback = builder.rollback;
        this.description = builder.description;
        this.priority = builder.priority;
        this.retry = builder.retry;
    }

    public static Builder builder(String id, ExecutionState from, ExecutionState to) {
        return new Builder(id, from, to);
    }

    public boolean canTransitionFrom(ExecutionState state) {
        return from == state;
    }

    /**
     * Copy of this definition with an additional guard appended.
     */
    public Transition withGuard(Condition guard) {
        return toBuilder().guard(guard).build();
    }

    public Transition withPriority(int newPriority) {
        return toBuilder().priority(newPriority).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id, from, to)
            .name(name)
            .description(description)
            .priority(priority)
            .retry(retry)
            .rollback(rollback);
        guards.forEach(builder::guard);
        preActions.forEach(builder::preAction);
        postActions.forEach(builder::postAction);
        return builder;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ExecutionState getFrom() {
        return from;
    }

    public ExecutionState getTo() {
        return to;
    }

    public List<Condition> getGuards() {
        return guards;
    }

    public List<TransitionAction> getPreActions() {
        return preActions;
    }

    public List<TransitionAction> getPostActions() {
        return postActions;
    }

    public RollbackAction getRollback() {
        return rollback;
    }

    public String getDescription() {
        return description;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * True for the verification-failed loop back into EXECUTING.
     */
    public boolean isRetry() {
        return retry;
    }

    @Override
    public String toString() {
        return id + " (" + from + " -> " + to + ")";
    }

    /**
     * Builder for transitions.
     */
    public static class Builder {
        private final String id;
        private final ExecutionState from;
        private final ExecutionState to;
        private String name;
        private final List<Condition> guards = new ArrayList<>();
        private final List<TransitionAction> preActions = new ArrayList<>();
        private final List<TransitionAction> postActions = new ArrayList<>();
        private RollbackAction rollback;
        private String description;
        private int priority;
        private boolean retry;

        private Builder(String id, ExecutionState from, ExecutionState to) {
            this.id = id;
            this.from = from;
            this.to = to;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder guard(Condition guard) {
            this.guards.add(guard);
            return this;
        }

        public Builder preAction(TransitionAction action) {
            this.preActions.add(action);
            return this;
        }

        public Builder postAction(TransitionAction action) {
            this.postActions.add(action);
            return this;
        }

        public Builder rollback(RollbackAction rollback) {
            this.rollback = rollback;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder retry(boolean retry) {
            this.retry = retry;
            return this;
        }

        public Transition build() {
            return new Transition(this);
        }
    }
}
