package com.agentexec.core.transition;

import com.agentexec.core.model.ExecutionContext;

/**
 * Side-effecting step run before or after a transition changes state.
 */
@FunctionalInterface
public interface TransitionAction {

    void apply(ExecutionContext context) throws Exception;
}
