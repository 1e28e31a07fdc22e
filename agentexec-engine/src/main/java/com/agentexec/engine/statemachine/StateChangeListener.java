package com.agentexec.engine.statemachine;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.model.ExecutionState;

/**
 * Callback fired after every successful transition.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(ExecutionState from, ExecutionState to, ExecutionContext context);
}
