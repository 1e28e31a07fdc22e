package com.agentexec.core.transition;

import com.agentexec.core.model.ExecutionContext;

/**
 * Compensation invoked once when a transition action fails.
 */
@FunctionalInterface
public interface RollbackAction {

    /**
     * @param context the context, already restored to its pre-transition state
     * @param cause   the action failure that triggered the rollback
     */
    void rollback(ExecutionContext context, Exception cause) throws Exception;
}
