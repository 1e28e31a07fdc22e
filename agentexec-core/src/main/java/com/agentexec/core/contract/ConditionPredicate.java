package com.agentexec.core.contract;

import com.agentexec.core.model.ExecutionContext;

/**
 * User-supplied check over an execution context. May throw; callers convert a thrown
 * exception into a failed result.
 */
@FunctionalInterface
public interface ConditionPredicate {

    boolean test(ExecutionContext context) throws Exception;
}
