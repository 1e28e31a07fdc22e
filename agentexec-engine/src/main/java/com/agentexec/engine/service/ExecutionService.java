package com.agentexec.engine.service;

import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.transition.TransitionResult;
import com.agentexec.engine.contract.ValidationOptions;
import com.agentexec.engine.contract.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Entry point for hosts driving the engine: contexts, transitions, contract validation and
 * agent admission.
 */
public interface ExecutionService {

    /**
     * Create a context in IDLE state.
     *
     * @param taskId    The task the context executes
     * @param sessionId Owning session, may be null
     * @param inputs    Task inputs
     * @return The created context
     */
    ExecutionContext createContext(String taskId, String sessionId, Map<String, Object> inputs);

    /**
     * Get a context by ID.
     *
     * @throws com.agentexec.core.exception.NotFoundException if unknown
     */
    ExecutionContext getContext(String contextId);

    /**
     * Contexts that have not yet reached a terminal state.
     */
    List<ExecutionContext> listContexts();

    /**
     * Execute a registered transition on a context.
     *
     * @param transitionId The transition ID
     * @param contextId    The context ID
     * @return The transition result; failures are reported, not thrown
     * @throws com.agentexec.core.exception.NotFoundException if the context is unknown
     */
    TransitionResult execute(String transitionId, String contextId);

    /**
     * Execute a transition that must be defined for the context's current state. Guard and
     * action failures are still reported in the result.
     *
     * @throws com.agentexec.core.exception.UndefinedTransitionException if the transition is unknown
     *         or cannot fire from the current state
     * @throws com.agentexec.core.exception.NotFoundException if the context is unknown
     */
    TransitionResult executeDefined(String transitionId, String contextId);

    /**
     * Validate a registered contract.
     *
     * @throws com.agentexec.core.exception.NotFoundException if the contract is unknown
     */
    ValidationResult validate(String contractId, ValidationOptions options);

    boolean canSpawnAgent();

    void registerAgent(String agentId);

    void unregisterAgent(String agentId);
}
