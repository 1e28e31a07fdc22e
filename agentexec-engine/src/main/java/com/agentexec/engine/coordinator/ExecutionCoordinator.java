package com.agentexec.engine.coordinator;

import com.agentexec.core.contract.AgentContract;
import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.exception.UndefinedTransitionException;
import com.agentexec.core.model.ExecutionContext;
import com.agentexec.core.transition.TransitionResult;
import com.agentexec.engine.contract.ContractRegistry;
import com.agentexec.engine.contract.ContractValidator;
import com.agentexec.engine.contract.ValidationOptions;
import com.agentexec.engine.contract.ValidationResult;
import com.agentexec.engine.resource.ResourceManager;
import com.agentexec.engine.service.ExecutionService;
import com.agentexec.engine.statemachine.StateMachineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordinator behind {@link ExecutionService}.
 * Holds live contexts in memory; each context is mutated by one transition at a time.
 * A context that reaches COMPLETED or FAILED leaves the live set for a bounded archive of
 * recently finished contexts, oldest evicted first.
 */
public class ExecutionCoordinator implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    public static final int DEFAULT_ARCHIVE_SIZE = 256;

    private final StateMachineExecutor stateMachine;
    private final ResourceManager resourceManager;
    private final ContractRegistry contractRegistry;
    private final ContractValidator contractValidator;
    private final Map<String, ExecutionContext> contexts = new ConcurrentHashMap<>();
    private final Map<String, ExecutionContext> archive;

    public ExecutionCoordinator(StateMachineExecutor stateMachine, ResourceManager resourceManager,
                                ContractRegistry contractRegistry, ContractValidator contractValidator) {
        this(stateMachine, resourceManager, contractRegistry, contractValidator, DEFAULT_ARCHIVE_SIZE);
    }

    public ExecutionCoordinator(StateMachineExecutor stateMachine, ResourceManager resourceManager,
                                ContractRegistry contractRegistry, ContractValidator contractValidator,
                                int archiveSize) {
        if (archiveSize < 0) {
            throw new IllegalArgumentException("archiveSize must be >= 0, was " + archiveSize);
        }
        this.stateMachine = stateMachine;
        this.resourceManager = resourceManager;
        this.contractRegistry = contractRegistry;
        this.contractValidator = contractValidator;
        this.archive = Collections.synchronizedMap(new LinkedHashMap<String, ExecutionContext>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ExecutionContext> eldest) {
                return size() > archiveSize;
            }
        });
    }

    @Override
    public ExecutionContext createContext(String taskId, String sessionId, Map<String, Object> inputs) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        ExecutionContext context = ExecutionContext.create(taskId, sessionId, inputs != null ? inputs : Map.of());
        contexts.put(context.getContextId(), context);
        log.info("Created context {} for task {}", context.getContextId(), taskId);
        return context;
    }

    /**
     * Live contexts first, then recently finished ones.
     */
    @Override
    public ExecutionContext getContext(String contextId) {
        ExecutionContext context = contextId != null ? contexts.get(contextId) : null;
        if (context == null && contextId != null) {
            context = archive.get(contextId);
        }
        if (context == null) {
            throw new NotFoundException("ExecutionContext", contextId);
        }
        return context;
    }

    @Override
    public List<ExecutionContext> listContexts() {
        return contexts.values().stream()
            .sorted(Comparator.comparing(ExecutionContext::getStartTime))
            .toList();
    }

    @Override
    public TransitionResult execute(String transitionId, String contextId) {
        ExecutionContext context = getContext(contextId);
        synchronized (context) {
            TransitionResult result = stateMachine.executeTransition(context, transitionId);
            log.debug("Transition {} on context {}: success={}, state={}",
                transitionId, contextId, result.success(), context.getState());
            if (context.getState().isTerminal() && contexts.remove(contextId) != null) {
                archive.put(contextId, context);
                log.info("Context {} finished in {}, archived", contextId, context.getState());
            }
            return result;
        }
    }

    @Override
    public TransitionResult executeDefined(String transitionId, String contextId) {
        ExecutionContext context = getContext(contextId);
        TransitionResult result = execute(transitionId, contextId);
        if (TransitionResult.UNDEFINED_TRANSITION.equals(result.errorCode())) {
            throw new UndefinedTransitionException(result.fromState(), result.toState(), result.error(),
                result.validTransitions(), context.getTaskId());
        }
        return result;
    }

    /**
     * Number of recently finished contexts still retained.
     */
    public int archivedCount() {
        return archive.size();
    }

    @Override
    public ValidationResult validate(String contractId, ValidationOptions options) {
        AgentContract contract = contractRegistry.get(contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
        return contractValidator.validate(contract, options);
    }

    @Override
    public boolean canSpawnAgent() {
        return resourceManager.canSpawnAgent();
    }

    @Override
    public void registerAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        resourceManager.registerAgent(agentId);
    }

    @Override
    public void unregisterAgent(String agentId) {
        resourceManager.unregisterAgent(agentId);
    }
}
