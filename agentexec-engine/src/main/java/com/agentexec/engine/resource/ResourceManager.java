package com.agentexec.engine.resource;

import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.core.model.ExecutionEventType;
import com.agentexec.core.model.ResourceSnapshot;
import com.agentexec.core.spi.MetricsSource;
import com.agentexec.engine.events.ExecutionEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admission control for concurrent agents.
 *
 * <p>An agent may start when fewer than {@code maxConcurrent} agents are registered and the
 * latest resource snapshot is within thresholds. The concurrency check runs first and
 * short-circuits, so a saturated manager never queries the metrics source.</p>
 *
 * <p>The active set is a concurrent set: register, unregister and count are safe from any
 * thread. {@link #tryAcquire(String)} makes check-and-register atomic for callers that
 * compete for slots.</p>
 */
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final int maxConcurrent;
    private final ResourceThresholds thresholds;
    private final MetricsSource metricsSource;
    private final ExecutionEventBus eventBus;
    private final Set<String> activeAgents = ConcurrentHashMap.newKeySet();
    private final Object admissionLock = new Object();
    private volatile ResourceSnapshot baseline;

    public ResourceManager(int maxConcurrent, ResourceThresholds thresholds, MetricsSource metricsSource,
                           ExecutionEventBus eventBus) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0, was " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.metricsSource = Objects.requireNonNull(metricsSource, "metricsSource");
        this.eventBus = eventBus != null ? eventBus : new ExecutionEventBus();
    }

    /**
     * Check whether one more agent may start. Never throws.
     */
    public boolean canSpawnAgent() {
        int active = activeAgents.size();
        if (active >= maxConcurrent) {
            log.debug("Admission denied: {}/{} agents active", active, maxConcurrent);
            publishDenied("Concurrency limit reached");
            return false;
        }
        ResourceCheckResult check = checkResources();
        if (!check.canSpawn()) {
            publishDenied(String.join("; ", check.violations()));
        }
        return check.canSpawn();
    }

    /**
     * Sample metrics and compare them against thresholds. A failing metrics source is
     * treated as "no capacity".
     */
    public ResourceCheckResult checkResources() {
        ResourceSnapshot snapshot;
        try {
            snapshot = metricsSource.sample();
        } catch (Exception e) {
            log.warn("Resource check failed: {}", e.getMessage());
            return new ResourceCheckResult(false, null, List.of("Resource check failed: " + e.getMessage()));
        }

        List<String> violations = new ArrayList<>();
        if (snapshot.cpuPercent() > thresholds.maxCpuPercent()) {
            violations.add(String.format("CPU usage %.1f%% exceeds %.1f%%",
                snapshot.cpuPercent(), thresholds.maxCpuPercent()));
        }
        if (snapshot.memoryPercent() > thresholds.maxMemoryPercent()) {
            violations.add(String.format("Memory usage %.1f%% exceeds %.1f%%",
                snapshot.memoryPercent(), thresholds.maxMemoryPercent()));
        }
        if (snapshot.processCount() > thresholds.maxProcessCount()) {
            violations.add(String.format("Process count %d exceeds %d",
                snapshot.processCount(), thresholds.maxProcessCount()));
        }
        if (!snapshot.canSpawnHint()) {
            violations.add("Metrics source reports no spare capacity");
        }
        return new ResourceCheckResult(violations.isEmpty(), snapshot, violations);
    }

    /**
     * Atomically check admission and register the agent. An id that is already active is
     * refused, since its slot belongs to another holder.
     *
     * @return true if the agent was admitted and is now registered
     */
    public boolean tryAcquire(String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        synchronized (admissionLock) {
            if (activeAgents.contains(agentId)) {
                log.warn("Admission denied: agent {} is already active", agentId);
                publishDenied("Agent " + agentId + " is already active");
                return false;
            }
            if (!canSpawnAgent()) {
                return false;
            }
            registerAgent(agentId);
            return true;
        }
    }

    /**
     * Add an agent to the active set. Registering an id twice is a no-op.
     */
    public void registerAgent(String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        if (activeAgents.add(agentId)) {
            log.info("Registered agent {} ({}/{})", agentId, activeAgents.size(), maxConcurrent);
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.AGENT_REGISTERED, agentId,
                Map.of("active", activeAgents.size())));
        }
    }

    /**
     * Remove an agent from the active set. Removing an unknown id is a no-op.
     */
    public void unregisterAgent(String agentId) {
        if (agentId != null && activeAgents.remove(agentId)) {
            log.info("Unregistered agent {} ({}/{})", agentId, activeAgents.size(), maxConcurrent);
            eventBus.publish(ExecutionEvent.of(ExecutionEventType.AGENT_UNREGISTERED, agentId,
                Map.of("active", activeAgents.size())));
        }
    }

    public int getActiveAgentCount() {
        return activeAgents.size();
    }

    public Set<String> getActiveAgents() {
        return Set.copyOf(activeAgents);
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public ResourceThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Record a reference snapshot, typically taken at startup, for diagnostics.
     */
    public void setBaseline(ResourceSnapshot snapshot) {
        this.baseline = snapshot;
        log.info("Resource baseline: cpu={}%, memory={}%, processes={}",
            snapshot.cpuPercent(), snapshot.memoryPercent(), snapshot.processCount());
    }

    public ResourceSnapshot getBaseline() {
        return baseline;
    }

    private void publishDenied(String reason) {
        eventBus.publish(ExecutionEvent.of(ExecutionEventType.ADMISSION_DENIED, "resource-manager",
            Map.of("reason", reason, "active", activeAgents.size(), "max", maxConcurrent)));
    }
}
