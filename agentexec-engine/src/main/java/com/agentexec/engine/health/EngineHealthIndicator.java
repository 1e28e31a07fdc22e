package com.agentexec.engine.health;

import com.agentexec.core.repository.DocumentStore;
import com.agentexec.engine.resource.ResourceCheckResult;
import com.agentexec.engine.resource.ResourceManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the execution engine.
 * Reports health status based on:
 * - Agent admission capacity
 * - Resource metrics availability
 * - Document store connectivity
 *
 * A saturated engine is still UP; it is DOWN only when metrics or storage cannot be reached.
 */
public class EngineHealthIndicator implements HealthIndicator {

    private final ResourceManager resourceManager;
    private final DocumentStore documentStore;

    public EngineHealthIndicator(ResourceManager resourceManager, DocumentStore documentStore) {
        this.resourceManager = resourceManager;
        this.documentStore = documentStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activeAgents", resourceManager.getActiveAgentCount());
        details.put("maxConcurrent", resourceManager.getMaxConcurrent());

        ResourceCheckResult check = resourceManager.checkResources();
        details.put("canSpawn", check.canSpawn()
            && resourceManager.getActiveAgentCount() < resourceManager.getMaxConcurrent());
        if (!check.violations().isEmpty()) {
            details.put("violations", check.violations());
        }
        boolean metricsUp = check.snapshot() != null;

        boolean storeUp = checkStore(details);
        if (!metricsUp || !storeUp) {
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    private boolean checkStore(Map<String, Object> details) {
        if (documentStore == null) {
            details.put("store", "none");
            return true;
        }
        try {
            boolean available = documentStore.isAvailable();
            details.put("store", available ? "available" : "unavailable");
            return available;
        } catch (RuntimeException e) {
            details.put("store", "unavailable");
            details.put("storeError", e.getMessage());
            return false;
        }
    }
}
