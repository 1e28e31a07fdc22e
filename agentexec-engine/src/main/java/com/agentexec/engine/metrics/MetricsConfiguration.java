package com.agentexec.engine.metrics;

import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.resource.ResourceManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the execution engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The event-driven engine meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "agent-execution-engine");
    }

    @Bean(destroyMethod = "close")
    public ExecutionMetrics executionMetrics(ExecutionEventBus eventBus, ResourceManager resourceManager) {
        return new ExecutionMetrics(eventBus, resourceManager);
    }
}
