package com.agentexec.engine.metrics;

import com.agentexec.core.model.ExecutionEvent;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.resource.ResourceManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Micrometer metrics for the execution engine, fed from the event bus.
 *
 * Metrics exposed:
 * - Active agent gauge
 * - Admission denials
 * - Transitions by outcome, with duration timer
 * - Checkpoints created
 * - Wave units (research roles or tasks) by outcome
 */
public class ExecutionMetrics implements MeterBinder {

    public static final String AGENTS_ACTIVE = "agentexec.agents.active";
    public static final String ADMISSION_DENIED = "agentexec.admission.denied";
    public static final String TRANSITIONS = "agentexec.transitions";
    public static final String TRANSITION_DURATION = "agentexec.transition.duration";
    public static final String CHECKPOINTS_CREATED = "agentexec.checkpoints.created";
    public static final String WAVE_UNITS = "agentexec.wave.units";

    private final ExecutionEventBus eventBus;
    private final ResourceManager resourceManager;
    private MeterRegistry registry;
    private ExecutionEventBus.Subscription subscription;

    public ExecutionMetrics(ExecutionEventBus eventBus, ResourceManager resourceManager) {
        this.eventBus = eventBus;
        this.resourceManager = resourceManager;
    }

    @Override
    public synchronized void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(AGENTS_ACTIVE, resourceManager, ResourceManager::getActiveAgentCount)
            .description("Number of registered agents")
            .register(registry);

        if (subscription == null) {
            subscription = eventBus.subscribeAll(this::record);
        }
    }

    /**
     * Stop listening to the event bus.
     */
    public synchronized void close() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void record(ExecutionEvent event) {
        if (registry == null) {
            return;
        }
        switch (event.type()) {
            case ADMISSION_DENIED -> Counter.builder(ADMISSION_DENIED)
                .description("Agent admissions refused")
                .register(registry)
                .increment();
            case STATE_CHANGED -> transition(event, "success");
            case TRANSITION_FAILED -> transition(event, "failure");
            case CHECKPOINT_CREATED -> Counter.builder(CHECKPOINTS_CREATED)
                .description("Checkpoints written")
                .register(registry)
                .increment();
            case WAVE_COMPLETED -> {
                waveUnits("success", number(event, "succeeded"));
                waveUnits("failure", number(event, "failed"));
            }
            default -> {
            }
        }
    }

    private void transition(ExecutionEvent event, String outcome) {
        String transitionId = String.valueOf(event.payload().getOrDefault("transitionId", "none"));
        Counter.builder(TRANSITIONS)
            .tag("outcome", outcome)
            .tag("transition", transitionId)
            .description("Transitions executed")
            .register(registry)
            .increment();
        Timer.builder(TRANSITION_DURATION)
            .tag("outcome", outcome)
            .description("Transition execution time")
            .register(registry)
            .record(Duration.ofMillis(number(event, "durationMs")));
    }

    private void waveUnits(String outcome, long count) {
        if (count > 0) {
            Counter.builder(WAVE_UNITS)
                .tag("outcome", outcome)
                .description("Wave roles and tasks settled")
                .register(registry)
                .increment(count);
        }
    }

    private static long number(ExecutionEvent event, String key) {
        Object value = event.payload().get(key);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
