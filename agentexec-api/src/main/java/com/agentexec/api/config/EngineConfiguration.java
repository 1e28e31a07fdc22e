package com.agentexec.api.config;

import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.spi.MetricsSource;
import com.agentexec.core.spi.PromptExecutor;
import com.agentexec.engine.contract.ContractRegistry;
import com.agentexec.engine.contract.ContractValidator;
import com.agentexec.engine.coordinator.AdmissionPolicy;
import com.agentexec.engine.coordinator.ExecutionCoordinator;
import com.agentexec.engine.coordinator.WaveCoordinator;
import com.agentexec.engine.coordinator.WaveOrchestrator;
import com.agentexec.engine.events.ExecutionEventBus;
import com.agentexec.engine.health.EngineHealthIndicator;
import com.agentexec.engine.json.JsonSupport;
import com.agentexec.engine.metrics.MetricsConfiguration;
import com.agentexec.engine.persistence.FileSystemDocumentStore;
import com.agentexec.engine.persistence.InMemoryDocumentStore;
import com.agentexec.engine.persistence.jdbc.JdbcDocumentStore;
import com.agentexec.engine.resource.ResourceManager;
import com.agentexec.engine.resource.ResourceThresholds;
import com.agentexec.engine.resource.SystemMetricsSource;
import com.agentexec.engine.statemachine.StateMachineConfig;
import com.agentexec.engine.statemachine.StateMachineExecutor;
import com.agentexec.recovery.StaleSessionReaper;
import com.agentexec.recovery.checkpoint.CheckpointRepository;
import com.agentexec.recovery.decision.NullResumeDecisionEngine;
import com.agentexec.recovery.decision.PatternResumeDecisionEngine;
import com.agentexec.recovery.decision.ResumeDecisionEngine;
import com.agentexec.recovery.session.StepExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine from {@link EngineProperties}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@Import(MetricsConfiguration.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonSupport.objectMapper();
    }

    @Bean
    public ExecutionEventBus executionEventBus() {
        return new ExecutionEventBus();
    }

    @Bean
    public DocumentStore documentStore(EngineProperties properties, ObjectMapper objectMapper, Clock clock) {
        EngineProperties.Store store = properties.getStore();
        log.info("Using {} document store", store.getType());
        return switch (store.getType()) {
            case MEMORY -> new InMemoryDocumentStore(clock);
            case FILESYSTEM -> new FileSystemDocumentStore(Path.of(store.getDirectory()), objectMapper);
            case JDBC -> jdbcStore(store.getJdbc(), objectMapper);
        };
    }

    private static DocumentStore jdbcStore(EngineProperties.Jdbc jdbc, ObjectMapper objectMapper) {
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("agentexec.store.jdbc.url is required for the jdbc store");
        }
        DriverManagerDataSource dataSource = new DriverManagerDataSource(jdbc.getUrl(), jdbc.getUsername(), jdbc.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        return new JdbcDocumentStore(new JdbcTemplate(dataSource), objectMapper);
    }

    // ========== Resources and state machines ==========

    @Bean
    public MetricsSource metricsSource() {
        return new SystemMetricsSource();
    }

    @Bean
    public ResourceManager resourceManager(EngineProperties properties, MetricsSource metricsSource,
                                           ExecutionEventBus eventBus) {
        EngineProperties.Resources resources = properties.getResources();
        ResourceThresholds thresholds = ResourceThresholds.builder()
            .maxCpuPercent(resources.getMaxCpuPercent())
            .maxMemoryPercent(resources.getMaxMemoryPercent())
            .maxProcessCount(resources.getMaxProcessCount())
            .build();
        return new ResourceManager(resources.getMaxConcurrent(), thresholds, metricsSource, eventBus);
    }

    @Bean
    public StateMachineConfig stateMachineConfig(EngineProperties properties) {
        EngineProperties.StateMachine sm = properties.getStateMachine();
        return StateMachineConfig.builder()
            .maxRetries(sm.getMaxRetries())
            .allowFailFromAny(sm.isAllowFailFromAny())
            .slowTransitionThreshold(sm.getSlowTransitionThreshold())
            .build();
    }

    @Bean
    public StateMachineExecutor stateMachineExecutor(StateMachineConfig config, ExecutionEventBus eventBus, Clock clock) {
        return new StateMachineExecutor(config, eventBus, clock);
    }

    // ========== Contracts ==========

    @Bean
    public ContractRegistry contractRegistry(DocumentStore documentStore, ObjectMapper objectMapper, Clock clock) {
        return new ContractRegistry(documentStore, objectMapper, clock);
    }

    @Bean
    public ContractValidator contractValidator() {
        return new ContractValidator();
    }

    @Bean
    public ExecutionCoordinator executionCoordinator(StateMachineExecutor stateMachine, ResourceManager resourceManager,
                                                     ContractRegistry contractRegistry, ContractValidator contractValidator,
                                                     EngineProperties properties) {
        return new ExecutionCoordinator(stateMachine, resourceManager, contractRegistry, contractValidator,
            properties.getStateMachine().getContextArchiveSize());
    }

    // ========== Waves ==========

    @Bean
    public PromptExecutor promptExecutor() {
        return new UnconfiguredPromptExecutor();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService waveExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "wave-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public WaveCoordinator waveCoordinator(ResourceManager resourceManager, PromptExecutor promptExecutor,
                                           ExecutorService waveExecutor, ObjectMapper objectMapper,
                                           ExecutionEventBus eventBus, EngineProperties properties, Clock clock) {
        return new WaveCoordinator(resourceManager, promptExecutor, waveExecutor, objectMapper, eventBus,
            properties.getWaves().getRoleTimeout(), clock);
    }

    @Bean
    public WaveOrchestrator waveOrchestrator(ResourceManager resourceManager, PromptExecutor promptExecutor,
                                             StateMachineConfig stateMachineConfig, ExecutorService waveExecutor,
                                             ExecutionEventBus eventBus, EngineProperties properties, Clock clock) {
        EngineProperties.Admission admission = properties.getAdmission();
        return new WaveOrchestrator(resourceManager, promptExecutor,
            () -> new StateMachineExecutor(stateMachineConfig, eventBus, clock),
            waveExecutor, eventBus,
            new AdmissionPolicy(admission.getMaxAttempts(), admission.getBackoff()),
            properties.getWaves().getTaskTimeout());
    }

    // ========== Recovery ==========

    @Bean
    public ResumeDecisionEngine resumeDecisionEngine(EngineProperties properties, Clock clock) {
        return switch (properties.getRecovery().getDecisionEngine()) {
            case PATTERN -> new PatternResumeDecisionEngine(clock);
            case DEFAULT -> new NullResumeDecisionEngine();
        };
    }

    @Bean
    public CheckpointRepository checkpointRepository(DocumentStore documentStore, ObjectMapper objectMapper, Clock clock) {
        return new CheckpointRepository(documentStore, objectMapper, clock);
    }

    @Bean
    public StepExecutor stepExecutor(CheckpointRepository checkpointRepository, DocumentStore documentStore,
                                     ObjectMapper objectMapper, ResumeDecisionEngine resumeDecisionEngine,
                                     ExecutionEventBus eventBus, EngineProperties properties, Clock clock) {
        return new StepExecutor(checkpointRepository, documentStore, objectMapper, resumeDecisionEngine, eventBus,
            properties.getCheckpoints().getAutoCheckpointInterval(), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "agentexec.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StaleSessionReaper staleSessionReaper(StepExecutor stepExecutor, ResumeDecisionEngine resumeDecisionEngine,
                                                 EngineProperties properties, Clock clock) {
        EngineProperties.Recovery recovery = properties.getRecovery();
        return new StaleSessionReaper(stepExecutor, resumeDecisionEngine,
            recovery.getStaleSessionThreshold(), recovery.getScanInterval(), clock);
    }

    // ========== Health ==========

    @Bean
    public EngineHealthIndicator engineHealthIndicator(ResourceManager resourceManager, DocumentStore documentStore) {
        return new EngineHealthIndicator(resourceManager, documentStore);
    }
}
