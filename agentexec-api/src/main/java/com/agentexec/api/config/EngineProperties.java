package com.agentexec.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from the {@code agentexec.*} namespace.
 */
@ConfigurationProperties(prefix = "agentexec")
public class EngineProperties {

    private Resources resources = new Resources();
    private StateMachine stateMachine = new StateMachine();
    private Checkpoints checkpoints = new Checkpoints();
    private Admission admission = new Admission();
    private Recovery recovery = new Recovery();
    private Waves waves = new Waves();
    private Store store = new Store();

    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }
    public StateMachine getStateMachine() { return stateMachine; }
    public void setStateMachine(StateMachine stateMachine) { this.stateMachine = stateMachine; }
    public Checkpoints getCheckpoints() { return checkpoints; }
    public void setCheckpoints(Checkpoints checkpoints) { this.checkpoints = checkpoints; }
    public Admission getAdmission() { return admission; }
    public void setAdmission(Admission admission) { this.admission = admission; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Waves getWaves() { return waves; }
    public void setWaves(Waves waves) { this.waves = waves; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    /**
     * Agent concurrency cap and host resource thresholds.
     */
    public static class Resources {
        private int maxConcurrent = 2;
        private double maxCpuPercent = 80.0;
        private double maxMemoryPercent = 85.0;
        private int maxProcessCount = 400;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public double getMaxCpuPercent() { return maxCpuPercent; }
        public void setMaxCpuPercent(double maxCpuPercent) { this.maxCpuPercent = maxCpuPercent; }
        public double getMaxMemoryPercent() { return maxMemoryPercent; }
        public void setMaxMemoryPercent(double maxMemoryPercent) { this.maxMemoryPercent = maxMemoryPercent; }
        public int getMaxProcessCount() { return maxProcessCount; }
        public void setMaxProcessCount(int maxProcessCount) { this.maxProcessCount = maxProcessCount; }
    }

    public static class StateMachine {
        private int maxRetries = 3;
        private boolean allowFailFromAny = true;
        private Duration slowTransitionThreshold = Duration.ofSeconds(30);
        /** Finished contexts kept for lookup after they leave the live set. */
        private int contextArchiveSize = 256;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public boolean isAllowFailFromAny() { return allowFailFromAny; }
        public void setAllowFailFromAny(boolean allowFailFromAny) { this.allowFailFromAny = allowFailFromAny; }
        public Duration getSlowTransitionThreshold() { return slowTransitionThreshold; }
        public void setSlowTransitionThreshold(Duration slowTransitionThreshold) { this.slowTransitionThreshold = slowTransitionThreshold; }
        public int getContextArchiveSize() { return contextArchiveSize; }
        public void setContextArchiveSize(int contextArchiveSize) { this.contextArchiveSize = contextArchiveSize; }
    }

    public static class Checkpoints {
        /** Checkpoint every Nth completed step; 0 disables interval checkpoints. */
        private int autoCheckpointInterval = 1;
        /** Checkpoints kept per session when compacting. */
        private int retention = 20;

        public int getAutoCheckpointInterval() { return autoCheckpointInterval; }
        public void setAutoCheckpointInterval(int autoCheckpointInterval) { this.autoCheckpointInterval = autoCheckpointInterval; }
        public int getRetention() { return retention; }
        public void setRetention(int retention) { this.retention = retention; }
    }

    /**
     * How long wave tasks wait for an agent slot.
     */
    public static class Admission {
        private int maxAttempts = 10;
        private Duration backoff = Duration.ofMillis(100);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration staleSessionThreshold = Duration.ofMinutes(30);
        private Duration scanInterval = Duration.ofSeconds(60);
        private DecisionEngineType decisionEngine = DecisionEngineType.PATTERN;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getStaleSessionThreshold() { return staleSessionThreshold; }
        public void setStaleSessionThreshold(Duration staleSessionThreshold) { this.staleSessionThreshold = staleSessionThreshold; }
        public Duration getScanInterval() { return scanInterval; }
        public void setScanInterval(Duration scanInterval) { this.scanInterval = scanInterval; }
        public DecisionEngineType getDecisionEngine() { return decisionEngine; }
        public void setDecisionEngine(DecisionEngineType decisionEngine) { this.decisionEngine = decisionEngine; }
    }

    public static class Waves {
        private Duration roleTimeout = Duration.ofMinutes(5);
        private Duration taskTimeout = Duration.ofMinutes(10);

        public Duration getRoleTimeout() { return roleTimeout; }
        public void setRoleTimeout(Duration roleTimeout) { this.roleTimeout = roleTimeout; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
    }

    public static class Store {
        private StoreType type = StoreType.FILESYSTEM;
        private String directory = "./.agentexec";
        private Jdbc jdbc = new Jdbc();

        public StoreType getType() { return type; }
        public void setType(StoreType type) { this.type = type; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url;
        private String username;
        private String password;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public enum StoreType {
        MEMORY,
        FILESYSTEM,
        JDBC
    }

    public enum DecisionEngineType {
        /** Error-pattern analysis. */
        PATTERN,
        /** Always resume with fixed confidence. */
        DEFAULT
    }
}
