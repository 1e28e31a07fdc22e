package com.agentexec.engine.resource;

/**
 * Limits a resource snapshot must stay within before another agent may start.
 *
 * Invariants:
 * - maxCpuPercent and maxMemoryPercent in (0, 100]
 * - maxProcessCount >= 1
 */
public record ResourceThresholds(
    double maxCpuPercent,
    double maxMemoryPercent,
    int maxProcessCount
) {
    public ResourceThresholds {
        if (maxCpuPercent <= 0 || maxCpuPercent > 100) {
            throw new IllegalArgumentException("maxCpuPercent must be in (0, 100]");
        }
        if (maxMemoryPercent <= 0 || maxMemoryPercent > 100) {
            throw new IllegalArgumentException("maxMemoryPercent must be in (0, 100]");
        }
        if (maxProcessCount < 1) {
            throw new IllegalArgumentException("maxProcessCount must be >= 1");
        }
    }

    /**
     * Defaults suitable for a developer workstation.
     */
    public static ResourceThresholds defaults() {
        return new ResourceThresholds(80.0, 85.0, 400);
    }

    /**
     * Thresholds that never block; admission then depends only on the concurrency cap.
     */
    public static ResourceThresholds unlimited() {
        return new ResourceThresholds(100.0, 100.0, Integer.MAX_VALUE);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for thresholds.
     */
    public static class Builder {
        private double maxCpuPercent = 80.0;
        private double maxMemoryPercent = 85.0;
        private int maxProcessCount = 400;

        public Builder maxCpuPercent(double maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
            return this;
        }

        public Builder maxMemoryPercent(double maxMemoryPercent) {
            this.maxMemoryPercent = maxMemoryPercent;
            return this;
        }

        public Builder maxProcessCount(int maxProcessCount) {
            this.maxProcessCount = maxProcessCount;
            return this;
        }

        public ResourceThresholds build() {
            return new ResourceThresholds(maxCpuPercent, maxMemoryPercent, maxProcessCount);
        }
    }
}
