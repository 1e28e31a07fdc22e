package com.agentexec.engine.resource;

import com.agentexec.core.model.ResourceSnapshot;
import com.agentexec.core.spi.MetricsSource;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * Samples the host the JVM runs on.
 * CPU comes from the system load average normalised by processor count when the
 * platform bean does not expose a CPU load.
 */
public class SystemMetricsSource implements MetricsSource {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public ResourceSnapshot sample() {
        double cpu = cpuPercent();
        double memory = memoryPercent();
        int processes = (int) ProcessHandle.allProcesses().count();
        return new ResourceSnapshot(cpu, memory, processes, true, Instant.now());
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getCpuLoad();
            if (load >= 0) {
                return load * 100.0;
            }
        }
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0.0;
        }
        return Math.min(100.0, loadAverage / os.getAvailableProcessors() * 100.0);
    }

    private double memoryPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean bean = (com.sun.management.OperatingSystemMXBean) os;
            long total = bean.getTotalMemorySize();
            if (total > 0) {
                return (total - bean.getFreeMemorySize()) * 100.0 / total;
            }
        }
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) * 100.0 / runtime.maxMemory();
    }
}
