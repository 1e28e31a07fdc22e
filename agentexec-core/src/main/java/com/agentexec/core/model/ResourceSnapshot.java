package com.agentexec.core.model;

import java.time.Instant;

/**
 * Point-in-time host resource reading produced by a metrics source.
 *
 * @param cpuPercent     CPU load in percent (0-100)
 * @param memoryPercent  memory in use in percent (0-100)
 * @param processCount   number of processes visible to the host
 * @param canSpawnHint   the source's own opinion on whether another agent fits
 * @param timestamp      when the sample was taken
 */
public record ResourceSnapshot(
    double cpuPercent,
    double memoryPercent,
    int processCount,
    boolean canSpawnHint,
    Instant timestamp
) {
    public static ResourceSnapshot of(double cpuPercent, double memoryPercent, int processCount) {
        return new ResourceSnapshot(cpuPercent, memoryPercent, processCount, true, Instant.now());
    }
}
