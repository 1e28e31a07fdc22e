package com.agentexec.engine.coordinator;

/**
 * @param waveSize        tasks per wave; {@code null} uses the resource manager's concurrency limit
 * @param continueOnError keep running later waves after a wave with failures
 */
public record WaveOptions(Integer waveSize, boolean continueOnError) {

    public static WaveOptions defaults() {
        return new WaveOptions(null, false);
    }
}
