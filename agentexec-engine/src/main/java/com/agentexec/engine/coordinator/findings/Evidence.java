package com.agentexec.engine.coordinator.findings;

/**
 * A claim a research role backs with a source.
 */
public record Evidence(String claim, String source, double confidence) {
}
