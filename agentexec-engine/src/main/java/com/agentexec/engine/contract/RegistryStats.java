package com.agentexec.engine.contract;

import java.util.Map;

/**
 * Counts over the registered contracts, keyed by wire value of task type and verification method.
 */
public record RegistryStats(
    int totalContracts,
    int enabledContracts,
    int disabledContracts,
    Map<String, Integer> byTaskType,
    Map<String, Integer> byVerificationMethod
) {
}
