package com.agentexec.core.contract;

/**
 * Whether a failing condition blocks the task or is only reported.
 */
public enum ConditionSeverity {
    ERROR,
    WARNING
}
