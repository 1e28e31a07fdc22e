package com.agentexec.core.model;

/**
 * Notifications published by the engine for subscribers outside the core.
 */
public enum ExecutionEventType {
    // Agent admission
    AGENT_REGISTERED,
    AGENT_UNREGISTERED,
    ADMISSION_DENIED,

    // State machine
    STATE_CHANGED,
    TRANSITION_FAILED,

    // Checkpoints and sessions
    CHECKPOINT_CREATED,
    SESSION_STARTED,
    SESSION_RESUMED,
    SESSION_ABANDONED,

    // Waves
    WAVE_STARTED,
    WAVE_COMPLETED,
    ROLE_FAILED
}
