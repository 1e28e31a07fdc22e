package com.agentexec.engine.coordinator;

import java.time.Duration;

/**
 * How long a wave task waits for an agent slot: up to {@code maxAttempts} tries, {@code backoff} apart.
 */
public record AdmissionPolicy(int maxAttempts, Duration backoff) {

    public AdmissionPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be non-negative");
        }
    }

    public static AdmissionPolicy defaults() {
        return new AdmissionPolicy(10, Duration.ofMillis(100));
    }
}
