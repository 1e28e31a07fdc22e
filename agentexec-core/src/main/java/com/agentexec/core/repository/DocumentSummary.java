package com.agentexec.core.repository;

import java.time.Instant;

/**
 * Listing entry for a stored document.
 */
public record DocumentSummary(String key, long sizeBytes, Instant createdAt) {
}
