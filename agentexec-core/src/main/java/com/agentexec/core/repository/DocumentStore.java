package com.agentexec.core.repository;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Key-addressed store of JSON documents, used for checkpoints, sessions and contract descriptors.
 *
 * Keys are slash-separated paths such as {@code checkpoints/<sessionId>/<checkpointId>}.
 * Implementations must be safe for concurrent readers; {@link #create} must be atomic
 * so that two writers can never both succeed for the same key.
 */
public interface DocumentStore {

    /**
     * Read a document.
     *
     * @param key document key
     * @return the document, or empty if absent
     */
    Optional<JsonNode> get(String key);

    /**
     * Write a document, replacing any previous version.
     */
    void put(String key, JsonNode document);

    /**
     * Create a document. Fails if the key already exists.
     *
     * @throws com.agentexec.core.exception.DuplicateCheckpointException if the key exists
     */
    void create(String key, JsonNode document);

    /**
     * List documents whose key starts with the prefix, oldest first.
     */
    List<DocumentSummary> list(String prefix);

    /**
     * Delete a document.
     *
     * @return true if a document was removed
     */
    boolean delete(String key);

    /**
     * Check the store can be reached. Used by health reporting.
     */
    default boolean isAvailable() {
        return true;
    }
}
