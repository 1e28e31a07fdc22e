package com.agentexec.engine.persistence;

import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.repository.DocumentSummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of DocumentStore.
 * For demonstration and testing purposes.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Stored> documents = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        Stored stored = documents.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.document().deepCopy());
    }

    @Override
    public void put(String key, JsonNode document) {
        documents.compute(key, (k, previous) -> previous == null
            ? stored(document)
            : new Stored(document.deepCopy(), previous.sequence(), previous.createdAt(), sizeOf(document)));
    }

    @Override
    public void create(String key, JsonNode document) {
        if (documents.putIfAbsent(key, stored(document)) != null) {
            throw new DuplicateCheckpointException(key);
        }
    }

    @Override
    public List<DocumentSummary> list(String prefix) {
        return documents.entrySet().stream()
            .filter(e -> e.getKey().startsWith(prefix))
            .sorted(Comparator.comparingLong(e -> e.getValue().sequence()))
            .map(e -> new DocumentSummary(e.getKey(), e.getValue().sizeBytes(), e.getValue().createdAt()))
            .toList();
    }

    @Override
    public boolean delete(String key) {
        return documents.remove(key) != null;
    }

    public int size() {
        return documents.size();
    }

    private Stored stored(JsonNode document) {
        return new Stored(document.deepCopy(), sequence.incrementAndGet(), clock.instant(), sizeOf(document));
    }

    private static long sizeOf(JsonNode document) {
        return document.toString().getBytes(StandardCharsets.UTF_8).length;
    }

    private record Stored(JsonNode document, long sequence, Instant createdAt, long sizeBytes) {
    }
}
