package com.agentexec.recovery.checkpoint;

import com.agentexec.core.exception.CheckpointCorruptException;
import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.model.Step;
import com.agentexec.core.model.StepCheckpoint;
import com.agentexec.core.model.StepCheckpointSummary;
import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.repository.DocumentSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Append-only, checksummed checkpoint storage on top of a {@link DocumentStore}.
 *
 * Layout:
 * <ul>
 *   <li>{@code checkpoints/<sessionId>/<checkpointId>} - the checkpoint document</li>
 *   <li>{@code checkpoint-index/<checkpointId>} - owning session, for lookup by id</li>
 * </ul>
 *
 * Both documents are written with {@link DocumentStore#create}, so a checkpoint id can never be
 * written twice. The checksum is a SHA-256 over the canonical JSON (object keys sorted) of the
 * step, prior steps and context.
 */
public class CheckpointRepository {

    private static final Logger log = LoggerFactory.getLogger(CheckpointRepository.class);

    static final String CHECKPOINT_PREFIX = "checkpoints/";
    static final String INDEX_PREFIX = "checkpoint-index/";

    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CheckpointRepository(DocumentStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Persist a new checkpoint.
     *
     * @param sessionId  owning session
     * @param waveNumber wave the session was in
     * @param step       step being checkpointed
     * @param priorSteps steps recorded before it
     * @param context    session context at checkpoint time
     * @param label      optional label
     * @return the stored checkpoint
     */
    public StepCheckpoint save(String sessionId, int waveNumber, Step step, List<Step> priorSteps,
                               Map<String, Object> context, String label) {
        Instant now = clock.instant();
        String id = "checkpoint-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
        List<Step> prior = priorSteps != null ? List.copyOf(priorSteps) : List.of();
        Map<String, Object> ctx = context != null ? context : Map.of();

        ObjectNode payload = payload(step, prior, ctx);
        String checksum = checksum(payload);
        long sizeBytes = canonicalBytes(payload).length;

        StepCheckpoint checkpoint = new StepCheckpoint(id, sessionId, waveNumber, step.taskId(), step.id(),
            step.sequence(), step, prior, ctx, checksum, now, label, sizeBytes);

        ObjectNode document = objectMapper.valueToTree(checkpoint);
        store.create(documentKey(sessionId, id), document);

        ObjectNode index = objectMapper.createObjectNode();
        index.put("sessionId", sessionId);
        store.create(INDEX_PREFIX + id, index);

        log.debug("Saved checkpoint {} for step {} ({} bytes)", id, step.id(), sizeBytes);
        return checkpoint;
    }

    /**
     * Load and verify a checkpoint.
     *
     * @throws NotFoundException          if no checkpoint has this id
     * @throws CheckpointCorruptException if the document cannot be decoded or fails its checksum
     */
    public StepCheckpoint load(String checkpointId) {
        String sessionId = store.get(INDEX_PREFIX + checkpointId)
            .map(node -> node.path("sessionId").asText(null))
            .orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        return loadDocument(checkpointId, documentKey(sessionId, checkpointId));
    }

    /**
     * List summaries for a session, oldest first. Corrupt checkpoints are listed with
     * {@code valid=false} rather than failing the listing.
     */
    public List<StepCheckpointSummary> list(String sessionId) {
        String prefix = CHECKPOINT_PREFIX + sessionId + "/";
        List<StepCheckpointSummary> summaries = new ArrayList<>();
        for (DocumentSummary doc : store.list(prefix)) {
            String checkpointId = doc.key().substring(prefix.length());
            try {
                summaries.add(loadDocument(checkpointId, doc.key()).toSummary());
            } catch (CheckpointCorruptException | NotFoundException e) {
                log.warn("Skipping unreadable checkpoint {}: {}", checkpointId, e.getMessage());
                summaries.add(StepCheckpointSummary.invalid(checkpointId, sessionId, e.getMessage()));
            }
        }
        summaries.sort(Comparator.comparing(StepCheckpointSummary::createdAt,
            Comparator.nullsLast(Comparator.naturalOrder())));
        return summaries;
    }

    /**
     * Delete a checkpoint and its index entry.
     *
     * @return true if the checkpoint document existed
     */
    public boolean delete(String sessionId, String checkpointId) {
        boolean removed = store.delete(documentKey(sessionId, checkpointId));
        store.delete(INDEX_PREFIX + checkpointId);
        return removed;
    }

    private StepCheckpoint loadDocument(String checkpointId, String key) {
        JsonNode document;
        try {
            document = store.get(key).orElseThrow(() -> new NotFoundException("Checkpoint", checkpointId));
        } catch (StorageException e) {
            throw new CheckpointCorruptException(checkpointId, "unreadable document: " + e.getMessage(), e);
        }

        String stored = document.path("checksum").asText(null);
        if (stored == null) {
            throw new CheckpointCorruptException(checkpointId, "missing checksum");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("step", document.path("step"));
        payload.set("priorSteps", document.path("priorSteps"));
        payload.set("context", document.path("context"));
        if (!stored.equals(checksum(payload))) {
            throw new CheckpointCorruptException(checkpointId, "checksum mismatch");
        }

        try {
            return objectMapper.treeToValue(document, StepCheckpoint.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CheckpointCorruptException(checkpointId, "unreadable document: " + e.getMessage(), e);
        }
    }

    private ObjectNode payload(Step step, List<Step> priorSteps, Map<String, Object> context) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("step", objectMapper.valueToTree(step));
        payload.set("priorSteps", objectMapper.valueToTree(priorSteps));
        payload.set("context", objectMapper.valueToTree(context));
        return payload;
    }

    String checksum(JsonNode payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalBytes(payload)));
        } catch (NoSuchAlgorithmException e) {
            throw new StorageException("SHA-256 not available", e);
        }
    }

    private byte[] canonicalBytes(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(canonical(payload)).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize checkpoint payload", e);
        }
    }

    /**
     * Copy of the tree with object fields in sorted order, so that stores which reorder keys
     * still produce the same checksum.
     */
    private JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = objectMapper.createObjectNode();
            TreeSet<String> names = new TreeSet<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, canonical(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(element -> array.add(canonical(element)));
            return array;
        }
        return node;
    }

    private static String documentKey(String sessionId, String checkpointId) {
        return CHECKPOINT_PREFIX + sessionId + "/" + checkpointId;
    }
}
