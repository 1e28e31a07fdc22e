package com.agentexec.engine.persistence.jdbc;

import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.repository.DocumentStore;
import com.agentexec.core.repository.DocumentSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of DocumentStore.
 *
 * Documents live in a single {@code documents} table as jsonb. Creation relies on the
 * primary key, so a second create for the same key inserts nothing and is reported as a
 * duplicate. Listing is ordered by an insertion sequence.
 */
@Repository("jdbcDocumentStore")
public class JdbcDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDocumentStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcDocumentStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        String sql = "SELECT body FROM documents WHERE doc_key = ?";
        try {
            List<String> rows = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("body"), key);
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(rows.get(0)));
        } catch (JsonProcessingException | DataAccessException e) {
            throw new StorageException("Failed to read document " + key, e);
        }
    }

    @Override
    @Transactional
    public void put(String key, JsonNode document) {
        String sql = """
            INSERT INTO documents (doc_key, body, size_bytes, created_at, updated_at)
            VALUES (?, ?::jsonb, ?, now(), now())
            ON CONFLICT (doc_key) DO UPDATE
            SET body = EXCLUDED.body, size_bytes = EXCLUDED.size_bytes, updated_at = now()
            """;
        String json = serialize(key, document);
        try {
            jdbcTemplate.update(sql, key, json, sizeOf(json));
            log.debug("Stored document {}", key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write document " + key, e);
        }
    }

    @Override
    @Transactional
    public void create(String key, JsonNode document) {
        String sql = """
            INSERT INTO documents (doc_key, body, size_bytes, created_at, updated_at)
            VALUES (?, ?::jsonb, ?, now(), now())
            ON CONFLICT (doc_key) DO NOTHING
            """;
        String json = serialize(key, document);
        int rows;
        try {
            rows = jdbcTemplate.update(sql, key, json, sizeOf(json));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to create document " + key, e);
        }
        if (rows == 0) {
            throw new DuplicateCheckpointException(key);
        }
        log.debug("Created document {}", key);
    }

    @Override
    public List<DocumentSummary> list(String prefix) {
        String sql = """
            SELECT doc_key, size_bytes, created_at FROM documents
            WHERE doc_key LIKE ? ESCAPE '\\'
            ORDER BY seq ASC
            """;
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> new DocumentSummary(
                rs.getString("doc_key"),
                rs.getLong("size_bytes"),
                rs.getTimestamp("created_at").toInstant()
            ), escapeLike(prefix) + "%");
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list documents under " + prefix, e);
        }
    }

    @Override
    @Transactional
    public boolean delete(String key) {
        try {
            return jdbcTemplate.update("DELETE FROM documents WHERE doc_key = ?", key) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete document " + key, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Document store unavailable: {}", e.getMessage());
            return false;
        }
    }

    private String serialize(String key, JsonNode document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize document " + key, e);
        }
    }

    private static long sizeOf(String json) {
        return json.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
