package com.agentexec.engine.persistence.jdbc;

import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.repository.DocumentSummary;
import com.agentexec.engine.json.JsonSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the document store against a real PostgreSQL. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcDocumentStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("agentexec_test")
        .withUsername("test")
        .withPassword("test");

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private JdbcTemplate jdbcTemplate;
    private JdbcDocumentStore store;

    @BeforeAll
    void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        store = new JdbcDocumentStore(jdbcTemplate, mapper);
    }

    @BeforeEach
    void cleanTable() {
        jdbcTemplate.update("DELETE FROM documents");
    }

    private ObjectNode doc(String value) {
        return mapper.createObjectNode().put("value", value);
    }

    @Test
    void putIsAnUpsert() {
        store.put("sessions/s1", doc("v1"));
        store.put("sessions/s1", doc("v2"));

        assertThat(store.get("sessions/s1").orElseThrow().get("value").asText()).isEqualTo("v2");
        assertThat(store.list("sessions/")).hasSize(1);
    }

    @Test
    @DisplayName("Second create of one key is rejected by the primary key")
    void createRejectsDuplicate() {
        store.create("checkpoints/s1/cp-1", doc("first"));

        assertThatThrownBy(() -> store.create("checkpoints/s1/cp-1", doc("second")))
            .isInstanceOf(DuplicateCheckpointException.class);
        assertThat(store.get("checkpoints/s1/cp-1").orElseThrow().get("value").asText()).isEqualTo("first");
    }

    @Test
    void listTreatsLikeWildcardsLiterally() {
        store.create("checkpoints/s_1/a", doc("1"));
        store.create("checkpoints/sX1/b", doc("2"));
        store.create("checkpoints/s_1/c", doc("3"));

        assertThat(store.list("checkpoints/s_1/"))
            .extracting(DocumentSummary::key)
            .containsExactly("checkpoints/s_1/a", "checkpoints/s_1/c");
    }

    @Test
    void deleteAndAvailability() {
        store.put("k", doc("a"));

        assertThat(store.delete("k")).isTrue();
        assertThat(store.get("k")).isEmpty();
        assertThat(store.isAvailable()).isTrue();
    }
}
