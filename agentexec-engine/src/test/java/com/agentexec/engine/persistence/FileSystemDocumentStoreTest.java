package com.agentexec.engine.persistence;

import com.agentexec.core.exception.DuplicateCheckpointException;
import com.agentexec.core.exception.StorageException;
import com.agentexec.core.repository.DocumentSummary;
import com.agentexec.engine.json.JsonSupport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemDocumentStoreTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private FileSystemDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemDocumentStore(root, mapper);
    }

    private ObjectNode doc(String value) {
        return mapper.createObjectNode().put("value", value);
    }

    @Test
    void keysMapToNestedJsonFiles() {
        store.put("checkpoints/s1/cp-1", doc("a"));

        assertThat(root.resolve("checkpoints/s1/cp-1.json")).exists();
        assertThat(store.get("checkpoints/s1/cp-1").orElseThrow().get("value").asText()).isEqualTo("a");
        assertThat(store.get("checkpoints/s1/missing")).isEmpty();
    }

    @Test
    void putReplacesWithoutLeavingTempFiles() throws Exception {
        store.put("sessions/s1", doc("v1"));
        store.put("sessions/s1", doc("v2"));

        assertThat(store.get("sessions/s1").orElseThrow().get("value").asText()).isEqualTo("v2");
        try (var files = Files.list(root.resolve("sessions"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("s1.json");
        }
    }

    @Test
    void createFailsWhenFileExists() {
        store.create("checkpoints/s1/cp-1", doc("first"));

        assertThatThrownBy(() -> store.create("checkpoints/s1/cp-1", doc("second")))
            .isInstanceOf(DuplicateCheckpointException.class);
        assertThat(store.get("checkpoints/s1/cp-1").orElseThrow().get("value").asText()).isEqualTo("first");
    }

    @Test
    void createLeavesOnlyTheFinalFile() throws Exception {
        store.create("checkpoints/s1/cp-1", doc("first"));

        assertThatThrownBy(() -> store.create("checkpoints/s1/cp-1", doc("second")))
            .isInstanceOf(DuplicateCheckpointException.class);
        try (var files = Files.list(root.resolve("checkpoints/s1"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("cp-1.json");
        }
    }

    @Test
    @DisplayName("A truncated file is a storage error on read but still shows up in listings")
    void truncatedFileFailsToRead() throws Exception {
        store.create("checkpoints/s1/cp-1", doc("a value long enough to cut in half"));
        Path file = root.resolve("checkpoints/s1/cp-1.json");
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length / 2));

        assertThatThrownBy(() -> store.get("checkpoints/s1/cp-1"))
            .isInstanceOf(StorageException.class)
            .hasMessage("Failed to read document checkpoints/s1/cp-1");
        assertThat(store.list("checkpoints/s1/")).extracting(DocumentSummary::key)
            .containsExactly("checkpoints/s1/cp-1");
    }

    @Test
    void listReturnsKeysUnderPrefix() {
        store.create("checkpoints/s1/a", doc("1"));
        store.create("checkpoints/s1/b", doc("2"));
        store.create("checkpoints/s10/a", doc("3"));
        store.put("sessions/s1", doc("4"));

        assertThat(store.list("checkpoints/s1/"))
            .extracting(DocumentSummary::key)
            .containsExactlyInAnyOrder("checkpoints/s1/a", "checkpoints/s1/b");
        assertThat(store.list("checkpoints/s1/"))
            .allSatisfy(summary -> assertThat(summary.sizeBytes()).isPositive());
    }

    @Test
    void keysCannotEscapeRoot() {
        assertThatThrownBy(() -> store.put("../outside", doc("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteAndAvailability() {
        store.put("k", doc("a"));

        assertThat(store.delete("k")).isTrue();
        assertThat(store.delete("k")).isFalse();
        assertThat(store.isAvailable()).isTrue();
    }
}
