package com.agentexec.engine.contract;

import com.agentexec.core.contract.AgentContract;
import com.agentexec.core.contract.StandardConditions;
import com.agentexec.core.model.TaskType;
import com.agentexec.core.model.VerificationMethod;
import com.agentexec.core.test.TimeController;
import com.agentexec.engine.json.JsonSupport;
import com.agentexec.engine.persistence.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractRegistryTest {

    private TimeController clock;
    private InMemoryDocumentStore store;
    private ContractRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryDocumentStore();
        registry = new ContractRegistry(store, JsonSupport.objectMapper(), clock);
    }

    private static AgentContract contract(String id, String name, TaskType type, String... tags) {
        AgentContract.Builder builder = AgentContract.builder()
            .id(id)
            .name(name)
            .taskType(type)
            .precondition(StandardConditions.hasInput("prompt"));
        for (String tag : tags) {
            builder.tag(tag);
        }
        return builder.build();
    }

    // ========== Registration ==========

    @Test
    void reRegisteringBumpsVersionAndKeepsRegistrationTime() {
        ContractMetadata first = registry.register(contract("c1", "First", TaskType.FIX_BUG));
        clock.advance(Duration.ofMinutes(5));
        ContractMetadata second = registry.register(contract("c1", "Second", TaskType.FIX_BUG));

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
        assertThat(second.registeredAt()).isEqualTo(first.registeredAt());
        assertThat(second.updatedAt()).isEqualTo(Instant.parse("2024-03-01T10:05:00Z"));
        assertThat(registry.get("c1")).get().extracting(AgentContract::getName).isEqualTo("Second");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> registry.register(contract(" ", "Blank", TaskType.TEST)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registrationWritesDescriptorDocument() {
        registry.register(contract("c1", "Fix", TaskType.FIX_BUG, "backend"));

        JsonNode doc = store.get("contracts/c1").orElseThrow();

        assertThat(doc.get("taskType").asText()).isEqualTo("fix_bug");
        assertThat(doc.get("verificationMethod").asText()).isEqualTo("runtime");
        assertThat(doc.get("version").asInt()).isEqualTo(1);
        assertThat(doc.get("tags").get(0).asText()).isEqualTo("backend");
        assertThat(doc.get("preconditions").get(0).asText()).isEqualTo("pre-has-prompt");
    }

    @Test
    void unregisterRemovesContractAndDescriptor() {
        registry.register(contract("c1", "Fix", TaskType.FIX_BUG));

        assertThat(registry.unregister("c1")).isTrue();
        assertThat(registry.unregister("c1")).isFalse();
        assertThat(registry.has("c1")).isFalse();
        assertThat(store.get("contracts/c1")).isEmpty();
    }

    // ========== Lookups ==========

    @Test
    void findByTaskTypeIncludesCustomAndSkipsDisabled() {
        registry.register(contract("bug", "Bug", TaskType.FIX_BUG));
        registry.register(contract("any", "Any", TaskType.CUSTOM));
        registry.register(contract("deploy", "Deploy", TaskType.DEPLOY));
        registry.register(contract("off", "Off", TaskType.FIX_BUG));
        registry.disable("off");

        assertThat(registry.findByTaskType(TaskType.FIX_BUG))
            .extracting(AgentContract::getId)
            .containsExactly("any", "bug");
    }

    @Test
    void reRegisteringKeepsDisabledFlag() {
        registry.register(contract("c1", "One", TaskType.TEST));
        registry.disable("c1");
        registry.register(contract("c1", "One again", TaskType.TEST));

        assertThat(registry.getMetadata("c1")).get().extracting(ContractMetadata::enabled).isEqualTo(false);
        assertThat(store.get("contracts/c1").orElseThrow().get("enabled").asBoolean()).isFalse();
        assertThat(registry.enable("c1")).isTrue();
        assertThat(registry.enable("missing")).isFalse();
    }

    @Test
    void findByTagsMatchesAnyTag() {
        registry.register(contract("a", "A", TaskType.TEST, "backend"));
        registry.register(contract("b", "B", TaskType.TEST, "frontend", "ui"));
        registry.register(contract("c", "C", TaskType.TEST));

        assertThat(registry.findByTags(java.util.List.of("ui", "backend")))
            .extracting(AgentContract::getId)
            .containsExactly("a", "b");
    }

    @Test
    void querySortsAndLimits() {
        registry.register(contract("a", "Zeta", TaskType.REVIEW));
        clock.advance(Duration.ofSeconds(1));
        registry.register(contract("b", "Alpha", TaskType.REVIEW));
        clock.advance(Duration.ofSeconds(1));
        registry.register(contract("c", "Mid", TaskType.REVIEW));
        registry.register(contract("c", "Mid", TaskType.REVIEW));
        registry.disable("a");

        assertThat(registry.query(ContractQuery.builder().sortBy(ContractQuery.SortField.NAME).build()))
            .extracting(AgentContract::getId)
            .containsExactly("b", "c");
        assertThat(registry.query(ContractQuery.builder()
                .includeDisabled(true)
                .sortBy(ContractQuery.SortField.REGISTERED_AT)
                .descending(true)
                .limit(2)
                .build()))
            .extracting(AgentContract::getId)
            .containsExactly("c", "b");
        assertThat(registry.query(ContractQuery.builder()
                .includeDisabled(true)
                .sortBy(ContractQuery.SortField.VERSION)
                .descending(true)
                .limit(1)
                .build()))
            .extracting(AgentContract::getId)
            .containsExactly("c");
    }

    @Test
    void statsCountByTypeAndMethod() {
        registry.register(contract("a", "A", TaskType.TEST));
        registry.register(contract("b", "B", TaskType.TEST));
        registry.register(AgentContract.builder().id("c").name("C").taskType(TaskType.DEPLOY)
            .verificationMethod(VerificationMethod.FORMAL).build());
        registry.disable("b");

        RegistryStats stats = registry.getStats();

        assertThat(stats.totalContracts()).isEqualTo(3);
        assertThat(stats.enabledContracts()).isEqualTo(2);
        assertThat(stats.disabledContracts()).isEqualTo(1);
        assertThat(stats.byTaskType()).containsEntry("test", 2).containsEntry("deploy", 1);
        assertThat(stats.byVerificationMethod()).containsEntry("runtime", 2).containsEntry("formal", 1);
    }

    @Test
    void clearEmptiesRegistryAndStore() {
        registry.register(contract("a", "A", TaskType.TEST));
        registry.register(contract("b", "B", TaskType.TEST));

        registry.clear();

        assertThat(registry.size()).isZero();
        assertThat(store.list("contracts/")).isEmpty();
    }
}
