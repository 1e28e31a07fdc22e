package com.agentexec.engine.contract;

import com.agentexec.core.contract.AgentContract;
import com.agentexec.core.contract.Condition;
import com.agentexec.core.model.TaskType;
import com.agentexec.core.model.VerificationMethod;
import com.agentexec.core.repository.DocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Contracts keyed by id, with versioning and task-type lookups.
 *
 * <p>Re-registering an id replaces the contract, bumps its version and keeps the original
 * registration time. When a {@link DocumentStore} is attached every registration also writes
 * a descriptor document under {@code contracts/<id>}; predicates are code and are not
 * persisted.</p>
 */
public class ContractRegistry {

    private static final Logger log = LoggerFactory.getLogger(ContractRegistry.class);

    static final String KEY_PREFIX = "contracts/";

    private final Map<String, Entry> contracts = new ConcurrentHashMap<>();
    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ContractRegistry() {
        this(null, null, Clock.systemUTC());
    }

    public ContractRegistry(DocumentStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Register or replace a contract.
     *
     * @return metadata of the stored version
     */
    public synchronized ContractMetadata register(AgentContract contract) {
        Objects.requireNonNull(contract, "contract");
        if (contract.getId() == null || contract.getId().isBlank()) {
            throw new IllegalArgumentException("Contract id is required");
        }
        Instant now = clock.instant();
        Entry existing = contracts.get(contract.getId());
        ContractMetadata metadata = new ContractMetadata(
            contract.getId(),
            contract.getName(),
            contract.getTaskType(),
            contract.getVerificationMethod(),
            existing != null ? existing.metadata().version() + 1 : 1,
            existing != null ? existing.metadata().registeredAt() : now,
            now,
            existing != null ? existing.metadata().enabled() : contract.isEnabled(),
            contract.getTags()
        );
        contracts.put(contract.getId(), new Entry(contract, metadata));
        persist(contract, metadata);

        log.info("Registered contract: id={}, version={}, taskType={}",
            contract.getId(), metadata.version(), contract.getTaskType());
        return metadata;
    }

    public synchronized boolean unregister(String contractId) {
        Entry removed = contracts.remove(contractId);
        if (removed == null) {
            return false;
        }
        if (store != null) {
            store.delete(KEY_PREFIX + contractId);
        }
        log.info("Unregistered contract: id={}", contractId);
        return true;
    }

    public Optional<AgentContract> get(String contractId) {
        Entry entry = contractId != null ? contracts.get(contractId) : null;
        return Optional.ofNullable(entry).map(Entry::contract);
    }

    public Optional<ContractMetadata> getMetadata(String contractId) {
        Entry entry = contractId != null ? contracts.get(contractId) : null;
        return Optional.ofNullable(entry).map(Entry::metadata);
    }

    public boolean has(String contractId) {
        return contractId != null && contracts.containsKey(contractId);
    }

    /**
     * Enabled contracts that apply to the task type. CUSTOM contracts apply to every type.
     */
    public List<AgentContract> findByTaskType(TaskType taskType) {
        return contracts.values().stream()
            .filter(e -> e.metadata().enabled())
            .filter(e -> e.contract().appliesTo(taskType))
            .sorted(Comparator.comparing(e -> e.metadata().contractId()))
            .map(Entry::contract)
            .toList();
    }

    /**
     * Enabled contracts carrying at least one of the tags.
     */
    public List<AgentContract> findByTags(List<String> tags) {
        return contracts.values().stream()
            .filter(e -> e.metadata().enabled())
            .filter(e -> matchesAnyTag(e.metadata(), tags))
            .sorted(Comparator.comparing(e -> e.metadata().contractId()))
            .map(Entry::contract)
            .toList();
    }

    public List<AgentContract> query(ContractQuery query) {
        Comparator<Entry> order = switch (query.sortBy()) {
            case ID -> Comparator.comparing(e -> e.metadata().contractId());
            case NAME -> Comparator.comparing(e -> nullToEmpty(e.metadata().name()));
            case REGISTERED_AT -> Comparator.comparing(e -> e.metadata().registeredAt());
            case VERSION -> Comparator.comparingInt(e -> e.metadata().version());
        };
        if (query.descending()) {
            order = order.reversed();
        }
        var stream = contracts.values().stream()
            .filter(e -> query.includeDisabled() || e.metadata().enabled())
            .filter(e -> query.taskType() == null || e.contract().appliesTo(query.taskType()))
            .filter(e -> query.tags().isEmpty() || matchesAnyTag(e.metadata(), query.tags()))
            .sorted(order)
            .map(Entry::contract);
        if (query.limit() > 0) {
            stream = stream.limit(query.limit());
        }
        return stream.toList();
    }

    public List<AgentContract> getAll() {
        return contracts.values().stream()
            .sorted(Comparator.comparing(e -> e.metadata().contractId()))
            .map(Entry::contract)
            .toList();
    }

    public RegistryStats getStats() {
        int enabled = 0;
        Map<String, Integer> byTaskType = new TreeMap<>();
        Map<String, Integer> byMethod = new TreeMap<>();
        for (Entry entry : contracts.values()) {
            ContractMetadata m = entry.metadata();
            if (m.enabled()) {
                enabled++;
            }
            byTaskType.merge(m.taskType() != null ? m.taskType().value() : "unknown", 1, Integer::sum);
            byMethod.merge(m.verificationMethod() != null ? m.verificationMethod().value() : "unknown", 1, Integer::sum);
        }
        int total = contracts.size();
        return new RegistryStats(total, enabled, total - enabled, byTaskType, byMethod);
    }

    public boolean enable(String contractId) {
        return setEnabled(contractId, true);
    }

    public boolean disable(String contractId) {
        return setEnabled(contractId, false);
    }

    public synchronized void clear() {
        if (store != null) {
            contracts.keySet().forEach(id -> store.delete(KEY_PREFIX + id));
        }
        contracts.clear();
    }

    public int size() {
        return contracts.size();
    }

    private synchronized boolean setEnabled(String contractId, boolean flag) {
        Entry entry = contracts.get(contractId);
        if (entry == null) {
            return false;
        }
        ContractMetadata updated = entry.metadata().withEnabled(flag, clock.instant());
        contracts.put(contractId, new Entry(entry.contract(), updated));
        persist(entry.contract(), updated);
        log.info("Contract {} {}", contractId, flag ? "enabled" : "disabled");
        return true;
    }

    private void persist(AgentContract contract, ContractMetadata metadata) {
        if (store == null) {
            return;
        }
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("id", metadata.contractId());
        doc.put("name", metadata.name());
        doc.put("taskType", metadata.taskType() != null ? metadata.taskType().value() : null);
        VerificationMethod method = metadata.verificationMethod();
        doc.put("verificationMethod", method != null ? method.value() : null);
        doc.put("description", contract.getDescription());
        doc.put("version", metadata.version());
        doc.put("enabled", metadata.enabled());
        doc.put("registeredAt", metadata.registeredAt().toString());
        doc.put("updatedAt", metadata.updatedAt().toString());
        ArrayNode tags = doc.putArray("tags");
        metadata.tags().forEach(tags::add);
        writeIds(doc.putArray("preconditions"), contract.getPreconditions());
        writeIds(doc.putArray("postconditions"), contract.getPostconditions());
        writeIds(doc.putArray("invariants"), contract.getInvariants());
        store.put(KEY_PREFIX + metadata.contractId(), doc);
    }

    private static void writeIds(ArrayNode target, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (condition != null) {
                target.add(condition.getId());
            }
        }
    }

    private static boolean matchesAnyTag(ContractMetadata metadata, List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return false;
        }
        List<String> own = new ArrayList<>(metadata.tags());
        return tags.stream().anyMatch(own::contains);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record Entry(AgentContract contract, ContractMetadata metadata) {
    }
}
