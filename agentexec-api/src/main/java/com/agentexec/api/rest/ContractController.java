package com.agentexec.api.rest;

import com.agentexec.core.exception.NotFoundException;
import com.agentexec.core.model.TaskType;
import com.agentexec.engine.contract.ContractMetadata;
import com.agentexec.engine.contract.ContractQuery;
import com.agentexec.engine.contract.ContractRegistry;
import com.agentexec.engine.contract.RegistryStats;
import com.agentexec.engine.contract.ValidationOptions;
import com.agentexec.engine.contract.ValidationResult;
import com.agentexec.engine.service.ExecutionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over the contract registry. Contracts carry executable predicates,
 * so they are registered in code and only inspected and toggled here.
 */
@RestController
@RequestMapping("/api/v1/contracts")
public class ContractController {

    private final ContractRegistry registry;
    private final ExecutionService executionService;

    public ContractController(ContractRegistry registry, ExecutionService executionService) {
        this.registry = registry;
        this.executionService = executionService;
    }

    @GetMapping
    public ResponseEntity<List<ContractMetadata>> query(
            @RequestParam(required = false) String taskType,
            @RequestParam(required = false) List<String> tag,
            @RequestParam(defaultValue = "false") boolean includeDisabled,
            @RequestParam(required = false) ContractQuery.SortField sortBy,
            @RequestParam(defaultValue = "false") boolean descending,
            @RequestParam(required = false) Integer limit) {

        ContractQuery.Builder query = ContractQuery.builder()
            .includeDisabled(includeDisabled)
            .descending(descending);
        if (taskType != null) {
            TaskType type = TaskType.fromValue(taskType);
            if (type == null) {
                throw new IllegalArgumentException("Unknown task type: " + taskType);
            }
            query.taskType(type);
        }
        if (tag != null) {
            tag.forEach(query::tag);
        }
        if (sortBy != null) {
            query.sortBy(sortBy);
        }
        if (limit != null) {
            query.limit(limit);
        }

        List<ContractMetadata> results = registry.query(query.build()).stream()
            .map(contract -> requireMetadata(contract.getId()))
            .toList();
        return ResponseEntity.ok(results);
    }

    @GetMapping("/stats")
    public ResponseEntity<RegistryStats> getStats() {
        return ResponseEntity.ok(registry.getStats());
    }

    @GetMapping("/{contractId}")
    public ResponseEntity<ContractMetadata> getContract(@PathVariable String contractId) {
        return ResponseEntity.ok(requireMetadata(contractId));
    }

    /**
     * Run the static validator against a registered contract.
     */
    @PostMapping("/{contractId}/validate")
    public ResponseEntity<ValidationResult> validate(
            @PathVariable String contractId,
            @RequestBody(required = false) ValidateRequest request) {

        ValidateRequest options = request != null ? request : new ValidateRequest(null, null, null, null);
        ValidationOptions validationOptions = ValidationOptions.builder()
            .checkCompleteness(options.checkCompleteness() == null || options.checkCompleteness())
            .checkConsistency(options.checkConsistency() == null || options.checkConsistency())
            .minPreconditions(options.minPreconditions() != null ? options.minPreconditions() : 0)
            .minPostconditions(options.minPostconditions() != null ? options.minPostconditions() : 0)
            .registry(registry)
            .build();
        return ResponseEntity.ok(executionService.validate(contractId, validationOptions));
    }

    @PostMapping("/{contractId}/enable")
    public ResponseEntity<ContractMetadata> enable(@PathVariable String contractId) {
        if (!registry.enable(contractId)) {
            throw new NotFoundException("Contract", contractId);
        }
        return ResponseEntity.ok(requireMetadata(contractId));
    }

    @PostMapping("/{contractId}/disable")
    public ResponseEntity<ContractMetadata> disable(@PathVariable String contractId) {
        if (!registry.disable(contractId)) {
            throw new NotFoundException("Contract", contractId);
        }
        return ResponseEntity.ok(requireMetadata(contractId));
    }

    @DeleteMapping("/{contractId}")
    public ResponseEntity<Void> unregister(@PathVariable String contractId) {
        if (!registry.unregister(contractId)) {
            throw new NotFoundException("Contract", contractId);
        }
        return ResponseEntity.noContent().build();
    }

    private ContractMetadata requireMetadata(String contractId) {
        return registry.getMetadata(contractId)
            .orElseThrow(() -> new NotFoundException("Contract", contractId));
    }

    // ========== DTOs ==========

    public record ValidateRequest(
        Boolean checkCompleteness,
        Boolean checkConsistency,
        Integer minPreconditions,
        Integer minPostconditions
    ) {}
}
