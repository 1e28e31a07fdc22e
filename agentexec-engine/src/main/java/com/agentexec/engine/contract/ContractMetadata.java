package com.agentexec.engine.contract;

import com.agentexec.core.model.TaskType;
import com.agentexec.core.model.VerificationMethod;

import java.time.Instant;
import java.util.List;

/**
 * Registry bookkeeping for one contract.
 */
public record ContractMetadata(
    String contractId,
    String name,
    TaskType taskType,
    VerificationMethod verificationMethod,
    int version,
    Instant registeredAt,
    Instant updatedAt,
    boolean enabled,
    List<String> tags
) {
    public ContractMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    ContractMetadata withEnabled(boolean flag, Instant now) {
        return new ContractMetadata(contractId, name, taskType, verificationMethod, version,
            registeredAt, now, flag, tags);
    }
}
