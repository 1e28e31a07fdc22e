package com.agentexec.engine.contract;

import com.agentexec.core.model.TaskType;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter, sort and limit for {@link ContractRegistry#query}.
 */
public record ContractQuery(
    TaskType taskType,
    List<String> tags,
    boolean includeDisabled,
    SortField sortBy,
    boolean descending,
    int limit
) {
    public enum SortField {
        ID,
        NAME,
        REGISTERED_AT,
        VERSION
    }

    public ContractQuery {
        tags = tags != null ? List.copyOf(tags) : List.of();
        sortBy = sortBy != null ? sortBy : SortField.ID;
    }

    public static ContractQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TaskType taskType;
        private final List<String> tags = new ArrayList<>();
        private boolean includeDisabled;
        private SortField sortBy = SortField.ID;
        private boolean descending;
        private int limit;

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder includeDisabled(boolean includeDisabled) {
            this.includeDisabled = includeDisabled;
            return this;
        }

        public Builder sortBy(SortField sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }

        /**
         * Maximum results; zero or negative means unlimited.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public ContractQuery build() {
            return new ContractQuery(taskType, tags, includeDisabled, sortBy, descending, limit);
        }
    }
}
