package com.agentexec.api.config;

import com.agentexec.core.spi.PromptExecutor;
import com.agentexec.core.spi.PromptResponse;
import com.agentexec.core.spi.RoleConfig;

/**
 * Placeholder used until the host application declares a {@code @Primary} {@link PromptExecutor} bean.
 * Every call fails, so waves report the role or task as failed instead of hanging.
 */
class UnconfiguredPromptExecutor implements PromptExecutor {

    static final String MESSAGE = "No prompt executor configured";

    @Override
    public PromptResponse execute(String prompt, RoleConfig config) {
        throw new IllegalStateException(MESSAGE + " (role " + config.role() + ")");
    }
}
