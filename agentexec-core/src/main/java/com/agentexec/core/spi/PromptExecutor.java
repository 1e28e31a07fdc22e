package com.agentexec.core.spi;

/**
 * Runs one prompt against whatever model provider the host application has configured.
 * Provider identity and cost are opaque to the engine and travel in {@link PromptResponse}.
 */
@FunctionalInterface
public interface PromptExecutor {

    /**
     * Execute a prompt.
     *
     * @param prompt prompt text
     * @param config role the prompt is executed for
     * @return the response
     * @throws RuntimeException if the provider call fails
     */
    PromptResponse execute(String prompt, RoleConfig config);
}
