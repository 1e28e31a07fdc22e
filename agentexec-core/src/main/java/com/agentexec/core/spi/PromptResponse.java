package com.agentexec.core.spi;

import java.util.Map;

/**
 * Provider response: text content plus pass-through usage and provider metadata.
 */
public record PromptResponse(String content, Map<String, Object> usage, Map<String, Object> providerMetadata) {

    public static PromptResponse of(String content) {
        return new PromptResponse(content, Map.of(), Map.of());
    }
}
