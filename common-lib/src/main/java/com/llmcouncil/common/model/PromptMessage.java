package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of an assembled prompt payload, in chat-completions shape.
 */
public record PromptMessage(
    @JsonProperty("role") String role,        // system / user / assistant
    @JsonProperty("content") String content
) {
    public static PromptMessage system(String content) {
        return new PromptMessage("system", content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage("user", content);
    }
}
