package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One backend's answer to one request. Produced once per participant per stage.
 *
 * <p>{@code failed=true} always comes with {@code content=null}; {@code failureReason} is
 * diagnostic only and never shown to another backend.
 */
public record ModelResponse(
    @JsonProperty("backendId") String backendId,
    @JsonProperty("content") String content,
    @JsonProperty("reasoningDetail") String reasoningDetail,
    @JsonProperty("failed") boolean failed,
    @JsonProperty("failureReason") String failureReason
) {
    public static ModelResponse success(String backendId, String content, String reasoningDetail) {
        return new ModelResponse(backendId, content, reasoningDetail, false, null);
    }

    public static ModelResponse failure(String backendId, String reason) {
        return new ModelResponse(backendId, null, null, true, reason);
    }

    /** True when this response can be anonymized and shown to evaluators. */
    @JsonIgnore
    public boolean isUsable() {
        return !failed && content != null && !content.isBlank();
    }
}
