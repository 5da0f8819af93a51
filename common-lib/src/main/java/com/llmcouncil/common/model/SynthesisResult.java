package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Chairman output. {@code complete=false} marks a synthesis that failed or was cut short; the
 * content then holds whatever partial text arrived, or a fixed error line.
 */
public record SynthesisResult(
    @JsonProperty("chairmanId") String chairmanId,
    @JsonProperty("content") String content,
    @JsonProperty("complete") boolean complete
) {
    public static final String FALLBACK_CONTENT = "Error: Unable to generate final synthesis.";

    public static SynthesisResult completed(String chairmanId, String content) {
        return new SynthesisResult(chairmanId, content, true);
    }

    public static SynthesisResult incomplete(String chairmanId, String partialContent) {
        String content = partialContent == null || partialContent.isBlank()
            ? FALLBACK_CONTENT : partialContent;
        return new SynthesisResult(chairmanId, content, false);
    }
}
