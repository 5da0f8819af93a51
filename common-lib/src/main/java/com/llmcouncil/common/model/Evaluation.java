package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One participant's Stage 2 critique plus the ranking extracted from it.
 *
 * <p>{@code parsedRanking} holds labels ("Response A", …) best first, possibly partial or empty.
 * A failed ranking call yields {@code failed=true}, {@code rawText=null} and an empty ranking.
 */
public record Evaluation(
    @JsonProperty("evaluatorBackendId") String evaluatorBackendId,
    @JsonProperty("rawText") String rawText,
    @JsonProperty("parsedRanking") List<String> parsedRanking,
    @JsonProperty("failed") boolean failed
) {
    public Evaluation {
        parsedRanking = parsedRanking == null ? List.of() : List.copyOf(parsedRanking);
    }

    public static Evaluation failed(String evaluatorBackendId) {
        return new Evaluation(evaluatorBackendId, null, List.of(), true);
    }

    /** True when this evaluation contributes at least one vote. */
    @JsonIgnore
    public boolean hasRanking() {
        return !parsedRanking.isEmpty();
    }
}
