package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Everything one deliberation produced. Owned by the caller once returned.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code responses}    every Stage 1 response in participant order, failures included</li>
 *   <li>{@code evaluations}  every Stage 2 evaluation in participant order</li>
 *   <li>{@code labelMap}     label to backend id, for de-anonymized display only</li>
 *   <li>{@code aggregate}    consensus ordering, best first</li>
 *   <li>{@code rankingDataAvailable} false when no evaluator produced a parsable ranking</li>
 * </ul>
 */
public record DeliberationResult(
    @JsonProperty("deliberationId") String deliberationId,
    @JsonProperty("prompt") String prompt,
    @JsonProperty("responses") List<ModelResponse> responses,
    @JsonProperty("evaluations") List<Evaluation> evaluations,
    @JsonProperty("labelMap") Map<String, String> labelMap,
    @JsonProperty("aggregate") List<AggregateEntry> aggregate,
    @JsonProperty("rankingDataAvailable") boolean rankingDataAvailable,
    @JsonProperty("consensus") ConsensusCheck consensus,
    @JsonProperty("synthesis") SynthesisResult synthesis
) {
    /** Backend ids whose Stage 1 call failed, in participant order. */
    @JsonProperty("failedParticipants")
    public List<String> failedParticipants() {
        return responses.stream()
            .filter(r -> !r.isUsable())
            .map(ModelResponse::backendId)
            .toList();
    }

    @JsonIgnore
    public boolean hasFailures() {
        return !failedParticipants().isEmpty();
    }
}
