package com.llmcouncil.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmcouncil.common.exception.ErrorKind;
import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.ConsensusCheck;
import com.llmcouncil.common.model.DeliberationResult;
import com.llmcouncil.common.model.Evaluation;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.SynthesisResult;

import java.util.List;
import java.util.Map;

/**
 * Typed progress event of one deliberation.
 *
 * <p>Per deliberation the events arrive in this relative order:
 * <pre>
 *   stage1_start, stage1_complete, stage2_start, stage2_complete,
 *   stage3_start, stage3_token*, stage3_complete, complete
 * </pre>
 * and exactly one of {@link Completed} or {@link Failed} ends the sequence. A {@link Failed}
 * event may follow any prefix of the list above, including the empty prefix.
 */
public interface DeliberationEvent {

    @JsonProperty("type")
    EventType type();

    @JsonIgnore
    default boolean isTerminal() {
        return type().isTerminal();
    }

    record Stage1Started(
        @JsonProperty("deliberationId") String deliberationId,
        @JsonProperty("participantIds") List<String> participantIds
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE1_START; }
    }

    /** Carries every participant's response, failed ones included, in participant order. */
    record Stage1Completed(
        @JsonProperty("responses") List<ModelResponse> responses
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE1_COMPLETE; }
    }

    /** Labels assigned at this point cover only the participants with usable answers. */
    record Stage2Started(
        @JsonProperty("labels") List<String> labels
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE2_START; }
    }

    record Stage2Completed(
        @JsonProperty("evaluations") List<Evaluation> evaluations,
        @JsonProperty("labelMap") Map<String, String> labelMap,
        @JsonProperty("aggregate") List<AggregateEntry> aggregate,
        @JsonProperty("rankingDataAvailable") boolean rankingDataAvailable,
        @JsonProperty("consensus") ConsensusCheck consensus
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE2_COMPLETE; }
    }

    record Stage3Started(
        @JsonProperty("chairmanId") String chairmanId
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE3_START; }
    }

    record Stage3Token(
        @JsonProperty("chunk") String chunk
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE3_TOKEN; }
    }

    record Stage3Completed(
        @JsonProperty("result") SynthesisResult result
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.STAGE3_COMPLETE; }
    }

    record Completed(
        @JsonProperty("result") DeliberationResult result
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.COMPLETE; }
    }

    record Failed(
        @JsonProperty("kind") ErrorKind kind,
        @JsonProperty("message") String message
    ) implements DeliberationEvent {
        @Override public EventType type() { return EventType.ERROR; }
    }
}
