package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound request for one deliberation.
 *
 * <p>Not validated on construction. The orchestrator rejects an invalid request with a terminal
 * {@code error} event.
 *
 * <p>{@code participantIds} and {@code chairmanId} may be {@code null} on the wire, in which case
 * the orchestrator applies its configured defaults via {@link #withDefaults(List, String)}.
 */
public record DeliberationRequest(
    @JsonProperty("prompt") String prompt,
    @JsonProperty("participantIds") List<String> participantIds,
    @JsonProperty("chairmanId") String chairmanId
) {
    public static DeliberationRequest of(String prompt, List<String> participantIds, String chairmanId) {
        return new DeliberationRequest(prompt, participantIds, chairmanId);
    }

    /**
     * Returns a copy where a missing participant list or chairman is replaced by the defaults.
     */
    public DeliberationRequest withDefaults(List<String> defaultParticipants, String defaultChairman) {
        List<String> participants = participantIds == null || participantIds.isEmpty()
            ? defaultParticipants : participantIds;
        String chairman = chairmanId == null || chairmanId.isBlank() ? defaultChairman : chairmanId;
        return new DeliberationRequest(prompt, participants, chairman);
    }
}
