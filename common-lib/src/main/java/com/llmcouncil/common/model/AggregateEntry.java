package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the consensus ordering.
 *
 * <p>{@code averageRankPosition} is {@code null} when {@code votesCounted == 0}: a backend that
 * nobody ranked has no position, not a worst-case one.
 */
public record AggregateEntry(
    @JsonProperty("backendId") String backendId,
    @JsonProperty("averageRankPosition") Double averageRankPosition,
    @JsonProperty("votesCounted") int votesCounted,
    @JsonProperty("firstPlaceVotes") int firstPlaceVotes
) {
    public boolean hasVotes() {
        return votesCounted > 0;
    }
}
