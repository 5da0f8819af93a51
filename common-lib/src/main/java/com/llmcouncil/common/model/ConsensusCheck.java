package com.llmcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the first-place agreement check over the parsed rankings.
 *
 * @param reached   true when one backend's share of first-place votes meets the threshold
 * @param backendId backend with the most first-place votes, {@code null} when nobody voted
 * @param share     that backend's share of first-place votes in [0.0, 1.0]
 */
public record ConsensusCheck(
    @JsonProperty("reached") boolean reached,
    @JsonProperty("backendId") String backendId,
    @JsonProperty("share") double share
) {
    public static ConsensusCheck none() {
        return new ConsensusCheck(false, null, 0.0);
    }
}
