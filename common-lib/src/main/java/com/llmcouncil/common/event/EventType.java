package com.llmcouncil.common.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wire names of the deliberation progress events, in protocol order.
 */
public enum EventType {
    STAGE1_START("stage1_start"),
    STAGE1_COMPLETE("stage1_complete"),
    STAGE2_START("stage2_start"),
    STAGE2_COMPLETE("stage2_complete"),
    STAGE3_START("stage3_start"),
    STAGE3_TOKEN("stage3_token"),
    STAGE3_COMPLETE("stage3_complete"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** {@code complete} and {@code error} end the sequence. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
