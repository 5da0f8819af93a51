package com.llmcouncil.common.exception;

/**
 * Classification of deliberation-level failures surfaced in the terminal {@code error} event.
 *
 * <p>Per-backend failures and ranking parse degradation are never represented here; they are
 * recovered locally and only show up as failed responses or missing votes.
 */
public enum ErrorKind {
    /** Request rejected before Stage 1 (empty participants, chairman not a participant, …). */
    CONFIGURATION,
    /** Every participant failed in a stage that cannot proceed without contributions. */
    TOTAL_STAGE_FAILURE,
    /** The caller cancelled the deliberation while it was in flight. */
    CANCELLED,
    /** Anything unexpected. */
    INTERNAL
}
