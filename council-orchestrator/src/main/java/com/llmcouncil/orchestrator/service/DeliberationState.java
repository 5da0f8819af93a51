package com.llmcouncil.orchestrator.service;

/**
 * Lifecycle of one deliberation.
 *
 * <pre>
 *   STAGE1_RUNNING → STAGE1_DONE → STAGE2_RUNNING → STAGE2_DONE → STAGE3_RUNNING → COMPLETE
 * </pre>
 * {@link #FAILED} is reachable from any non-terminal state through a configuration error, a
 * total stage failure or cancellation; never through one backend failing.
 */
public enum DeliberationState {
    STAGE1_RUNNING,
    STAGE1_DONE,
    STAGE2_RUNNING,
    STAGE2_DONE,
    STAGE3_RUNNING,
    COMPLETE,
    FAILED
}
