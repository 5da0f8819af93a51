package com.llmcouncil.orchestrator.config;

import java.time.Duration;
import java.util.List;

/**
 * Immutable engine settings resolved from {@code application.yml}.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code members}            default participant list when a request names none</li>
 *   <li>{@code chairman}           default chairman when a request names none</li>
 *   <li>{@code callTimeout}        bound on each backend call (for streams: between chunks)</li>
 *   <li>{@code maxConcurrency}     max in-flight backend calls per stage</li>
 *   <li>{@code streamChairman}     use the token-streaming chairman variant</li>
 *   <li>{@code consensusThreshold} first-place share that counts as consensus</li>
 * </ul>
 */
public record CouncilSettings(
    List<String> members,
    String chairman,
    Duration callTimeout,
    int maxConcurrency,
    boolean streamChairman,
    double consensusThreshold
) {
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_MAX_CONCURRENCY = 8;

    public CouncilSettings {
        members = members == null ? List.of() : members.stream()
            .map(String::trim)
            .filter(m -> !m.isEmpty())
            .toList();
        callTimeout = callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()
            ? DEFAULT_CALL_TIMEOUT : callTimeout;
        maxConcurrency = maxConcurrency <= 0 ? DEFAULT_MAX_CONCURRENCY : maxConcurrency;
    }
}
