package com.llmcouncil.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.util.context.ContextView;

/**
 * Reactive tracing helper keyed by deliberation id.
 *
 * <p>Reactor Context is the single source of truth for the deliberation id inside a
 * deliberation pipeline. MDC is only written as a temporary bridge during a log statement,
 * never as a persistent ThreadLocal store, because per-participant calls hop threads.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withDeliberationId(events, deliberationId);
 * </pre>
 *
 * <p>Usage pattern inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getDeliberationId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String DELIBERATION_ID_KEY = "deliberationId";

    private TraceContextUtil() {}

    /**
     * Stores {@code deliberationId} in the Reactor Context of {@code flux}.
     *
     * <p>{@code contextWrite} propagates upstream during subscription, so call this at the
     * end of pipeline assembly.
     */
    public static <T> Flux<T> withDeliberationId(Flux<T> flux, String deliberationId) {
        return flux.contextWrite(ctx -> ctx.put(DELIBERATION_ID_KEY, deliberationId));
    }

    /**
     * Retrieves the deliberation id from the Reactor {@link ContextView}.
     * Returns {@code "unknown"} if not present, never {@code null}.
     */
    public static String getDeliberationId(ContextView ctx) {
        return ctx.getOrDefault(DELIBERATION_ID_KEY, "unknown");
    }

    /**
     * Temporarily bridges {@code deliberationId} into MDC for the duration of
     * {@code logAction}, then removes the MDC entry. Only use this inside logging
     * side-effects.
     *
     * @param deliberationId the id to bridge into MDC
     * @param logAction      the log statement to execute with MDC populated
     */
    public static void withMdc(String deliberationId, Runnable logAction) {
        MDC.put(DELIBERATION_ID_KEY, deliberationId);
        try {
            logAction.run();
        } finally {
            MDC.remove(DELIBERATION_ID_KEY);
        }
    }
}
