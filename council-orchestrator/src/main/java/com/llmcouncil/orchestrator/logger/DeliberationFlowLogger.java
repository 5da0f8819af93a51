package com.llmcouncil.orchestrator.logger;

import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.trace.TraceContextUtil;
import com.llmcouncil.orchestrator.service.DeliberationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.List;
import java.util.function.Consumer;

/**
 * Observability component for the deliberation state machine.
 *
 * <p>Logs each state transition and per-backend outcome without touching pipeline behavior.
 * All methods are pure side-effects. The deliberation id is bridged into MDC only for the
 * duration of the log call.
 *
 * <p>Usage with {@code doOnEach} (reads the id from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.state(DeliberationState.STAGE1_DONE))
 * </pre>
 */
@Component
public class DeliberationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DeliberationFlowLogger.class);

    /**
     * Returns a {@code doOnEach} consumer that logs {@code state} on the first
     * {@code onNext}. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> state(DeliberationState state) {
        return signal -> {
            if (!signal.isOnNext()) return;
            transition(state, TraceContextUtil.getDeliberationId(signal.getContextView()));
        };
    }

    public void transition(DeliberationState state, String deliberationId) {
        TraceContextUtil.withMdc(deliberationId, () ->
            log.info("[DeliberationFlow] state={} deliberationId={}", state, deliberationId)
        );
    }

    public void failed(String deliberationId, String kind, String message) {
        TraceContextUtil.withMdc(deliberationId, () ->
            log.warn("[DeliberationFlow] state={} kind={} reason={} deliberationId={}",
                     DeliberationState.FAILED, kind, message, deliberationId)
        );
    }

    public void backendOutcome(String stage, ModelResponse response, String deliberationId) {
        TraceContextUtil.withMdc(deliberationId, () -> {
            if (response.isUsable()) {
                log.info("[DeliberationFlow] stage={} backend={} ok chars={} deliberationId={}",
                         stage, response.backendId(), response.content().length(), deliberationId);
            } else {
                log.warn("[DeliberationFlow] stage={} backend={} degraded reason={} deliberationId={}",
                         stage, response.backendId(), response.failureReason(), deliberationId);
            }
        });
    }

    /**
     * Compact summary of the aggregate ordering: backend, average position and vote count
     * for the leader, plus how many evaluations produced a usable ranking.
     */
    public void aggregate(List<AggregateEntry> aggregate, long rankedEvaluations, String deliberationId) {
        TraceContextUtil.withMdc(deliberationId, () -> {
            AggregateEntry leader = aggregate.isEmpty() ? null : aggregate.get(0);
            log.info("[DeliberationFlow] aggregate leader={} avgPosition={} votes={} rankedEvaluations={} deliberationId={}",
                     leader != null ? leader.backendId() : "N/A",
                     leader != null ? leader.averageRankPosition() : "N/A",
                     leader != null ? leader.votesCounted() : 0,
                     rankedEvaluations, deliberationId);
        });
    }
}
