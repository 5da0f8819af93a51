package com.llmcouncil.orchestrator.service;

import com.llmcouncil.common.anonymization.AnonymizedResponse;
import com.llmcouncil.common.anonymization.Anonymizer;
import com.llmcouncil.common.anonymization.LabelMap;
import com.llmcouncil.common.event.DeliberationEvent;
import com.llmcouncil.common.exception.ConfigurationException;
import com.llmcouncil.common.exception.CouncilException;
import com.llmcouncil.common.exception.ErrorKind;
import com.llmcouncil.common.exception.TotalStageFailureException;
import com.llmcouncil.common.model.AggregateEntry;
import com.llmcouncil.common.model.ConsensusCheck;
import com.llmcouncil.common.model.DeliberationRequest;
import com.llmcouncil.common.model.DeliberationResult;
import com.llmcouncil.common.model.Evaluation;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;
import com.llmcouncil.common.model.SynthesisResult;
import com.llmcouncil.common.ranking.AggregateRankingCalculator;
import com.llmcouncil.common.ranking.ConsensusDetector;
import com.llmcouncil.common.ranking.RankingParser;
import com.llmcouncil.common.trace.TraceContextUtil;
import com.llmcouncil.orchestrator.client.BackendClient;
import com.llmcouncil.orchestrator.config.CouncilSettings;
import com.llmcouncil.orchestrator.logger.DeliberationFlowLogger;
import com.llmcouncil.orchestrator.prompt.CouncilPromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Stage orchestrator for the three-stage council deliberation.
 *
 * <p>Pipeline per deliberation:
 * <ol>
 *   <li><b>Stage 1</b>: every participant answers the query concurrently. Full-barrier join:
 *       the stage ends when every call has settled, successfully or not.</li>
 *   <li><b>Stage 2</b>: usable answers are labelled in participant order, every participant
 *       ranks all of them concurrently, rankings are parsed and aggregated.</li>
 *   <li><b>Stage 3</b>: the chairman synthesizes a final answer from everything collected,
 *       streamed chunk by chunk when {@code council.stream-chairman} is on.</li>
 * </ol>
 *
 * <p><strong>Reactive contract</strong>: fully non-blocking. Fan-out uses
 * {@code flatMapSequential}, so each participant's result lands in its own slot in participant
 * order whatever the network completion order. Each call is bounded by the configured timeout
 * and a failed, timed-out or empty call degrades into a failed {@link ModelResponse}.
 *
 * <p><strong>Failure behaviour</strong>: configuration errors are rejected before any event is
 * emitted; if no participant answers in Stage 1 the deliberation fails; a Stage 2 without a
 * single parsable ranking continues to Stage 3 on Stage 1 content alone. Every failure path
 * ends in exactly one {@code error} event.
 *
 * <p>The engine keeps no state between deliberations; everything, including the
 * {@link LabelMap}, lives inside one pipeline assembly.
 */
@Service
public class DeliberationEngine {

    private static final Logger log = LoggerFactory.getLogger(DeliberationEngine.class);

    static final String STAGE1 = "stage1";
    static final String STAGE2 = "stage2";
    static final String STAGE3 = "stage3";

    private final BackendClient backendClient;
    private final CouncilSettings settings;
    private final DeliberationFlowLogger flowLogger;

    public DeliberationEngine(BackendClient backendClient,
                              CouncilSettings settings,
                              DeliberationFlowLogger flowLogger) {
        this.backendClient = backendClient;
        this.settings = settings;
        this.flowLogger = flowLogger;
    }

    /**
     * Prepares a deliberation. Nothing runs until {@link DeliberationHandle#events()} is
     * subscribed, which may happen once.
     */
    public DeliberationHandle start(DeliberationRequest request) {
        String deliberationId = UUID.randomUUID().toString();
        return new DeliberationHandle(deliberationId, handle ->
            TraceContextUtil.withDeliberationId(pipeline(deliberationId, request, handle), deliberationId));
    }

    /**
     * Event stream of a new deliberation. Every subscription starts its own deliberation with
     * a fresh id. Cancelling the subscription cancels every in-flight backend call; use
     * {@link #start} to also receive the {@code Cancelled} event.
     */
    public Flux<DeliberationEvent> deliberate(DeliberationRequest request) {
        return Flux.defer(() -> start(request).events());
    }

    /**
     * Runs a deliberation to the end and returns only its result.
     *
     * @return the result, or an error carrying the {@link ErrorKind} of the terminal event
     */
    public Mono<DeliberationResult> run(DeliberationRequest request) {
        return deliberate(request)
            .filter(DeliberationEvent::isTerminal)
            .next()
            .flatMap(event -> {
                if (event instanceof DeliberationEvent.Completed completed) {
                    return Mono.just(completed.result());
                }
                DeliberationEvent.Failed failed = (DeliberationEvent.Failed) event;
                return Mono.error(failed.kind() == ErrorKind.CONFIGURATION
                    ? new ConfigurationException(failed.message())
                    : new CouncilException(failed.kind(), failed.message()));
            });
    }

    // ── pipeline ─────────────────────────────────────────────────────────────

    private Flux<DeliberationEvent> pipeline(String deliberationId,
                                             DeliberationRequest rawRequest,
                                             DeliberationHandle handle) {
        return Flux.defer(() -> {
            DeliberationRequest request = validate(rawRequest == null ? null
                : rawRequest.withDefaults(settings.members(), settings.chairman()));
            flowLogger.transition(DeliberationState.STAGE1_RUNNING, deliberationId);

            return Flux.<DeliberationEvent>concat(
                Mono.just(new DeliberationEvent.Stage1Started(deliberationId, request.participantIds())),
                runStage1(deliberationId, request)
                    .flatMapMany(responses -> afterStage1(deliberationId, request, responses, handle)));
        })
        .onErrorResume(e -> handle.terminal(failedEvent(deliberationId, e)));
    }

    private Flux<DeliberationEvent> afterStage1(String deliberationId,
                                                DeliberationRequest request,
                                                List<ModelResponse> responses,
                                                DeliberationHandle handle) {
        DeliberationEvent stage1Completed = new DeliberationEvent.Stage1Completed(responses);
        long usable = responses.stream().filter(ModelResponse::isUsable).count();
        if (usable == 0) {
            return Flux.concat(
                Mono.just(stage1Completed),
                Mono.error(new TotalStageFailureException(STAGE1,
                    "All " + responses.size() + " participants failed to respond")));
        }

        LabelMap labelMap = Anonymizer.buildLabelMap(responses);
        flowLogger.transition(DeliberationState.STAGE2_RUNNING, deliberationId);

        return Flux.<DeliberationEvent>concat(
            Mono.just(stage1Completed),
            Mono.just(new DeliberationEvent.Stage2Started(labelMap.labels())),
            runStage2(deliberationId, request, responses, labelMap)
                .flatMapMany(stage2 -> afterStage2(deliberationId, request, responses, stage2, handle)));
    }

    private Flux<DeliberationEvent> afterStage2(String deliberationId,
                                                DeliberationRequest request,
                                                List<ModelResponse> responses,
                                                Stage2Outcome stage2,
                                                DeliberationHandle handle) {
        flowLogger.transition(DeliberationState.STAGE3_RUNNING, deliberationId);
        String chairmanId = request.chairmanId();

        return Flux.<DeliberationEvent>concat(
            Mono.just(new DeliberationEvent.Stage2Completed(
                stage2.evaluations(), stage2.labelMap().asMap(), stage2.aggregate(),
                stage2.rankingDataAvailable(), stage2.consensus())),
            Mono.just(new DeliberationEvent.Stage3Started(chairmanId)),
            runStage3(deliberationId, request, responses, stage2, handle));
    }

    // ── stage 1 ──────────────────────────────────────────────────────────────

    private Mono<List<ModelResponse>> runStage1(String deliberationId, DeliberationRequest request) {
        List<PromptMessage> prompt = CouncilPromptBuilder.responsePrompt(request.prompt());
        return fanOut(request.participantIds(), id -> callBackend(STAGE1, id, prompt, deliberationId))
            .doOnEach(flowLogger.state(DeliberationState.STAGE1_DONE));
    }

    // ── stage 2 ──────────────────────────────────────────────────────────────

    private Mono<Stage2Outcome> runStage2(String deliberationId,
                                          DeliberationRequest request,
                                          List<ModelResponse> responses,
                                          LabelMap labelMap) {
        List<AnonymizedResponse> anonymized = Anonymizer.anonymize(responses, labelMap);
        List<PromptMessage> prompt = CouncilPromptBuilder.evaluationPrompt(request.prompt(), anonymized);

        return fanOut(request.participantIds(), id ->
                callBackend(STAGE2, id, prompt, deliberationId).map(r -> toEvaluation(r, labelMap)))
            .map(evaluations -> {
                List<AggregateEntry> aggregate = AggregateRankingCalculator.aggregate(evaluations, labelMap);
                boolean rankingData = AggregateRankingCalculator.hasRankingData(aggregate);
                ConsensusCheck consensus = ConsensusDetector.check(evaluations, labelMap,
                                                                   settings.consensusThreshold());
                flowLogger.aggregate(aggregate,
                    evaluations.stream().filter(Evaluation::hasRanking).count(), deliberationId);
                return new Stage2Outcome(evaluations, labelMap, aggregate, rankingData, consensus);
            })
            .doOnEach(flowLogger.state(DeliberationState.STAGE2_DONE));
    }

    private Evaluation toEvaluation(ModelResponse response, LabelMap labelMap) {
        if (!response.isUsable()) {
            return Evaluation.failed(response.backendId());
        }
        return new Evaluation(response.backendId(), response.content(),
                              RankingParser.parse(response.content(), labelMap), false);
    }

    // ── stage 3 ──────────────────────────────────────────────────────────────

    private Flux<DeliberationEvent> runStage3(String deliberationId,
                                              DeliberationRequest request,
                                              List<ModelResponse> responses,
                                              Stage2Outcome stage2,
                                              DeliberationHandle handle) {
        String chairmanId = request.chairmanId();
        List<PromptMessage> prompt = CouncilPromptBuilder.chairmanPrompt(
            request.prompt(), responses, stage2.labelMap(), stage2.evaluations(),
            stage2.aggregate(), stage2.rankingDataAvailable());

        return Flux.defer(() -> {
            StringBuilder buffer = new StringBuilder();
            AtomicBoolean streamFailed = new AtomicBoolean(false);

            Flux<DeliberationEvent> tokens;
            Mono<SynthesisResult> synthesis;
            if (settings.streamChairman()) {
                tokens = Flux.defer(() -> backendClient.generateStreaming(chairmanId, prompt))
                    .timeout(settings.callTimeout())
                    .doOnNext(buffer::append)
                    .<DeliberationEvent>map(DeliberationEvent.Stage3Token::new)
                    .onErrorResume(e -> {
                        streamFailed.set(true);
                        log.warn("Chairman stream failed. chairman={} receivedChars={} reason={} deliberationId={}",
                                 chairmanId, buffer.length(), describe(e), deliberationId);
                        return Flux.empty();
                    });
                synthesis = Mono.fromSupplier(() -> streamFailed.get() || buffer.length() == 0
                    ? SynthesisResult.incomplete(chairmanId, buffer.toString())
                    : SynthesisResult.completed(chairmanId, buffer.toString()));
            } else {
                tokens = Flux.empty();
                synthesis = callBackend(STAGE3, chairmanId, prompt, deliberationId)
                    .map(r -> r.isUsable()
                        ? SynthesisResult.completed(chairmanId, r.content())
                        : SynthesisResult.incomplete(chairmanId, null));
            }

            return Flux.concat(
                tokens,
                synthesis.flatMapMany(result -> {
                    DeliberationResult deliberationResult = new DeliberationResult(
                        deliberationId, request.prompt(), responses, stage2.evaluations(),
                        stage2.labelMap().asMap(), stage2.aggregate(), stage2.rankingDataAvailable(),
                        stage2.consensus(), result);
                    return Flux.<DeliberationEvent>concat(
                        Mono.just(new DeliberationEvent.Stage3Completed(result)),
                        handle.terminal(new DeliberationEvent.Completed(deliberationResult))
                            .doOnNext(e -> flowLogger.transition(DeliberationState.COMPLETE, deliberationId)));
                }));
        });
    }

    // ── fan-out / single call ────────────────────────────────────────────────

    private <T> Mono<List<T>> fanOut(List<String> backendIds, Function<String, Mono<T>> call) {
        return Flux.fromIterable(backendIds)
            .flatMapSequential(call, settings.maxConcurrency())
            .collectList();
    }

    private Mono<ModelResponse> callBackend(String stage, String backendId,
                                            List<PromptMessage> prompt, String deliberationId) {
        return Mono.defer(() -> backendClient.generate(backendId, prompt))
            .timeout(settings.callTimeout())
            .switchIfEmpty(Mono.fromSupplier(() -> ModelResponse.failure(backendId, "Empty response")))
            .onErrorResume(e -> Mono.just(ModelResponse.failure(backendId, describe(e))))
            .doOnNext(r -> flowLogger.backendOutcome(stage, r, deliberationId));
    }

    // ── validation / errors ──────────────────────────────────────────────────

    static DeliberationRequest validate(DeliberationRequest request) {
        if (request == null) {
            throw new ConfigurationException("Request must not be null");
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new ConfigurationException("Prompt must not be blank");
        }
        List<String> participants = request.participantIds();
        if (participants == null || participants.isEmpty()) {
            throw new ConfigurationException("At least one participant is required");
        }
        Set<String> seen = new HashSet<>();
        for (String id : participants) {
            if (id == null || id.isBlank()) {
                throw new ConfigurationException("Participant ids must not be blank");
            }
            if (!seen.add(id)) {
                throw new ConfigurationException("Duplicate participant id: " + id);
            }
        }
        if (request.chairmanId() == null || !seen.contains(request.chairmanId())) {
            throw new ConfigurationException("Chairman " + request.chairmanId() + " is not a participant");
        }
        return request;
    }

    private DeliberationEvent failedEvent(String deliberationId, Throwable e) {
        ErrorKind kind = e instanceof CouncilException ce ? ce.getKind() : ErrorKind.INTERNAL;
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (kind == ErrorKind.INTERNAL) {
            log.error("Deliberation failed unexpectedly. deliberationId={}", deliberationId, e);
        }
        flowLogger.failed(deliberationId, kind.name(), message);
        return new DeliberationEvent.Failed(kind, message);
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "Timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record Stage2Outcome(
        List<Evaluation> evaluations,
        LabelMap labelMap,
        List<AggregateEntry> aggregate,
        boolean rankingDataAvailable,
        ConsensusCheck consensus
    ) {}
}
