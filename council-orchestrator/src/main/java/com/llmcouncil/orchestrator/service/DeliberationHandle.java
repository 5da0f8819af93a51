package com.llmcouncil.orchestrator.service;

import com.llmcouncil.common.event.DeliberationEvent;
import com.llmcouncil.common.exception.DeliberationCancelledException;
import com.llmcouncil.common.exception.ErrorKind;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Caller-side handle on one in-flight deliberation.
 *
 * <p>{@link #events()} may be subscribed once; a second subscription fails with
 * {@link IllegalStateException} instead of re-running the backend calls under the same id.
 * {@link #cancel()} stops every running backend call and ends the stream with a single
 * {@code error} event of kind {@link ErrorKind#CANCELLED}; it is a no-op once a terminal event
 * has been emitted.
 *
 * <p>Exactly one terminal event: the pipeline and {@link #cancel()} race for a single
 * {@link Outcome} transition out of {@code RUNNING}, and only the winner's event is emitted.
 */
public final class DeliberationHandle {

    enum Outcome { RUNNING, COMPLETED, CANCELLED }

    private final String deliberationId;
    private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.RUNNING);
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private final Sinks.One<Boolean> cancelSignal = Sinks.one();
    private final Flux<DeliberationEvent> events;

    DeliberationHandle(String deliberationId,
                       Function<DeliberationHandle, Flux<DeliberationEvent>> pipeline) {
        this.deliberationId = deliberationId;
        Flux<DeliberationEvent> once = pipeline.apply(this)
            .takeUntilOther(cancelSignal.asMono())
            .concatWith(Mono.defer(() -> outcome.get() == Outcome.CANCELLED
                ? Mono.just(cancelledEvent())
                : Mono.empty()));
        this.events = Flux.defer(() -> subscribed.compareAndSet(false, true)
            ? once
            : Flux.error(new IllegalStateException(
                "Events of deliberation " + deliberationId + " were already subscribed")));
    }

    public String deliberationId() {
        return deliberationId;
    }

    public Flux<DeliberationEvent> events() {
        return events;
    }

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call cancelled the deliberation, {@code false} if it had
     *         already finished or been cancelled
     */
    public boolean cancel() {
        if (!outcome.compareAndSet(Outcome.RUNNING, Outcome.CANCELLED)) {
            return false;
        }
        cancelSignal.tryEmitValue(Boolean.TRUE);
        return true;
    }

    public boolean isCancelled() {
        return outcome.get() == Outcome.CANCELLED;
    }

    /**
     * Emits {@code terminal} unless the deliberation was already cancelled.
     */
    Mono<DeliberationEvent> terminal(DeliberationEvent terminal) {
        return Mono.defer(() -> outcome.compareAndSet(Outcome.RUNNING, Outcome.COMPLETED)
            ? Mono.just(terminal)
            : Mono.empty());
    }

    private DeliberationEvent cancelledEvent() {
        return new DeliberationEvent.Failed(ErrorKind.CANCELLED,
            new DeliberationCancelledException(deliberationId).getMessage());
    }
}
