package com.llmcouncil.orchestrator.controller;

import com.llmcouncil.common.event.DeliberationEvent;
import com.llmcouncil.common.model.DeliberationRequest;
import com.llmcouncil.common.model.DeliberationResult;
import com.llmcouncil.orchestrator.config.CouncilSettings;
import com.llmcouncil.orchestrator.service.DeliberationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/council")
public class DeliberationController {

    private static final Logger log = LoggerFactory.getLogger(DeliberationController.class);

    private final DeliberationEngine deliberationEngine;
    private final CouncilSettings settings;

    public DeliberationController(DeliberationEngine deliberationEngine, CouncilSettings settings) {
        this.deliberationEngine = deliberationEngine;
        this.settings = settings;
    }

    @PostMapping("/deliberate")
    public Mono<ResponseEntity<DeliberationResult>> deliberate(@RequestBody DeliberationRequest request) {
        log.info("Deliberation requested. participants={} chairman={}",
                 request.participantIds(), request.chairmanId());
        return deliberationEngine.run(request).map(ResponseEntity::ok);
    }

    /**
     * Server-Sent Events view of the deliberation: {@code event} is the wire type name,
     * {@code data} the JSON payload. Closing the connection cancels the deliberation.
     */
    @PostMapping(value = "/deliberate/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<DeliberationEvent>> deliberateStream(@RequestBody DeliberationRequest request) {
        log.info("Streaming deliberation requested. participants={} chairman={}",
                 request.participantIds(), request.chairmanId());
        return deliberationEngine.deliberate(request)
            .map(event -> ServerSentEvent.<DeliberationEvent>builder(event)
                .event(event.type().wireName())
                .build());
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        return ResponseEntity.ok(Map.of(
            "members", settings.members(),
            "chairman", settings.chairman(),
            "streamChairman", settings.streamChairman()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
