package com.llmcouncil.orchestrator.controller;

import com.llmcouncil.common.model.DeliberationRequest;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;
import com.llmcouncil.orchestrator.client.BackendClient;
import com.llmcouncil.orchestrator.config.CouncilSettings;
import com.llmcouncil.orchestrator.logger.DeliberationFlowLogger;
import com.llmcouncil.orchestrator.service.DeliberationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeliberationControllerTest {

    private static final List<String> MEMBERS = List.of("m1", "m2", "m3");

    /** Every call answers; rankings always put Response A first. */
    private static final BackendClient HEALTHY = new BackendClient() {
        @Override
        public Mono<ModelResponse> generate(String backendId, List<PromptMessage> messages) {
            String prompt = messages.get(0).content();
            String content = prompt.contains("FINAL RANKING:") && !prompt.startsWith("You are the Chairman")
                ? "FINAL RANKING:\n1. Response A\n2. Response B\n3. Response C"
                : "Answer from a council member.";
            return Mono.just(ModelResponse.success(backendId, content, null));
        }

        @Override
        public Flux<String> generateStreaming(String backendId, List<PromptMessage> messages) {
            return Flux.just("Final ", "answer.");
        }
    };

    private static final BackendClient BROKEN = new BackendClient() {
        @Override
        public Mono<ModelResponse> generate(String backendId, List<PromptMessage> messages) {
            return Mono.just(ModelResponse.failure(backendId, "HTTP 503"));
        }

        @Override
        public Flux<String> generateStreaming(String backendId, List<PromptMessage> messages) {
            return Flux.error(new IllegalStateException("unreachable"));
        }
    };

    private static WebTestClient client(BackendClient backendClient) {
        CouncilSettings settings = new CouncilSettings(MEMBERS, "m2", Duration.ofSeconds(5), 8, true, 0.8);
        DeliberationEngine engine = new DeliberationEngine(backendClient, settings, new DeliberationFlowLogger());
        return WebTestClient.bindToController(new DeliberationController(engine, settings))
            .controllerAdvice(new CouncilExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("POST /deliberate → 200 with the full result")
    void deliberate() {
        client(HEALTHY).post().uri("/api/v1/council/deliberate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(DeliberationRequest.of("Capital of France?", null, null))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.responses.length()").isEqualTo(3)
            .jsonPath("$.aggregate[0].backendId").isEqualTo("m1")
            .jsonPath("$.labelMap['Response A']").isEqualTo("m1")
            .jsonPath("$.consensus.reached").isEqualTo(true)
            .jsonPath("$.synthesis.content").isEqualTo("Final answer.")
            .jsonPath("$.synthesis.chairmanId").isEqualTo("m2")
            .jsonPath("$.failedParticipants.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("invalid request → 400 CONFIGURATION")
    void invalidRequest() {
        client(HEALTHY).post().uri("/api/v1/council/deliberate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(DeliberationRequest.of("Capital of France?", List.of("m1"), "m9"))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.kind").isEqualTo("CONFIGURATION");
    }

    @Test
    @DisplayName("every participant down → 502 TOTAL_STAGE_FAILURE")
    void totalFailure() {
        client(BROKEN).post().uri("/api/v1/council/deliberate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(DeliberationRequest.of("Capital of France?", null, null))
            .exchange()
            .expectStatus().isEqualTo(502)
            .expectBody()
            .jsonPath("$.kind").isEqualTo("TOTAL_STAGE_FAILURE");
    }

    @Test
    @DisplayName("POST /deliberate/stream → SSE named by event type, ending with complete")
    void stream() {
        List<ServerSentEvent<String>> events = client(HEALTHY).post().uri("/api/v1/council/deliberate/stream")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(DeliberationRequest.of("Capital of France?", null, null))
            .exchange()
            .expectStatus().isOk()
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(10));

        assertNotNull(events);
        assertEquals(List.of("stage1_start", "stage1_complete", "stage2_start", "stage2_complete",
                             "stage3_start", "stage3_token", "stage3_token", "stage3_complete", "complete"),
                     events.stream().map(ServerSentEvent::event).toList());
        assertTrue(events.get(5).data().contains("\"chunk\":\"Final \""));
        assertTrue(events.get(8).data().contains("\"type\":\"complete\""));
    }

    @Test
    @DisplayName("streamed failure arrives as an error event, not an HTTP error")
    void streamFailure() {
        List<ServerSentEvent<String>> events = client(HEALTHY).post().uri("/api/v1/council/deliberate/stream")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(DeliberationRequest.of(" ", null, null))
            .exchange()
            .expectStatus().isOk()
            .returnResult(new ParameterizedTypeReference<ServerSentEvent<String>>() {})
            .getResponseBody()
            .collectList()
            .block(Duration.ofSeconds(10));

        assertNotNull(events);
        assertEquals(1, events.size());
        assertEquals("error", events.get(0).event());
        assertTrue(events.get(0).data().contains("\"kind\":\"CONFIGURATION\""));
    }

    @Test
    @DisplayName("GET /config and /health")
    void configAndHealth() {
        WebTestClient client = client(HEALTHY);

        client.get().uri("/api/v1/council/config").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.members.length()").isEqualTo(3)
            .jsonPath("$.chairman").isEqualTo("m2");

        client.get().uri("/api/v1/council/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
