package com.llmcouncil.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcouncil.common.exception.BackendCallException;
import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link BackendClient} backed by the OpenRouter chat-completions API.
 *
 * <p><strong>Wire format</strong>: {@code POST /chat/completions} with {@code {model, messages}}.
 * The answer is read from {@code choices[0].message.content}; {@code reasoning_details}, when
 * present, is kept verbatim as JSON text. With {@code stream=true} the provider answers with
 * Server-Sent Events whose {@code data} frames carry {@code choices[0].delta.content} and end
 * with {@code [DONE]}; comment frames (keep-alives) carry no data and are skipped.
 *
 * <p><strong>Failure contract</strong>: {@link #generate} never errors. Every failure is
 * logged once at WARN and returned as a failed {@link ModelResponse}.
 */
@Component
public class OpenRouterBackendClient implements BackendClient {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterBackendClient.class);

    static final String COMPLETIONS_PATH = "/chat/completions";
    static final String DONE_SENTINEL = "[DONE]";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient openRouterClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenRouterBackendClient(WebClient openRouterClient,
                                   ObjectMapper objectMapper,
                                   @Value("${openrouter.api-key:}") String apiKey) {
        this.openRouterClient = openRouterClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public Mono<ModelResponse> generate(String backendId, List<PromptMessage> messages) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[OpenRouter] No API key configured. backend={} marked failed", backendId);
            return Mono.just(ModelResponse.failure(backendId, "No OpenRouter API key configured"));
        }

        return Mono.fromCallable(() -> writeBody(backendId, messages, false))
            .flatMap(bodyJson ->
                openRouterClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .switchIfEmpty(Mono.error(() -> new BackendCallException(backendId, "Empty response body")))
            .map(body -> parseCompletion(backendId, body))
            .doOnSuccess(r -> log.debug("[OpenRouter] backend={} answered. chars={}",
                                        backendId, r.content().length()))
            .onErrorResume(e -> {
                String reason = describe(e);
                log.warn("[OpenRouter] backend={} failed. reason={}", backendId, reason);
                return Mono.just(ModelResponse.failure(backendId, reason));
            });
    }

    @Override
    public Flux<String> generateStreaming(String backendId, List<PromptMessage> messages) {
        if (apiKey == null || apiKey.isBlank()) {
            return Flux.error(new BackendCallException(backendId, "No OpenRouter API key configured"));
        }

        return Mono.fromCallable(() -> writeBody(backendId, messages, true))
            .flatMapMany(bodyJson ->
                openRouterClient.post()
                    .uri(COMPLETIONS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE))
            .filter(event -> event.data() != null)
            .map(event -> event.data().trim())
            .takeWhile(data -> !DONE_SENTINEL.equals(data))
            .map(data -> extractDelta(backendId, data))
            .filter(chunk -> !chunk.isEmpty())
            .onErrorMap(e -> !(e instanceof BackendCallException),
                        e -> new BackendCallException(backendId, describe(e), e));
    }

    // ── wire format ──────────────────────────────────────────────────────────

    String writeBody(String backendId, List<PromptMessage> messages, boolean stream)
            throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", backendId);
        body.put("messages", messages);
        if (stream) {
            body.put("stream", true);
        }
        return objectMapper.writeValueAsString(body);
    }

    ModelResponse parseCompletion(String backendId, String body) {
        JsonNode root = readTree(backendId, body);
        failOnProviderError(backendId, root);
        JsonNode message = root.path("choices").path(0).path("message");
        JsonNode content = message.path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new BackendCallException(backendId, "Malformed response: no choices[0].message.content");
        }
        JsonNode reasoning = message.path("reasoning_details");
        String reasoningDetail = reasoning.isMissingNode() || reasoning.isNull() ? null : reasoning.toString();
        return ModelResponse.success(backendId, content.asText(), reasoningDetail);
    }

    String extractDelta(String backendId, String data) {
        JsonNode root = readTree(backendId, data);
        failOnProviderError(backendId, root);
        JsonNode delta = root.path("choices").path(0).path("delta").path("content");
        return delta.isTextual() ? delta.asText() : "";
    }

    private JsonNode readTree(String backendId, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BackendCallException(backendId, "Malformed response: not JSON", e);
        }
    }

    private void failOnProviderError(String backendId, JsonNode root) {
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new BackendCallException(backendId,
                "Provider error: " + error.path("message").asText(error.toString()));
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof WebClientResponseException http) {
            return "HTTP " + http.getStatusCode().value()
                + (http.getStatusCode().value() == 429 ? " (rate limited)" : "");
        }
        if (e instanceof TimeoutException) {
            return "Timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
