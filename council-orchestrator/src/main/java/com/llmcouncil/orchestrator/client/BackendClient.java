package com.llmcouncil.orchestrator.client;

import com.llmcouncil.common.model.ModelResponse;
import com.llmcouncil.common.model.PromptMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One text-generation request to one named backend.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>never signal an error from {@link #generate}; transport errors, rate limits and
 *       malformed provider responses become {@link ModelResponse#failure}</li>
 *   <li>not retry; retry policy belongs to the caller</li>
 *   <li>leave prompt assembly to the caller</li>
 * </ul>
 */
public interface BackendClient {

    /**
     * @param backendId provider model identifier, e.g. {@code openai/gpt-5.1}
     * @param messages  assembled prompt payload
     * @return exactly one response, failed or not
     */
    Mono<ModelResponse> generate(String backendId, List<PromptMessage> messages);

    /**
     * Streams the answer as text chunks. Unlike {@link #generate}, a failure mid-stream is
     * signalled as an error so the caller can tell a finished answer from a truncated one.
     */
    Flux<String> generateStreaming(String backendId, List<PromptMessage> messages);
}
