package com.llmcouncil.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

@Configuration
public class CouncilConfig {

    @Value("${council.members}")
    private List<String> members;

    @Value("${council.chairman}")
    private String chairman;

    @Value("${council.call-timeout-ms:120000}")
    private long callTimeoutMs;

    @Value("${council.max-concurrency:8}")
    private int maxConcurrency;

    @Value("${council.stream-chairman:true}")
    private boolean streamChairman;

    @Value("${council.consensus-threshold:0.8}")
    private double consensusThreshold;

    @Value("${openrouter.base-url:https://openrouter.ai/api/v1}")
    private String openRouterBaseUrl;

    @Value("${openrouter.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Bean
    public CouncilSettings councilSettings() {
        return new CouncilSettings(members, chairman, Duration.ofMillis(callTimeoutMs),
                                   maxConcurrency, streamChairman, consensusThreshold);
    }

    /**
     * OpenRouter chat-completions client. The response timeout is an idle timeout between
     * reads, so long token streams are not cut off while chunks keep arriving.
     */
    @Bean
    public WebClient openRouterClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(callTimeoutMs));

        return builder
            .baseUrl(openRouterBaseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    // Authorization is a header, so the URL is safe to log as-is.
    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(CouncilConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
