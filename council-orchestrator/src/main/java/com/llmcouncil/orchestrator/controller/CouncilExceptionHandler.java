package com.llmcouncil.orchestrator.controller;

import com.llmcouncil.common.exception.CouncilException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps deliberation failures on the blocking endpoint to HTTP responses. The streaming
 * endpoint never reaches this: its failures travel as {@code error} events.
 */
@RestControllerAdvice
public class CouncilExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CouncilExceptionHandler.class);

    @ExceptionHandler(CouncilException.class)
    public ResponseEntity<Map<String, String>> handle(CouncilException e) {
        HttpStatus status = switch (e.getKind()) {
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case TOTAL_STAGE_FAILURE -> HttpStatus.BAD_GATEWAY;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.warn("Deliberation request failed. kind={} status={} reason={}",
                 e.getKind(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
            "kind", e.getKind().name(),
            "message", e.getMessage() != null ? e.getMessage() : ""));
    }
}
