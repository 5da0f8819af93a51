package com.llmcouncil.common.anonymization;

/**
 * A Stage 1 answer stripped of its author, as shown to evaluators.
 */
public record AnonymizedResponse(String label, String content) {}
