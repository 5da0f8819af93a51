package com.llmcouncil.common.anonymization;

import com.llmcouncil.common.model.ModelResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-deliberation {@link LabelMap} and strips backend identity from responses.
 *
 * <p>Pure static utility: no state, no logging, safe to call concurrently.
 */
public final class Anonymizer {

    private Anonymizer() { /* utility class */ }

    /**
     * Label map over the backends that produced a usable response, in the order the
     * responses are given (which is participant order, not arrival order).
     */
    public static LabelMap buildLabelMap(List<ModelResponse> responses) {
        return LabelMap.build(responses.stream()
            .filter(ModelResponse::isUsable)
            .map(ModelResponse::backendId)
            .toList());
    }

    /**
     * Returns {@code (label, content)} pairs in label order. Responses whose backend has no
     * label (failed ones) are skipped.
     */
    public static List<AnonymizedResponse> anonymize(List<ModelResponse> responses, LabelMap map) {
        List<AnonymizedResponse> anonymized = new ArrayList<>(map.size());
        for (String label : map.labels()) {
            String backendId = map.deanonymize(label).orElseThrow();
            responses.stream()
                .filter(r -> r.backendId().equals(backendId) && r.isUsable())
                .findFirst()
                .ifPresent(r -> anonymized.add(new AnonymizedResponse(label, r.content())));
        }
        return anonymized;
    }
}
