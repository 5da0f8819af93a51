package com.llmcouncil.common.anonymization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bijection between anonymous labels ("Response A", "Response B", …) and backend ids,
 * scoped to a single deliberation.
 *
 * <p>Labels are assigned in the order the backend ids are supplied, never in response arrival
 * order, so the same participant list always yields the same map. Instances are immutable and
 * must not outlive the deliberation that built them.
 */
public final class LabelMap {

    public static final String LABEL_PREFIX = "Response ";

    private final Map<String, String> labelToBackend;
    private final Map<String, String> backendToLabel;

    private LabelMap(Map<String, String> labelToBackend, Map<String, String> backendToLabel) {
        this.labelToBackend = Collections.unmodifiableMap(labelToBackend);
        this.backendToLabel = Collections.unmodifiableMap(backendToLabel);
    }

    /**
     * Builds a map assigning {@code Response A} to the first id, {@code Response B} to the
     * second, and so on. After {@code Z} labels continue with {@code AA}, {@code AB}, ….
     *
     * @param backendIds ordered, unique backend ids
     * @throws IllegalArgumentException if an id is repeated
     */
    public static LabelMap build(List<String> backendIds) {
        Objects.requireNonNull(backendIds, "backendIds");
        Map<String, String> forward = new LinkedHashMap<>();
        Map<String, String> reverse = new LinkedHashMap<>();
        for (int i = 0; i < backendIds.size(); i++) {
            String backendId = backendIds.get(i);
            if (reverse.containsKey(backendId)) {
                throw new IllegalArgumentException("Duplicate backend id: " + backendId);
            }
            String label = labelFor(i);
            forward.put(label, backendId);
            reverse.put(backendId, label);
        }
        return new LabelMap(forward, reverse);
    }

    /**
     * Label for the zero-based position {@code index}: 0 → "Response A", 25 → "Response Z",
     * 26 → "Response AA".
     */
    public static String labelFor(int index) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        StringBuilder letters = new StringBuilder();
        int n = index;
        do {
            letters.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return LABEL_PREFIX + letters;
    }

    /** Backend id behind {@code label}, empty for labels this deliberation never issued. */
    public Optional<String> deanonymize(String label) {
        return Optional.ofNullable(labelToBackend.get(label));
    }

    public Optional<String> labelOf(String backendId) {
        return Optional.ofNullable(backendToLabel.get(backendId));
    }

    public boolean containsLabel(String label) {
        return labelToBackend.containsKey(label);
    }

    /** Labels in assignment order. */
    public List<String> labels() {
        return List.copyOf(labelToBackend.keySet());
    }

    /** Backend ids in assignment order. */
    public List<String> backendIds() {
        return List.copyOf(backendToLabel.keySet());
    }

    public int size() {
        return labelToBackend.size();
    }

    /** Label → backend id, in assignment order. Read-only view. */
    public Map<String, String> asMap() {
        return labelToBackend;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelMap other)) return false;
        return labelToBackend.equals(other.labelToBackend);
    }

    @Override
    public int hashCode() {
        return labelToBackend.hashCode();
    }

    @Override
    public String toString() {
        return "LabelMap" + labelToBackend;
    }
}
