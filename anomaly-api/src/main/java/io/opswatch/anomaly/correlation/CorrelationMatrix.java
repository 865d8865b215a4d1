package io.opswatch.anomaly.correlation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Symmetric Pearson coefficients between metrics. Pairs that could not be computed are absent.
 */
public class CorrelationMatrix {

    private final List<String> metrics;
    private final Map<String, Map<String, Double>> coefficients = new LinkedHashMap<>();

    public CorrelationMatrix(List<String> metrics) {
        this.metrics = List.copyOf(metrics);
    }

    void put(String first, String second, double coefficient) {
        coefficients.computeIfAbsent(first, k -> new LinkedHashMap<>()).put(second, coefficient);
        coefficients.computeIfAbsent(second, k -> new LinkedHashMap<>()).put(first, coefficient);
    }

    public OptionalDouble get(String first, String second) {
        Double value = coefficients.getOrDefault(first, Map.of()).get(second);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public List<String> getMetrics() {
        return metrics;
    }

    /**
     * Row-wise view for serialization.
     */
    public Map<String, Map<String, Double>> asMap() {
        Map<String, Map<String, Double>> view = new LinkedHashMap<>();
        coefficients.forEach((metric, row) -> view.put(metric, Collections.unmodifiableMap(row)));
        return Collections.unmodifiableMap(view);
    }
}
