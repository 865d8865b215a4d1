package io.opswatch.anomaly.correlation;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class CorrelationReport {
    CorrelationMatrix matrix;
    List<CoupledPair> coupledPairs;
    double threshold;
    Instant computedAt;

    /**
     * Metrics coupled with {@code metricName}, strongest first.
     */
    public List<String> coupledWith(String metricName) {
        return coupledPairs.stream()
                .filter(pair -> pair.getFirst().equals(metricName) || pair.getSecond().equals(metricName))
                .sorted((a, b) -> Double.compare(Math.abs(b.getCorrelation()), Math.abs(a.getCorrelation())))
                .map(pair -> pair.getFirst().equals(metricName) ? pair.getSecond() : pair.getFirst())
                .collect(Collectors.toList());
    }
}
