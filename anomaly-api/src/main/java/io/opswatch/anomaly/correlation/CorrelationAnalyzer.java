package io.opswatch.anomaly.correlation;

import io.opswatch.anomaly.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Pairwise Pearson correlation between metrics over a common window. Coupled pairs are
 * reported for context only.
 */
@Slf4j
@Component
public class CorrelationAnalyzer {

    /**
     * Coefficient over the shared timestamps, empty when fewer than two line up or when either
     * side is constant.
     */
    public OptionalDouble correlation(List<MetricSample> first, List<MetricSample> second) {
        double[][] aligned = SeriesAligner.align(first, second);
        if (aligned[0].length < 2) {
            return OptionalDouble.empty();
        }
        double r = new PearsonsCorrelation().correlation(aligned[0], aligned[1]);
        return Double.isNaN(r) ? OptionalDouble.empty() : OptionalDouble.of(r);
    }

    public CorrelationReport analyze(Map<String, List<MetricSample>> series, double threshold, Instant computedAt) {
        List<String> metrics = new ArrayList<>(series.keySet());
        CorrelationMatrix matrix = new CorrelationMatrix(metrics);
        List<CoupledPair> coupled = new ArrayList<>();
        for (int i = 0; i < metrics.size(); i++) {
            for (int j = i; j < metrics.size(); j++) {
                String first = metrics.get(i);
                String second = metrics.get(j);
                OptionalDouble r = correlation(series.get(first), series.get(second));
                if (r.isEmpty()) {
                    log.debug("Correlation {} ~ {} skipped, not enough aligned variation", first, second);
                    continue;
                }
                matrix.put(first, second, r.getAsDouble());
                if (i != j && Math.abs(r.getAsDouble()) > threshold) {
                    coupled.add(new CoupledPair(first, second, r.getAsDouble()));
                }
            }
        }
        if (!coupled.isEmpty()) {
            log.info("Coupled metrics (|r| > {}): {}", threshold, coupled);
        }
        return new CorrelationReport(matrix, List.copyOf(coupled), threshold, computedAt);
    }
}
