package io.opswatch.anomaly.correlation;

import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.training.dto.FeatureMatrix;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lines up series of different metrics on their shared timestamps.
 */
public final class SeriesAligner {

    private SeriesAligner() {
    }

    /**
     * Values of both series at the timestamps present in both, oldest first. The result is never
     * longer than the shorter series.
     */
    public static double[][] align(List<MetricSample> first, List<MetricSample> second) {
        Map<Instant, Double> byTime = index(first);
        List<double[]> pairs = new ArrayList<>();
        for (Map.Entry<Instant, Double> entry : index(second).entrySet()) {
            Double value = byTime.get(entry.getKey());
            if (value != null) {
                pairs.add(new double[]{value, entry.getValue()});
            }
        }
        double[][] aligned = new double[2][pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            aligned[0][i] = pairs.get(i)[0];
            aligned[1][i] = pairs.get(i)[1];
        }
        return aligned;
    }

    /**
     * One row per timestamp at which every feature has a sample, columns in {@code featureOrder}.
     */
    public static FeatureMatrix toFeatureMatrix(List<String> featureOrder, Map<String, List<MetricSample>> series) {
        FeatureMatrix matrix = new FeatureMatrix(featureOrder);
        List<Map<Instant, Double>> columns = new ArrayList<>();
        for (String feature : featureOrder) {
            columns.add(index(series.getOrDefault(feature, List.of())));
        }
        for (Instant timestamp : columns.get(0).keySet()) {
            double[] row = new double[featureOrder.size()];
            boolean complete = true;
            for (int i = 0; i < columns.size() && complete; i++) {
                Double value = columns.get(i).get(timestamp);
                if (value == null) {
                    complete = false;
                } else {
                    row[i] = value;
                }
            }
            if (complete) {
                matrix.addRow(timestamp, row);
            }
        }
        return matrix;
    }

    private static Map<Instant, Double> index(List<MetricSample> samples) {
        // later duplicates win
        Map<Instant, Double> indexed = new TreeMap<>();
        for (MetricSample sample : samples) {
            indexed.put(sample.getTimestamp(), sample.getValue());
        }
        return indexed;
    }
}
