package io.opswatch.anomaly.detector.pattern;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Flags a metric whose recent values stopped moving, typically a stuck exporter.
 */
@Component
@Order(4)
public class FlatlineDetector implements PatternDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.FLATLINE;
    }

    @Override
    public Optional<AnomalyEvent> detect(MetricSnapshot snapshot, MetricThresholds thresholds) {
        List<MetricSample> window = snapshot.tail(thresholds.getFlatlineWindow());
        if (window.size() < thresholds.getFlatlineMinSamples()) {
            throw new InsufficientDataException(String.format("%s has %d samples in the flatline window, %d required",
                    snapshot.getMetricName(), window.size(), thresholds.getFlatlineMinSamples()));
        }
        double[] values = MetricSnapshot.values(window);
        double variance = StatUtils.populationVariance(values);
        if (variance >= thresholds.getFlatlineVarianceEpsilon()) {
            return Optional.empty();
        }
        MetricSample latest = window.get(window.size() - 1);
        return Optional.of(AnomalyEvent.builder()
                .metricName(snapshot.getMetricName())
                .detectorKind(kind())
                .subtype(AnomalySubtype.FLATLINE)
                .observedValue(latest.getValue())
                .baselineValue(StatUtils.mean(values))
                .score(variance)
                .timestamp(latest.getTimestamp())
                .build());
    }
}
