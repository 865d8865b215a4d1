package io.opswatch.anomaly.detector.pattern;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Counts direction changes of the series. A metric that flips between rising and falling on
 * most samples is flapping.
 */
@Component
@Order(3)
public class OscillationDetector implements PatternDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.OSCILLATION;
    }

    /**
     * Half the summed magnitude of sign changes between consecutive first differences. A full
     * reversal counts one, a move to or from a flat step counts a half.
     */
    public static double crossings(double[] values) {
        double total = 0.0;
        double previousSign = Double.NaN;
        for (int i = 1; i < values.length; i++) {
            double sign = Math.signum(values[i] - values[i - 1]);
            if (!Double.isNaN(previousSign)) {
                total += Math.abs(sign - previousSign);
            }
            previousSign = sign;
        }
        return total / 2.0;
    }

    @Override
    public Optional<AnomalyEvent> detect(MetricSnapshot snapshot, MetricThresholds thresholds) {
        List<MetricSample> window = snapshot.tail(thresholds.getOscillationWindow());
        if (window.size() < thresholds.getOscillationMinSamples()) {
            throw new InsufficientDataException(String.format("%s has %d samples in the oscillation window, %d required",
                    snapshot.getMetricName(), window.size(), thresholds.getOscillationMinSamples()));
        }
        double crossings = crossings(MetricSnapshot.values(window));
        double limit = thresholds.getOscillationCrossingFraction() * window.size();
        if (crossings <= limit) {
            return Optional.empty();
        }
        MetricSample latest = window.get(window.size() - 1);
        return Optional.of(AnomalyEvent.builder()
                .metricName(snapshot.getMetricName())
                .detectorKind(kind())
                .subtype(AnomalySubtype.OSCILLATION)
                .observedValue(latest.getValue())
                .baselineValue(limit)
                .score(crossings)
                .timestamp(latest.getTimestamp())
                .build());
    }
}
