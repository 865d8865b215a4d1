package io.opswatch.anomaly.detector.pattern;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares the latest value with the value one spike delay earlier.
 */
@Slf4j
@Component
@Order(1)
public class SuddenSpikeDetector implements PatternDetector {

    // keeps the ratio finite when the earlier value is zero
    private static final double DENOMINATOR_FLOOR = 1e-4;

    @Override
    public DetectorKind kind() {
        return DetectorKind.SPIKE;
    }

    public static double changePercent(double current, double previous) {
        return (current - previous) / (Math.abs(previous) + DENOMINATOR_FLOOR) * 100.0;
    }

    @Override
    public Optional<AnomalyEvent> detect(MetricSnapshot snapshot, MetricThresholds thresholds) {
        MetricSample current = snapshot.latest()
                .orElseThrow(() -> new InsufficientDataException("No samples for " + snapshot.getMetricName()));
        MetricSample previous = snapshot.at(current.getTimestamp().minus(thresholds.getSpikeDelay()))
                .orElseThrow(() -> new InsufficientDataException(
                        "No sample " + thresholds.getSpikeDelay() + " before the latest for " + snapshot.getMetricName()));

        double change = changePercent(current.getValue(), previous.getValue());
        if (change <= thresholds.getSpikeChangePercent()) {
            return Optional.empty();
        }
        log.debug("{}: {} -> {} is a {}% jump", snapshot.getMetricName(), previous.getValue(), current.getValue(), change);
        return Optional.of(AnomalyEvent.builder()
                .metricName(snapshot.getMetricName())
                .detectorKind(kind())
                .subtype(AnomalySubtype.SUDDEN_SPIKE)
                .observedValue(current.getValue())
                .baselineValue(previous.getValue())
                .score(change)
                .timestamp(current.getTimestamp())
                .build());
    }
}
