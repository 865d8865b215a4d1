package io.opswatch.anomaly.detector.pattern;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fits a least-squares line over the degradation window and flags a slope steeper than the
 * (negative) threshold. The slope is in metric units per minute.
 */
@Component
@Order(2)
public class GradualDegradationDetector implements PatternDetector {

    @Override
    public DetectorKind kind() {
        return DetectorKind.DEGRADATION;
    }

    static SimpleRegression fit(List<MetricSample> window) {
        SimpleRegression regression = new SimpleRegression();
        Instant origin = window.get(0).getTimestamp();
        for (MetricSample sample : window) {
            double minutes = Duration.between(origin, sample.getTimestamp()).toMillis() / 60_000.0;
            regression.addData(minutes, sample.getValue());
        }
        return regression;
    }

    @Override
    public Optional<AnomalyEvent> detect(MetricSnapshot snapshot, MetricThresholds thresholds) {
        List<MetricSample> window = snapshot.tail(thresholds.getDegradationWindow());
        if (window.size() < 2) {
            throw new InsufficientDataException("Trend of " + snapshot.getMetricName() + " needs at least 2 samples");
        }
        SimpleRegression regression = fit(window);
        double slope = regression.getSlope();
        // NaN when every sample shares one timestamp
        if (Double.isNaN(slope) || slope >= thresholds.getDegradationSlopeThreshold()) {
            return Optional.empty();
        }
        MetricSample latest = window.get(window.size() - 1);
        return Optional.of(AnomalyEvent.builder()
                .metricName(snapshot.getMetricName())
                .detectorKind(kind())
                .subtype(AnomalySubtype.DEGRADATION)
                .observedValue(latest.getValue())
                .baselineValue(regression.getIntercept())
                .score(slope)
                .timestamp(latest.getTimestamp())
                .build());
    }
}
