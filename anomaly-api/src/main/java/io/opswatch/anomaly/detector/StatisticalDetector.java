package io.opswatch.anomaly.detector;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.BaselineWindow;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.services.BaselineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Flags the latest sample of a metric when it lies more than a threshold number of standard
 * deviations from the baseline built over the samples before it.
 */
@Slf4j
@Component
public class StatisticalDetector {

    /** Relative spread below which a series counts as constant. */
    private static final double ZERO_SPREAD = 1e-12;

    /**
     * {@code (current - mean) / stdDev}, or 0 when the baseline has no spread.
     */
    public static double zScore(double current, double mean, double stdDev) {
        if (!(stdDev > ZERO_SPREAD * Math.max(1.0, Math.abs(mean)))) {
            return 0.0;
        }
        return (current - mean) / stdDev;
    }

    public Optional<AnomalyEvent> evaluate(String metricName, MetricSample current, double mean, double stdDev,
                                           double threshold) {
        double z = zScore(current.getValue(), mean, stdDev);
        AnomalySubtype subtype;
        if (z > threshold) {
            subtype = AnomalySubtype.SPIKE;
        } else if (z < -threshold) {
            subtype = AnomalySubtype.DROP;
        } else {
            log.debug("{}: z-score {} within +/-{}", metricName, z, threshold);
            return Optional.empty();
        }
        return Optional.of(AnomalyEvent.builder()
                .metricName(metricName)
                .detectorKind(DetectorKind.STATISTICAL)
                .subtype(subtype)
                .observedValue(current.getValue())
                .baselineValue(mean)
                .score(z)
                .timestamp(current.getTimestamp())
                .build());
    }

    /**
     * Judges the snapshot's latest sample against the preceding samples of the baseline window.
     *
     * @throws InsufficientDataException when the history is shorter than the configured minimum
     */
    public Optional<AnomalyEvent> detect(MetricSnapshot snapshot, Duration baselineWindow, MetricThresholds thresholds) {
        List<MetricSample> window = snapshot.tail(baselineWindow);
        if (window.size() < 2) {
            throw new InsufficientDataException("No history for " + snapshot.getMetricName());
        }
        List<MetricSample> history = window.subList(0, window.size() - 1);
        if (history.size() < thresholds.getMinBaselineSamples()) {
            throw new InsufficientDataException(String.format("%s has %d baseline samples, %d required",
                    snapshot.getMetricName(), history.size(), thresholds.getMinBaselineSamples()));
        }
        BaselineWindow baseline = BaselineService.fromSamples(snapshot.getMetricName(), history);
        return evaluate(snapshot.getMetricName(), window.get(window.size() - 1),
                baseline.getMean(), baseline.getStdDev(), thresholds.getZScoreThreshold());
    }
}
