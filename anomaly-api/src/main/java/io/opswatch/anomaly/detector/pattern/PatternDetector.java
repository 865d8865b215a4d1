package io.opswatch.anomaly.detector.pattern;

import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSnapshot;

import java.util.Optional;

/**
 * A shape detector over the recent samples of one metric.
 * <p>
 * Implementations are stateless: the verdict depends only on the snapshot and the thresholds,
 * and the emitted event carries the timestamp of the sample that triggered it.
 */
public interface PatternDetector {

    DetectorKind kind();

    /**
     * @throws io.opswatch.anomaly.exception.InsufficientDataException when the window holds too
     *                                                                  few samples to judge
     */
    Optional<AnomalyEvent> detect(MetricSnapshot snapshot, MetricThresholds thresholds);
}
