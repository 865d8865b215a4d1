package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Fetches the per-cycle sample window of a metric. One window covers every detector's
 * lookback, so all detectors of a cycle read the same data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricSnapshotService {

    private final MetricSource metricSource;
    private final AnomalyProperties properties;

    public Duration snapshotWindow() {
        int minutes = IntStream.of(
                properties.getBaselineWindowMinutes(),
                properties.getDegradationWindowMinutes(),
                properties.getOscillationWindowMinutes(),
                properties.getFlatlineWindowMinutes(),
                properties.getCorrelationWindowMinutes()).max().orElseThrow();
        return Duration.ofMinutes(minutes);
    }

    /**
     * @throws io.opswatch.anomaly.exception.SourceUnavailableException when the source fails
     */
    public MetricSnapshot capture(String metricName, Instant at) {
        List<MetricSample> samples = metricSource.queryRange(metricName, at.minus(snapshotWindow()), at,
                Duration.ofSeconds(properties.getQueryStepSeconds()));
        log.debug("Captured {} samples of {}", samples.size(), metricName);
        return new MetricSnapshot(metricName, samples, at);
    }
}
