package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.BaselineWindow;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rolling baseline statistics of a metric over a lookback window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final MetricSource metricSource;
    private final AnomalyProperties properties;
    private final Clock clock;

    public BaselineWindow computeBaseline(String metricName) {
        return computeBaseline(metricName, Duration.ofMinutes(properties.getBaselineWindowMinutes()));
    }

    /**
     * Queries the lookback window and summarizes it.
     *
     * @throws InsufficientDataException when the source returns no samples
     */
    public BaselineWindow computeBaseline(String metricName, Duration lookback) {
        Instant end = clock.instant();
        List<MetricSample> samples = metricSource.queryRange(metricName, end.minus(lookback), end,
                Duration.ofSeconds(properties.getQueryStepSeconds()));
        BaselineWindow window = fromSamples(metricName, samples);
        log.debug("Baseline {} over {}: n={} mean={} std={} p95={} p99={}", metricName, lookback,
                window.size(), window.getMean(), window.getStdDev(), window.getP95(), window.getP99());
        return window;
    }

    public static BaselineWindow fromSamples(String metricName, List<MetricSample> samples) {
        if (samples.isEmpty()) {
            throw new InsufficientDataException("No samples for " + metricName + " in the baseline window");
        }
        return BaselineWindow.of(metricName, samples);
    }
}
