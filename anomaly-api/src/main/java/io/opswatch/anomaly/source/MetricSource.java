package io.opswatch.anomaly.source;

import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.model.MetricSample;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read access to the time-series backend. Calls may be slow and may fail; implementations
 * bound every call with a timeout.
 */
public interface MetricSource {

    /**
     * The current value of a metric.
     *
     * @throws SourceUnavailableException when the backend times out, errors or has no value
     */
    double queryInstant(String metricName);

    /**
     * Samples of a metric between {@code start} and {@code end}, oldest first. An unknown or
     * silent metric yields an empty list.
     *
     * @throws SourceUnavailableException when the backend times out or errors
     */
    List<MetricSample> queryRange(String metricName, Instant start, Instant end, Duration step);
}
