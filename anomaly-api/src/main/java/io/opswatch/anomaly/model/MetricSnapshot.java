package io.opswatch.anomaly.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The samples of one metric captured once at cycle start. Every detector of the cycle reads
 * the same snapshot.
 */
@Getter
public class MetricSnapshot {

    private final String metricName;
    private final List<MetricSample> samples;
    private final Instant capturedAt;

    public MetricSnapshot(String metricName, List<MetricSample> samples, Instant capturedAt) {
        this.metricName = metricName;
        this.samples = samples.stream()
                .sorted(Comparator.comparing(MetricSample::getTimestamp))
                .collect(Collectors.toUnmodifiableList());
        this.capturedAt = capturedAt;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    public Optional<MetricSample> latest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    /**
     * All samples except the latest: the history the latest sample is judged against.
     */
    public List<MetricSample> history() {
        return samples.isEmpty() ? List.of() : samples.subList(0, samples.size() - 1);
    }

    /**
     * Samples no older than {@code window} before the latest sample.
     */
    public List<MetricSample> tail(Duration window) {
        if (samples.isEmpty()) {
            return List.of();
        }
        Instant from = samples.get(samples.size() - 1).getTimestamp().minus(window);
        return samples.stream()
                .filter(sample -> !sample.getTimestamp().isBefore(from))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * The latest sample taken at or before {@code instant}.
     */
    public Optional<MetricSample> at(Instant instant) {
        MetricSample found = null;
        for (MetricSample sample : samples) {
            if (sample.getTimestamp().isAfter(instant)) {
                break;
            }
            found = sample;
        }
        return Optional.ofNullable(found);
    }

    public static double[] values(List<MetricSample> window) {
        return window.stream().mapToDouble(MetricSample::getValue).toArray();
    }
}
