package io.opswatch.anomaly.model;

import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rolling summary of a metric's recent history.
 * <p>
 * Holds at most {@code windowSize} samples, evicting the oldest first. Mean, sample standard
 * deviation and the 95th/99th percentiles are recomputed on every mutation so they always
 * describe the current buffer.
 */
@Getter
public class BaselineWindow {

    private final String metricName;
    private final int windowSize;
    private final Deque<MetricSample> buffer = new ArrayDeque<>();
    private double mean = Double.NaN;
    private double stdDev = Double.NaN;
    private double p95 = Double.NaN;
    private double p99 = Double.NaN;

    public BaselineWindow(String metricName, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive, was " + windowSize);
        }
        this.metricName = metricName;
        this.windowSize = windowSize;
    }

    public static BaselineWindow of(String metricName, List<MetricSample> samples) {
        BaselineWindow window = new BaselineWindow(metricName, Math.max(1, samples.size()));
        for (MetricSample sample : samples) {
            window.buffer.addLast(sample);
        }
        window.recompute();
        return window;
    }

    public void add(MetricSample sample) {
        buffer.addLast(sample);
        while (buffer.size() > windowSize) {
            buffer.removeFirst();
        }
        recompute();
    }

    public int size() {
        return buffer.size();
    }

    public boolean isEmpty() {
        return buffer.isEmpty();
    }

    public List<MetricSample> getSamples() {
        return new ArrayList<>(buffer);
    }

    private void recompute() {
        if (buffer.isEmpty()) {
            mean = stdDev = p95 = p99 = Double.NaN;
            return;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        buffer.forEach(sample -> stats.addValue(sample.getValue()));
        mean = stats.getMean();
        // a single sample has no spread
        stdDev = stats.getN() > 1 ? stats.getStandardDeviation() : 0.0;
        p95 = stats.getPercentile(95);
        p99 = stats.getPercentile(99);
    }
}
