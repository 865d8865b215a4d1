package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.config.MetricThresholds;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class ThresholdService {

    private final AnomalyProperties properties;
    private final Map<String, MetricThresholds> resolved = new ConcurrentHashMap<>();

    public ThresholdService(AnomalyProperties properties) {
        this.properties = properties;
    }

    public MetricThresholds forMetric(String metricName) {
        return resolved.computeIfAbsent(metricName, this::resolve);
    }

    private MetricThresholds resolve(String metricName) {
        AnomalyProperties.MetricOverrides o = properties.getOverrides()
                .getOrDefault(metricName, new AnomalyProperties.MetricOverrides());
        return MetricThresholds.builder()
                .zScoreThreshold(orDefault(o.getZScoreThreshold(), properties.getZScoreThreshold()))
                .minBaselineSamples(properties.getMinBaselineSamples())
                .spikeChangePercent(orDefault(o.getSpikeChangePercent(), properties.getSpikeChangePercent()))
                .spikeDelay(Duration.ofSeconds(properties.getSpikeDelaySeconds()))
                .degradationSlopeThreshold(orDefault(o.getDegradationSlopeThreshold(), properties.getDegradationSlopeThreshold()))
                .degradationWindow(Duration.ofMinutes(properties.getDegradationWindowMinutes()))
                .oscillationCrossingFraction(orDefault(o.getOscillationCrossingFraction(), properties.getOscillationCrossingFraction()))
                .oscillationWindow(Duration.ofMinutes(properties.getOscillationWindowMinutes()))
                .oscillationMinSamples(properties.getOscillationMinSamples())
                .flatlineVarianceEpsilon(orDefault(o.getFlatlineVarianceEpsilon(), properties.getFlatlineVarianceEpsilon()))
                .flatlineWindow(Duration.ofMinutes(properties.getFlatlineWindowMinutes()))
                .flatlineMinSamples(properties.getFlatlineMinSamples())
                .build();
    }

    private static double orDefault(Double override, double fallback) {
        return override != null ? override : fallback;
    }
}
