package io.opswatch.anomaly.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Detector thresholds resolved for one metric.
 */
@Value
@Builder
public class MetricThresholds {
    double zScoreThreshold;
    int minBaselineSamples;
    double spikeChangePercent;
    Duration spikeDelay;
    double degradationSlopeThreshold;
    Duration degradationWindow;
    double oscillationCrossingFraction;
    Duration oscillationWindow;
    int oscillationMinSamples;
    double flatlineVarianceEpsilon;
    Duration flatlineWindow;
    int flatlineMinSamples;
}
