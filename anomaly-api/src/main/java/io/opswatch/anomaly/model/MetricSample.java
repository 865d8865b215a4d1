package io.opswatch.anomaly.model;

import lombok.Value;

import java.time.Instant;

@Value
public class MetricSample {
    String metricName;
    Instant timestamp;
    double value;
}
