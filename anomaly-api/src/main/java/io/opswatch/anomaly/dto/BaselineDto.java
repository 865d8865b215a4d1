package io.opswatch.anomaly.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BaselineDto {
    private String metricName;
    private int windowMinutes;
    private int samples;
    private double mean;
    private double stdDev;
    private double p95;
    private double p99;
}
