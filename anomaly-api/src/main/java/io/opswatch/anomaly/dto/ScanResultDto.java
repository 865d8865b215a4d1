package io.opswatch.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ScanResultDto {
    private String metricName;
    private int samples;
    private int window;
    private double sensitivity;
    private double threshold;
    private int anomaliesFound;
    /** The latest flagged points, oldest first. */
    private List<ScanPoint> latest;

    @Data
    @Builder
    public static class ScanPoint {
        private Instant timestamp;
        private double value;
        private double score;
    }
}
