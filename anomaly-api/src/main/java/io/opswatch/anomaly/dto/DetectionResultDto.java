package io.opswatch.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running detectors on demand: the events they raised and, per detector that
 * could not judge, the reason.
 */
@Data
@Builder
public class DetectionResultDto {
    private String metricName;
    private List<AnomalyEventDto> events;
    private Map<String, String> skipped;
}
