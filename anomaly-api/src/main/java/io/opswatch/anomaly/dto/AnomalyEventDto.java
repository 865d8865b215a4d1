package io.opswatch.anomaly.dto;

import io.opswatch.anomaly.model.AnomalyEvent;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AnomalyEventDto {
    private String metricName;
    private String detectorKind;
    private String subtype;
    private double observedValue;
    private double baselineValue;
    private double score;
    private Instant timestamp;

    public static AnomalyEventDto from(AnomalyEvent event) {
        return AnomalyEventDto.builder()
                .metricName(event.getMetricName())
                .detectorKind(event.getDetectorKind().code())
                .subtype(event.getSubtype().code())
                .observedValue(event.getObservedValue())
                .baselineValue(event.getBaselineValue())
                .score(event.getScore())
                .timestamp(event.getTimestamp())
                .build();
    }
}
