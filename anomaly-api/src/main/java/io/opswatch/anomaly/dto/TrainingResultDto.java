package io.opswatch.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class TrainingResultDto {
    private long modelId;
    private List<String> featureOrder;
    private long trainedRows;
    private int trees;
    private double contaminationRate;
    private double scoreThreshold;
    private Instant trainedAt;
}
