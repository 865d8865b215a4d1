package io.opswatch.anomaly.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class MultivariateScoreDto {
    private List<String> featureOrder;
    private double[] values;
    private double score;
    private double threshold;
    private boolean anomalous;
    private long modelId;
    private Instant modelTrainedAt;
}
