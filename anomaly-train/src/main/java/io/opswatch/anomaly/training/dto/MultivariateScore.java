package io.opswatch.anomaly.training.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Average normalized isolation path length of a vector; lower means easier to isolate.
 */
@Value
@Builder
public class MultivariateScore {
    double score;
    double threshold;
    boolean anomalous;
    long modelId;
    Instant modelTrainedAt;
}
