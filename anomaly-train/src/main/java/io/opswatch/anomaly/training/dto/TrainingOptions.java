package io.opswatch.anomaly.training.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrainingOptions {

    @Builder.Default
    int ensembleSize = 100;

    @Builder.Default
    double contaminationRate = 0.05;

    /** Points drawn per tree; capped at the row count. */
    @Builder.Default
    int subsampleSize = 256;

    @Builder.Default
    long seed = 42L;

    public void validate() {
        if (ensembleSize < 1) {
            throw new IllegalArgumentException("ensembleSize must be at least 1, was " + ensembleSize);
        }
        if (!(contaminationRate > 0.0 && contaminationRate <= 0.5)) {
            throw new IllegalArgumentException("contaminationRate must be in (0, 0.5], was " + contaminationRate);
        }
        if (subsampleSize < 2) {
            throw new IllegalArgumentException("subsampleSize must be at least 2, was " + subsampleSize);
        }
    }
}
