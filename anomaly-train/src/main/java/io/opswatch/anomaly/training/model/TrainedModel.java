package io.opswatch.anomaly.training.model;

import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import lombok.Builder;
import lombok.Getter;
import smile.anomaly.IsolationForest;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An isolation forest together with everything needed to score against it.
 * Never mutated after training; retraining produces a new instance.
 */
@Getter
@Builder
public class TrainedModel implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final IsolationForest forest;
    private final List<String> featureOrder;
    private final ScalerParams scalerParams;
    private final double contaminationRate;
    /** Scores below this value are anomalous. */
    private final double scoreThreshold;
    private final double subsampleRate;
    private final long trainedRows;
    private final Instant trainedAt;

    /**
     * Scores a raw (unscaled) vector.
     *
     * @return the average path length across the ensemble, normalized by the expected
     * path length of an unsuccessful search; lower means more anomalous
     */
    public double score(double[] raw) {
        if (raw.length != featureOrder.size()) {
            throw FeatureMismatchException.lengthMismatch(featureOrder, raw.length);
        }
        return scoreScaled(scalerParams.transform(raw));
    }

    double scoreScaled(double[] scaled) {
        // smile reports s = 2^(-E(h)/c(n)), so E(h)/c(n) = -log2(s)
        double s = forest.score(scaled);
        return -Math.log(s) / Math.log(2.0);
    }

    public boolean isAnomalous(double score) {
        return score < scoreThreshold;
    }

    public int getTrees() {
        return forest.trees().length;
    }
}
