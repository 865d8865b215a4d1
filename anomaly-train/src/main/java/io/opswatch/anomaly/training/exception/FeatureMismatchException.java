package io.opswatch.anomaly.training.exception;

import java.util.List;

/**
 * A feature vector does not line up with the feature order a model was trained on.
 * This is a configuration defect: retrying the same call cannot succeed.
 */
public class FeatureMismatchException extends RuntimeException {

    public FeatureMismatchException(String message) {
        super(message);
    }

    public static FeatureMismatchException lengthMismatch(List<String> featureOrder, int actualLength) {
        return new FeatureMismatchException(String.format(
                "Feature vector has %d values but the model expects %d %s",
                actualLength, featureOrder.size(), featureOrder));
    }
}
