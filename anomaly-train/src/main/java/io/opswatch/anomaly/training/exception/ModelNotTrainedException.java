package io.opswatch.anomaly.training.exception;

public class ModelNotTrainedException extends RuntimeException {

    public ModelNotTrainedException(String metricSetKey) {
        super("No trained model for metric set " + metricSetKey);
    }
}
