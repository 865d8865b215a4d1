package io.opswatch.anomaly.training.dto;

import lombok.Value;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Simultaneous values of the model's metrics, in the model's feature order.
 */
@Value
public class FeatureVector {
    List<String> featureOrder;
    double[] values;
    Instant timestamp;

    public FeatureVector(List<String> featureOrder, double[] values, Instant timestamp) {
        this.featureOrder = List.copyOf(featureOrder);
        this.values = values.clone();
        this.timestamp = timestamp;
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    @Override
    public String toString() {
        return "FeatureVector" + featureOrder + Arrays.toString(values);
    }
}
