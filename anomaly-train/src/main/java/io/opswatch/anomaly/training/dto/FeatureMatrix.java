package io.opswatch.anomaly.training.dto;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Training rows: one feature vector per historical timestamp, columns in feature order.
 */
@Getter
public class FeatureMatrix {

    private final List<String> featureOrder;
    private final List<Instant> timestamps = new ArrayList<>();
    private final List<double[]> rows = new ArrayList<>();

    public FeatureMatrix(List<String> featureOrder) {
        if (featureOrder.isEmpty()) {
            throw new IllegalArgumentException("Feature order must not be empty");
        }
        this.featureOrder = List.copyOf(featureOrder);
    }

    public void addRow(Instant timestamp, double[] row) {
        if (row.length != featureOrder.size()) {
            throw new IllegalArgumentException("Row has " + row.length + " values, expected " + featureOrder.size());
        }
        timestamps.add(timestamp);
        rows.add(row.clone());
    }

    public int rowCount() {
        return rows.size();
    }

    public double[][] toArray() {
        return rows.toArray(new double[0][]);
    }
}
