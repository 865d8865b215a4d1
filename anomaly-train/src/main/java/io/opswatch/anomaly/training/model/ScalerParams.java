package io.opswatch.anomaly.training.model;

import lombok.Getter;

import java.io.Serial;
import java.io.Serializable;

/**
 * Per-feature mean and standard deviation of the training set.
 * A constant feature keeps a scale of 1 so it standardizes to zero instead of NaN.
 */
@Getter
public class ScalerParams implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final double[] means;
    private final double[] stdDevs;

    private ScalerParams(double[] means, double[] stdDevs) {
        this.means = means;
        this.stdDevs = stdDevs;
    }

    public static ScalerParams fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on zero rows");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] stdDevs = new double[width];
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            means[j] /= rows.length;
        }
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                double d = row[j] - means[j];
                stdDevs[j] += d * d;
            }
        }
        for (int j = 0; j < width; j++) {
            double std = Math.sqrt(stdDevs[j] / rows.length);
            stdDevs[j] = std > 0.0 ? std : 1.0;
        }
        return new ScalerParams(means, stdDevs);
    }

    public int width() {
        return means.length;
    }

    public double[] transform(double[] x) {
        double[] scaled = new double[x.length];
        for (int j = 0; j < x.length; j++) {
            scaled[j] = (x[j] - means[j]) / stdDevs[j];
        }
        return scaled;
    }

    public double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = transform(rows[i]);
        }
        return scaled;
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getStdDevs() {
        return stdDevs.clone();
    }
}
