package io.opswatch.anomaly.model;

public enum AnomalySubtype {
    SPIKE,
    DROP,
    SUDDEN_SPIKE,
    DEGRADATION,
    OSCILLATION,
    FLATLINE,
    MULTIVARIATE_OUTLIER;

    public String code() {
        return name().toLowerCase();
    }
}
