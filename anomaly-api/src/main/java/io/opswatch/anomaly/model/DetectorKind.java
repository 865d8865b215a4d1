package io.opswatch.anomaly.model;

/**
 * The closed set of detectors an anomaly event can come from.
 */
public enum DetectorKind {
    STATISTICAL,
    SPIKE,
    DEGRADATION,
    OSCILLATION,
    FLATLINE,
    MULTIVARIATE,
    CORRELATION;

    public String code() {
        return name().toLowerCase();
    }
}
