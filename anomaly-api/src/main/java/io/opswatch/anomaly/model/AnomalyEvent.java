package io.opswatch.anomaly.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A detected anomaly. Immutable; the engine appends it to the event log and never updates it.
 * <p>
 * {@code baselineValue} is what the detector compared against (baseline mean, the earlier
 * sample, the trend slope threshold...) and {@code score} is the detector's own measure
 * (z-score, percent change, slope, crossing count, variance, isolation score).
 */
@Value
@Builder
public class AnomalyEvent {
    @NonNull
    String metricName;
    @NonNull
    DetectorKind detectorKind;
    @NonNull
    AnomalySubtype subtype;
    double observedValue;
    double baselineValue;
    double score;
    @NonNull
    Instant timestamp;
}
