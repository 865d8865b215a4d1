package io.opswatch.anomaly.correlation;

import lombok.Value;

/**
 * Two metrics whose correlation magnitude exceeded the coupling threshold.
 */
@Value
public class CoupledPair {
    String first;
    String second;
    double correlation;
}
