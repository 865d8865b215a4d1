package io.opswatch.anomaly.orchestrator;

import lombok.Value;

/**
 * A detector that produced no verdict for a metric in a cycle, with the reason.
 */
@Value
public class SkippedDetection {
    String metricName;
    String detector;
    String reason;
}
