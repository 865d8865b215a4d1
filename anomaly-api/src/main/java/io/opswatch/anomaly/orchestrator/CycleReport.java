package io.opswatch.anomaly.orchestrator;

import io.opswatch.anomaly.correlation.CorrelationReport;
import io.opswatch.anomaly.model.AnomalyEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CycleReport {
    long cycle;
    Instant startedAt;
    Instant finishedAt;
    List<AnomalyEvent> events;
    List<SkippedDetection> skipped;
    int persisted;
    int notified;
    /** Set on the cycles that ran the correlation analyzer. */
    CorrelationReport correlationReport;
}
