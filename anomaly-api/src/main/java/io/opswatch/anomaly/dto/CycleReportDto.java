package io.opswatch.anomaly.dto;

import io.opswatch.anomaly.orchestrator.CycleReport;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class CycleReportDto {
    private long cycle;
    private Instant startedAt;
    private Instant finishedAt;
    private List<AnomalyEventDto> events;
    private List<String> skipped;
    private int persisted;
    private int notified;
    private CorrelationDto correlations;

    public static CycleReportDto from(CycleReport report) {
        return CycleReportDto.builder()
                .cycle(report.getCycle())
                .startedAt(report.getStartedAt())
                .finishedAt(report.getFinishedAt())
                .events(report.getEvents().stream().map(AnomalyEventDto::from).collect(Collectors.toList()))
                .skipped(report.getSkipped().stream()
                        .map(s -> s.getMetricName() + "/" + s.getDetector() + ": " + s.getReason())
                        .collect(Collectors.toList()))
                .persisted(report.getPersisted())
                .notified(report.getNotified())
                .correlations(report.getCorrelationReport() == null ? null
                        : CorrelationDto.from(report.getCorrelationReport()))
                .build();
    }
}
