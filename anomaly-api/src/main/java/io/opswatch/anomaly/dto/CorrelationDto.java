package io.opswatch.anomaly.dto;

import io.opswatch.anomaly.correlation.CorrelationReport;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Data
@Builder
public class CorrelationDto {
    private double threshold;
    private Instant computedAt;
    private Map<String, Map<String, Double>> matrix;
    private List<Coupling> coupledPairs;

    @Data
    @Builder
    public static class Coupling {
        private String first;
        private String second;
        private double correlation;
    }

    public static CorrelationDto from(CorrelationReport report) {
        return CorrelationDto.builder()
                .threshold(report.getThreshold())
                .computedAt(report.getComputedAt())
                .matrix(report.getMatrix().asMap())
                .coupledPairs(report.getCoupledPairs().stream()
                        .map(pair -> Coupling.builder()
                                .first(pair.getFirst())
                                .second(pair.getSecond())
                                .correlation(pair.getCorrelation())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
