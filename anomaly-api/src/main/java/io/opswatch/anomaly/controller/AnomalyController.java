package io.opswatch.anomaly.controller;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.dto.AnomalyEventDto;
import io.opswatch.anomaly.dto.BaselineDto;
import io.opswatch.anomaly.dto.CorrelationDto;
import io.opswatch.anomaly.dto.CycleReportDto;
import io.opswatch.anomaly.dto.DetectionResultDto;
import io.opswatch.anomaly.dto.MultivariateScoreDto;
import io.opswatch.anomaly.dto.ScanResultDto;
import io.opswatch.anomaly.dto.TrainingResultDto;
import io.opswatch.anomaly.model.BaselineWindow;
import io.opswatch.anomaly.orchestrator.DetectionOrchestrator;
import io.opswatch.anomaly.services.AnomalyEventService;
import io.opswatch.anomaly.services.BaselineService;
import io.opswatch.anomaly.services.ModelTrainingService;
import io.opswatch.anomaly.services.OnDemandDetectionService;
import io.opswatch.anomaly.services.TimeSeriesScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
@Tag(name = "Anomaly", description = "On-demand anomaly detection")
public class AnomalyController {

    private final OnDemandDetectionService onDemandDetectionService;
    private final ModelTrainingService modelTrainingService;
    private final DetectionOrchestrator orchestrator;
    private final BaselineService baselineService;
    private final TimeSeriesScanService scanService;
    private final AnomalyEventService eventService;
    private final AnomalyProperties properties;

    @PostMapping("/train")
    @Operation(summary = "Train the multivariate model now")
    public TrainingResultDto train() {
        return modelTrainingService.train();
    }

    @GetMapping("/detect/{metric}")
    @Operation(summary = "Run statistical detection on one metric")
    public DetectionResultDto detect(
            @Parameter(description = "Metric name or query", required = true, example = "node_load1")
            @PathVariable(name = "metric") String metric) {
        return onDemandDetectionService.detectStatistical(metric);
    }

    @GetMapping("/ml")
    @Operation(summary = "Score the current multivariate feature vector")
    public MultivariateScoreDto ml() {
        return onDemandDetectionService.scoreCurrent();
    }

    @GetMapping("/patterns/{metric}")
    @Operation(summary = "Run the pattern detectors on one metric")
    public DetectionResultDto patterns(@PathVariable(name = "metric") String metric) {
        return onDemandDetectionService.detectPatterns(metric);
    }

    @GetMapping("/correlations")
    @Operation(summary = "Correlate the configured metrics")
    public CorrelationDto correlations() {
        return CorrelationDto.from(onDemandDetectionService.correlations());
    }

    @PostMapping("/cycle")
    @Operation(summary = "Run one full detection cycle now")
    public CycleReportDto cycle() {
        return CycleReportDto.from(orchestrator.runCycle());
    }

    @GetMapping("/baseline/{metric}")
    public BaselineDto baseline(@PathVariable(name = "metric") String metric,
                                @RequestParam(name = "windowMinutes", required = false) Integer windowMinutes) {
        int minutes = windowMinutes != null ? windowMinutes : properties.getBaselineWindowMinutes();
        BaselineWindow window = baselineService.computeBaseline(metric, Duration.ofMinutes(minutes));
        return BaselineDto.builder()
                .metricName(metric)
                .windowMinutes(minutes)
                .samples(window.size())
                .mean(window.getMean())
                .stdDev(window.getStdDev())
                .p95(window.getP95())
                .p99(window.getP99())
                .build();
    }

    @GetMapping("/scan/{metric}")
    @Operation(summary = "Scan a long window for outlying points")
    public ScanResultDto scan(@PathVariable(name = "metric") String metric,
                              @Parameter(description = "Score percentile above which points are reported", example = "0.95")
                              @RequestParam(name = "sensitivity", defaultValue = "0.95") double sensitivity) {
        return scanService.scan(metric, sensitivity);
    }

    @GetMapping("/events/{metric}")
    public List<AnomalyEventDto> events(@PathVariable(name = "metric") String metric,
                                        @Parameter(description = "ISO-8601 instant", example = "2026-03-02T10:00:00Z")
                                        @RequestParam(name = "since", required = false) Instant since) {
        return eventService.findByMetric(metric, since != null ? since : Instant.EPOCH);
    }
}
