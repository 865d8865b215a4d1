package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.correlation.CorrelationAnalyzer;
import io.opswatch.anomaly.correlation.CorrelationReport;
import io.opswatch.anomaly.detector.StatisticalDetector;
import io.opswatch.anomaly.detector.pattern.PatternDetector;
import io.opswatch.anomaly.dto.AnomalyEventDto;
import io.opswatch.anomaly.dto.DetectionResultDto;
import io.opswatch.anomaly.dto.MultivariateScoreDto;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.orchestrator.DetectionOrchestrator;
import io.opswatch.anomaly.training.dto.FeatureVector;
import io.opswatch.anomaly.training.dto.MultivariateScore;
import io.opswatch.anomaly.training.service.MultivariateScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single detector runs outside the cycle. Nothing here is persisted or notified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnDemandDetectionService {

    private final MetricSnapshotService snapshotService;
    private final ThresholdService thresholdService;
    private final StatisticalDetector statisticalDetector;
    private final List<PatternDetector> patternDetectors;
    private final MultivariateDetectionService multivariateDetectionService;
    private final MultivariateScoringService scoringService;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final DetectionOrchestrator orchestrator;
    private final AnomalyProperties properties;
    private final Clock clock;

    /**
     * @throws InsufficientDataException when the baseline is too short
     */
    public DetectionResultDto detectStatistical(String metricName) {
        MetricSnapshot snapshot = snapshotService.capture(metricName, clock.instant());
        List<AnomalyEventDto> events = new ArrayList<>();
        statisticalDetector.detect(snapshot, Duration.ofMinutes(properties.getBaselineWindowMinutes()),
                        thresholdService.forMetric(metricName))
                .ifPresent(event -> events.add(AnomalyEventDto.from(event)));
        return DetectionResultDto.builder()
                .metricName(metricName)
                .events(events)
                .skipped(Map.of())
                .build();
    }

    public DetectionResultDto detectPatterns(String metricName) {
        MetricSnapshot snapshot = snapshotService.capture(metricName, clock.instant());
        MetricThresholds thresholds = thresholdService.forMetric(metricName);
        List<AnomalyEventDto> events = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        for (PatternDetector detector : patternDetectors) {
            try {
                detector.detect(snapshot, thresholds).ifPresent(event -> events.add(AnomalyEventDto.from(event)));
            } catch (InsufficientDataException e) {
                log.debug("{} skipped on {}: {}", detector.kind().code(), metricName, e.getMessage());
                skipped.put(detector.kind().code(), e.getMessage());
            }
        }
        return DetectionResultDto.builder()
                .metricName(metricName)
                .events(events)
                .skipped(skipped)
                .build();
    }

    public MultivariateScoreDto scoreCurrent() {
        FeatureVector vector = multivariateDetectionService.currentVector(Map.of(), clock.instant());
        MultivariateScore score = scoringService.score(vector);
        return MultivariateScoreDto.builder()
                .featureOrder(vector.getFeatureOrder())
                .values(vector.getValues())
                .score(score.getScore())
                .threshold(score.getThreshold())
                .anomalous(score.isAnomalous())
                .modelId(score.getModelId())
                .modelTrainedAt(score.getModelTrainedAt())
                .build();
    }

    /**
     * Correlates every configured metric over the correlation window. Metrics the source
     * cannot serve are left out.
     */
    public CorrelationReport correlations() {
        Instant now = clock.instant();
        Map<String, MetricSnapshot> snapshots = new LinkedHashMap<>();
        for (String metric : properties.getMetrics()) {
            try {
                snapshots.put(metric, snapshotService.capture(metric, now));
            } catch (SourceUnavailableException e) {
                log.warn("Correlation leaves out {}: {}", metric, e.getMessage());
            }
        }
        return correlationAnalyzer.analyze(orchestrator.correlationSeries(snapshots),
                properties.getCorrelationThreshold(), now);
    }
}
