package io.opswatch.anomaly.orchestrator;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.config.MetricThresholds;
import io.opswatch.anomaly.correlation.CorrelationAnalyzer;
import io.opswatch.anomaly.correlation.CorrelationReport;
import io.opswatch.anomaly.detector.StatisticalDetector;
import io.opswatch.anomaly.detector.pattern.PatternDetector;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.services.AnomalyEventService;
import io.opswatch.anomaly.services.AnomalyNotificationService;
import io.opswatch.anomaly.services.MetricSnapshotService;
import io.opswatch.anomaly.services.MultivariateDetectionService;
import io.opswatch.anomaly.services.ThresholdService;
import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import io.opswatch.anomaly.training.exception.ModelNotTrainedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs one detection cycle: snapshot every metric once, run the statistical and pattern
 * detectors per metric on the worker pool, score the multivariate model, run the correlation
 * analyzer every Nth cycle, then persist and notify each event.
 * <p>
 * A failing detector is logged and recorded as skipped; it never aborts the cycle. Cycles
 * are serialized.
 */
@Slf4j
@Service
public class DetectionOrchestrator {

    static final String STATISTICAL = "statistical";
    static final String MULTIVARIATE = "multivariate";
    static final String CORRELATION = "correlation";
    static final String COLLECTION = "collection";

    private final MetricSnapshotService snapshotService;
    private final ThresholdService thresholdService;
    private final StatisticalDetector statisticalDetector;
    private final List<PatternDetector> patternDetectors;
    private final MultivariateDetectionService multivariateDetectionService;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final AnomalyEventService anomalyEventService;
    private final AnomalyNotificationService notificationService;
    private final AnomalyProperties properties;
    private final ExecutorService detectionExecutor;
    private final Clock clock;

    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicReference<CorrelationReport> latestCorrelation = new AtomicReference<>();
    private final ReentrantLock cycleLock = new ReentrantLock();

    public DetectionOrchestrator(MetricSnapshotService snapshotService,
                                 ThresholdService thresholdService,
                                 StatisticalDetector statisticalDetector,
                                 List<PatternDetector> patternDetectors,
                                 MultivariateDetectionService multivariateDetectionService,
                                 CorrelationAnalyzer correlationAnalyzer,
                                 AnomalyEventService anomalyEventService,
                                 AnomalyNotificationService notificationService,
                                 AnomalyProperties properties,
                                 @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
                                 Clock clock) {
        this.snapshotService = snapshotService;
        this.thresholdService = thresholdService;
        this.statisticalDetector = statisticalDetector;
        this.patternDetectors = List.copyOf(patternDetectors);
        this.multivariateDetectionService = multivariateDetectionService;
        this.correlationAnalyzer = correlationAnalyzer;
        this.anomalyEventService = anomalyEventService;
        this.notificationService = notificationService;
        this.properties = properties;
        this.detectionExecutor = detectionExecutor;
        this.clock = clock;
    }

    public CycleState getState() {
        return state.get();
    }

    public Optional<CorrelationReport> getLatestCorrelation() {
        return Optional.ofNullable(latestCorrelation.get());
    }

    public CycleReport runCycle() {
        cycleLock.lock();
        try {
            long cycle = cycles.incrementAndGet();
            Instant startedAt = clock.instant();
            log.info("Detection cycle {} started", cycle);
            List<SkippedDetection> skipped = new ArrayList<>();
            try {
                state.set(CycleState.COLLECTING);
                Map<String, MetricSnapshot> snapshots = collect(startedAt, skipped);

                state.set(CycleState.DETECTING);
                List<AnomalyEvent> events = new ArrayList<>(detect(snapshots, skipped));
                detectMultivariate(snapshots, startedAt, skipped).ifPresent(events::add);
                CorrelationReport correlationReport = null;
                if (cycle % properties.getCorrelationCycleMultiple() == 0) {
                    correlationReport = correlate(snapshots, startedAt, skipped);
                }

                state.set(CycleState.REPORTING);
                int persisted = 0;
                int notified = 0;
                CorrelationReport context = latestCorrelation.get();
                for (AnomalyEvent event : events) {
                    log.info("Anomaly {} [{}/{}] observed={} baseline={} score={} at {}", event.getMetricName(),
                            event.getDetectorKind().code(), event.getSubtype().code(), event.getObservedValue(),
                            event.getBaselineValue(), event.getScore(), event.getTimestamp());
                    boolean stored = persist(event);
                    if (stored) {
                        persisted++;
                    }
                    if (notificationService.notify(event, stored, context)) {
                        notified++;
                    }
                }
                Instant finishedAt = clock.instant();
                log.info("Detection cycle {} finished: {} events, {} persisted, {} notified, {} skipped",
                        cycle, events.size(), persisted, notified, skipped.size());
                return CycleReport.builder()
                        .cycle(cycle)
                        .startedAt(startedAt)
                        .finishedAt(finishedAt)
                        .events(List.copyOf(events))
                        .skipped(List.copyOf(skipped))
                        .persisted(persisted)
                        .notified(notified)
                        .correlationReport(correlationReport)
                        .build();
            } finally {
                state.set(CycleState.IDLE);
            }
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Snapshots every configured metric once, in parallel. Metrics the source cannot serve are
     * recorded as skipped and left out of the result.
     */
    Map<String, MetricSnapshot> collect(Instant at, List<SkippedDetection> skipped) {
        List<String> metrics = properties.getMetrics();
        List<Callable<MetricSnapshot>> tasks = new ArrayList<>();
        for (String metric : metrics) {
            tasks.add(() -> snapshotService.capture(metric, at));
        }
        List<Future<MetricSnapshot>> futures = invokeAll(tasks);
        Map<String, MetricSnapshot> snapshots = new LinkedHashMap<>();
        for (int i = 0; i < metrics.size(); i++) {
            String metric = metrics.get(i);
            try {
                MetricSnapshot snapshot = futures.get(i).get();
                if (snapshot.isEmpty()) {
                    skip(skipped, metric, COLLECTION, "no samples in the snapshot window");
                } else {
                    snapshots.put(metric, snapshot);
                }
            } catch (ExecutionException e) {
                skip(skipped, metric, COLLECTION, String.valueOf(e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while collecting " + metric, e);
            }
        }
        return snapshots;
    }

    /**
     * Statistical and pattern detection over the snapshots, one worker task per metric. Events
     * come back in metric order, then detector order.
     */
    public List<AnomalyEvent> detect(Map<String, MetricSnapshot> snapshots, List<SkippedDetection> skipped) {
        List<MetricSnapshot> ordered = new ArrayList<>(snapshots.values());
        List<Callable<MetricOutcome>> tasks = new ArrayList<>();
        for (MetricSnapshot snapshot : ordered) {
            tasks.add(() -> evaluate(snapshot));
        }
        List<Future<MetricOutcome>> futures = invokeAll(tasks);
        List<AnomalyEvent> events = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            try {
                MetricOutcome outcome = futures.get(i).get();
                events.addAll(outcome.events());
                skipped.addAll(outcome.skipped());
            } catch (ExecutionException e) {
                log.error("Detection of {} failed", ordered.get(i).getMetricName(), e.getCause());
                skipped.add(new SkippedDetection(ordered.get(i).getMetricName(), "all",
                        String.valueOf(e.getCause().getMessage())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while detecting " + ordered.get(i).getMetricName(), e);
            }
        }
        return events;
    }

    MetricOutcome evaluate(MetricSnapshot snapshot) {
        String metric = snapshot.getMetricName();
        MetricThresholds thresholds = thresholdService.forMetric(metric);
        Duration baselineWindow = Duration.ofMinutes(properties.getBaselineWindowMinutes());
        List<AnomalyEvent> events = new ArrayList<>();
        List<SkippedDetection> skipped = new ArrayList<>();
        runDetector(metric, STATISTICAL,
                () -> statisticalDetector.detect(snapshot, baselineWindow, thresholds), events, skipped);
        for (PatternDetector detector : patternDetectors) {
            runDetector(metric, detector.kind().code(), () -> detector.detect(snapshot, thresholds), events, skipped);
        }
        return new MetricOutcome(events, skipped);
    }

    private void runDetector(String metric, String detector, Supplier<Optional<AnomalyEvent>> run,
                             List<AnomalyEvent> events, List<SkippedDetection> skipped) {
        try {
            run.get().ifPresent(events::add);
        } catch (InsufficientDataException e) {
            skip(skipped, metric, detector, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Detector {} failed on {}", detector, metric, e);
            skipped.add(new SkippedDetection(metric, detector, String.valueOf(e.getMessage())));
        }
    }

    private Optional<AnomalyEvent> detectMultivariate(Map<String, MetricSnapshot> snapshots, Instant at,
                                                      List<SkippedDetection> skipped) {
        String featureSet = String.join(",", properties.featureOrder());
        try {
            return multivariateDetectionService.detect(snapshots, at);
        } catch (ModelNotTrainedException | SourceUnavailableException e) {
            skip(skipped, featureSet, MULTIVARIATE, e.getMessage());
        } catch (FeatureMismatchException e) {
            log.error("Multivariate model does not fit the configured features, retrain it: {}", e.getMessage());
            skipped.add(new SkippedDetection(featureSet, MULTIVARIATE, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Multivariate detection failed", e);
            skipped.add(new SkippedDetection(featureSet, MULTIVARIATE, String.valueOf(e.getMessage())));
        }
        return Optional.empty();
    }

    private CorrelationReport correlate(Map<String, MetricSnapshot> snapshots, Instant at,
                                        List<SkippedDetection> skipped) {
        try {
            CorrelationReport report = correlationAnalyzer.analyze(correlationSeries(snapshots),
                    properties.getCorrelationThreshold(), at);
            latestCorrelation.set(report);
            return report;
        } catch (RuntimeException e) {
            log.error("Correlation analysis failed", e);
            skipped.add(new SkippedDetection("*", CORRELATION, String.valueOf(e.getMessage())));
            return null;
        }
    }

    public Map<String, List<MetricSample>> correlationSeries(Map<String, MetricSnapshot> snapshots) {
        Duration window = Duration.ofMinutes(properties.getCorrelationWindowMinutes());
        Map<String, List<MetricSample>> series = new LinkedHashMap<>();
        snapshots.forEach((metric, snapshot) -> series.put(metric, snapshot.tail(window)));
        return series;
    }

    private boolean persist(AnomalyEvent event) {
        try {
            anomalyEventService.append(event);
            return true;
        } catch (RuntimeException e) {
            // includes transaction failures thrown by the proxy before the service body runs
            log.error("Anomaly event for {} at {} was not persisted, notifying anyway",
                    event.getMetricName(), event.getTimestamp(), e);
            return false;
        }
    }

    private <T> List<Future<T>> invokeAll(List<Callable<T>> tasks) {
        try {
            return detectionExecutor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for detection workers", e);
        }
    }

    private static void skip(List<SkippedDetection> skipped, String metric, String detector, String reason) {
        log.warn("Skipped {} on {}: {}", detector, metric, reason);
        skipped.add(new SkippedDetection(metric, detector, reason));
    }

    record MetricOutcome(List<AnomalyEvent> events, List<SkippedDetection> skipped) {
    }
}
