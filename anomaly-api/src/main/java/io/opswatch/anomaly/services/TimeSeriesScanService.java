package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.dto.ScanResultDto;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Long-window scan that scores every point against its trailing rolling mean and deviation.
 * Report only; nothing is persisted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeSeriesScanService {

    static final int MIN_SAMPLES = 10;
    static final int MAX_WINDOW = 24;
    static final int REPORTED = 5;
    private static final double EPSILON = 1e-6;

    private final MetricSource metricSource;
    private final AnomalyProperties properties;
    private final Clock clock;

    public ScanResultDto scan(String metricName, double sensitivity) {
        if (!(sensitivity > 0.0 && sensitivity <= 1.0)) {
            throw new IllegalArgumentException("sensitivity must be in (0, 1], was " + sensitivity);
        }
        AnomalyProperties.Training training = properties.getTraining();
        Instant end = clock.instant();
        List<MetricSample> samples = metricSource.queryRange(metricName,
                end.minus(Duration.ofDays(training.getWindowDays())), end,
                Duration.ofSeconds(training.getStepSeconds()));
        return scan(metricName, samples, sensitivity);
    }

    static ScanResultDto scan(String metricName, List<MetricSample> samples, double sensitivity) {
        if (samples.size() < MIN_SAMPLES) {
            throw new InsufficientDataException(String.format("%s has %d samples, scan needs %d",
                    metricName, samples.size(), MIN_SAMPLES));
        }
        double[] values = MetricSnapshot.values(samples);
        int window = Math.min(MAX_WINDOW, values.length / 4);
        double[] scores = scores(values, window);
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(scores, sensitivity * 100.0);

        List<ScanResultDto.ScanPoint> flagged = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > threshold) {
                flagged.add(ScanResultDto.ScanPoint.builder()
                        .timestamp(samples.get(i).getTimestamp())
                        .value(values[i])
                        .score(scores[i])
                        .build());
            }
        }
        log.debug("Scan of {}: {} points, window {}, threshold {}, {} flagged",
                metricName, values.length, window, threshold, flagged.size());
        return ScanResultDto.builder()
                .metricName(metricName)
                .samples(values.length)
                .window(window)
                .sensitivity(sensitivity)
                .threshold(threshold)
                .anomaliesFound(flagged.size())
                .latest(List.copyOf(flagged.subList(Math.max(0, flagged.size() - REPORTED), flagged.size())))
                .build();
    }

    /**
     * {@code |x - mean| / (std + 1e-6)} where the mean covers the {@code window} points ending at
     * x (the first full window before that) and the population deviation covers up to
     * {@code window + 1} points ending at x.
     */
    static double[] scores(double[] values, int window) {
        double[] scores = new double[values.length];
        double firstMean = StatUtils.mean(values, 0, window);
        for (int i = 0; i < values.length; i++) {
            double mean = i < window - 1 ? firstMean : StatUtils.mean(values, i - window + 1, window);
            int from = Math.max(0, i - window);
            double[] trailing = Arrays.copyOfRange(values, from, i + 1);
            double std = Math.sqrt(StatUtils.populationVariance(trailing));
            scores[i] = Math.abs(values[i] - mean) / (std + EPSILON);
        }
        return scores;
    }
}
