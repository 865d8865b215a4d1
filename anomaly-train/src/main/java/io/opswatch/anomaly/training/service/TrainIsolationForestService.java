package io.opswatch.anomaly.training.service;

import io.opswatch.anomaly.training.dto.FeatureMatrix;
import io.opswatch.anomaly.training.dto.TrainingOptions;
import io.opswatch.anomaly.training.model.ScalerParams;
import io.opswatch.anomaly.training.model.TrainedModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

/**
 * Fits a standard scaler and an isolation forest on a feature matrix, then calibrates
 * the anomaly threshold from the contamination rate on the training scores.
 */
@Slf4j
@Component
public class TrainIsolationForestService {

    private final Clock clock;

    public TrainIsolationForestService() {
        this(Clock.systemUTC());
    }

    TrainIsolationForestService(Clock clock) {
        this.clock = clock;
    }

    public TrainedModel train(FeatureMatrix matrix, TrainingOptions options) {
        options.validate();
        if (matrix.rowCount() < 2) {
            throw new IllegalArgumentException("At least 2 training rows are required, got " + matrix.rowCount());
        }
        double[][] trainingData = matrix.toArray();
        ScalerParams scaler = ScalerParams.fit(trainingData);
        double[][] scaled = scaler.transform(trainingData);

        // sampling_rate = min(1.0, subsample / n)
        double samplingRate = Math.min(1.0, options.getSubsampleSize() / (double) scaled.length);
        int sampleSize = (int) Math.max(2, Math.round(samplingRate * scaled.length));
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2.0));
        log.info("Training isolation forest: rows={}, features={}, trees={}, samplingRate={}, maxDepth={}",
                scaled.length, matrix.getFeatureOrder().size(), options.getEnsembleSize(), samplingRate, maxDepth);

        IsolationForest forest = fitSeeded(scaled, options, maxDepth, samplingRate);

        TrainedModel unCalibrated = TrainedModel.builder()
                .forest(forest)
                .featureOrder(matrix.getFeatureOrder())
                .scalerParams(scaler)
                .build();
        double[] scores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            scores[i] = unCalibrated.score(trainingData[i]);
        }
        double threshold = lowerPercentile(scores, options.getContaminationRate());
        log.info("Calibrated threshold (lower=worse): contamination={}, threshold={}",
                options.getContaminationRate(), threshold);

        return TrainedModel.builder()
                .forest(forest)
                .featureOrder(matrix.getFeatureOrder())
                .scalerParams(scaler)
                .contaminationRate(options.getContaminationRate())
                .scoreThreshold(threshold)
                .subsampleRate(samplingRate)
                .trainedRows(scaled.length)
                .trainedAt(Instant.now(clock))
                .build();
    }

    /**
     * Smile builds trees on a parallel stream drawing from thread-local generators, so the fit runs
     * in a single-worker pool whose only thread is seeded first.
     */
    private static IsolationForest fitSeeded(double[][] scaled, TrainingOptions options, int maxDepth,
                                             double samplingRate) {
        ForkJoinPool pool = new ForkJoinPool(1);
        try {
            return pool.submit(() -> {
                MathEx.setSeed(options.getSeed());
                return IsolationForest.fit(scaled, options.getEnsembleSize(), maxDepth, samplingRate, 0);
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fitting the isolation forest", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Isolation forest fit failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * The score below which {@code fraction} of the training scores fall.
     */
    static double lowerPercentile(double[] scores, double fraction) {
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        return sorted[(int) Math.floor(fraction * (sorted.length - 1))];
    }
}
