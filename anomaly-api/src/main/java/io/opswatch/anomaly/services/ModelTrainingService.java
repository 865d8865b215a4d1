package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.correlation.SeriesAligner;
import io.opswatch.anomaly.dto.TrainingResultDto;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.source.MetricSource;
import io.opswatch.anomaly.training.dto.FeatureMatrix;
import io.opswatch.anomaly.training.dto.TrainingOptions;
import io.opswatch.anomaly.training.model.TrainedModel;
import io.opswatch.anomaly.training.service.ModelRegistryService;
import io.opswatch.anomaly.training.service.TrainIsolationForestService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trains the multivariate model from the metric source history and registers it. Scorers keep
 * using the previous model until the new registry row is committed.
 */
@Slf4j
@Service
public class ModelTrainingService {

    private final MetricSource metricSource;
    private final TrainIsolationForestService trainService;
    private final ModelRegistryService modelRegistryService;
    private final AnomalyProperties properties;
    private final Clock clock;
    private final Lock trainingLock = new ReentrantLock();

    public ModelTrainingService(MetricSource metricSource,
                                TrainIsolationForestService trainService,
                                ModelRegistryService modelRegistryService,
                                AnomalyProperties properties,
                                Clock clock) {
        this.metricSource = metricSource;
        this.trainService = trainService;
        this.modelRegistryService = modelRegistryService;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean hasModel() {
        return modelRegistryService.loadLatestModel(properties.featureOrder()).isPresent();
    }

    /**
     * @throws IllegalStateException     when another training is running
     * @throws InsufficientDataException when the history yields fewer rows than configured
     */
    public TrainingResultDto train() {
        if (!trainingLock.tryLock()) {
            throw new IllegalStateException("Model training already in progress");
        }
        try {
            return doTrain();
        } finally {
            trainingLock.unlock();
        }
    }

    private TrainingResultDto doTrain() {
        AnomalyProperties.Training training = properties.getTraining();
        List<String> featureOrder = properties.featureOrder();
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(training.getWindowDays()));
        Duration step = Duration.ofSeconds(training.getStepSeconds());

        Map<String, List<MetricSample>> history = new LinkedHashMap<>();
        for (String feature : featureOrder) {
            history.put(feature, metricSource.queryRange(feature, start, end, step));
        }
        FeatureMatrix matrix = SeriesAligner.toFeatureMatrix(featureOrder, history);
        if (matrix.rowCount() < training.getMinRows()) {
            throw new InsufficientDataException(String.format("Only %d aligned training rows for %s, %d required",
                    matrix.rowCount(), featureOrder, training.getMinRows()));
        }

        TrainedModel model = trainService.train(matrix, TrainingOptions.builder()
                .ensembleSize(training.getEnsembleSize())
                .contaminationRate(training.getContaminationRate())
                .subsampleSize(training.getSubsampleSize())
                .seed(training.getSeed())
                .build());
        long modelId = modelRegistryService.save(model);
        log.info("Trained multivariate model {} on {} rows, threshold {}", modelId,
                model.getTrainedRows(), model.getScoreThreshold());
        return TrainingResultDto.builder()
                .modelId(modelId)
                .featureOrder(model.getFeatureOrder())
                .trainedRows(model.getTrainedRows())
                .trees(model.getTrees())
                .contaminationRate(model.getContaminationRate())
                .scoreThreshold(model.getScoreThreshold())
                .trainedAt(model.getTrainedAt())
                .build();
    }
}
