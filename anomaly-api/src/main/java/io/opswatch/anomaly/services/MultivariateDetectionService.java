package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.model.MetricSnapshot;
import io.opswatch.anomaly.source.MetricSource;
import io.opswatch.anomaly.training.dto.FeatureVector;
import io.opswatch.anomaly.training.dto.MultivariateScore;
import io.opswatch.anomaly.training.service.ModelRegistryService;
import io.opswatch.anomaly.training.service.MultivariateScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the current feature vector of the multivariate metric set and scores it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultivariateDetectionService {

    private final MetricSource metricSource;
    private final MultivariateScoringService scoringService;
    private final AnomalyProperties properties;

    /**
     * Latest snapshot value per feature; features without a snapshot are read instantly.
     */
    public FeatureVector currentVector(Map<String, MetricSnapshot> snapshots, Instant at) {
        List<String> featureOrder = properties.featureOrder();
        double[] values = new double[featureOrder.size()];
        for (int i = 0; i < featureOrder.size(); i++) {
            String feature = featureOrder.get(i);
            MetricSnapshot snapshot = snapshots.get(feature);
            Optional<MetricSample> latest = snapshot == null ? Optional.empty() : snapshot.latest();
            values[i] = latest.isPresent() ? latest.get().getValue() : metricSource.queryInstant(feature);
        }
        return new FeatureVector(featureOrder, values, at);
    }

    /**
     * @throws io.opswatch.anomaly.training.exception.ModelNotTrainedException when no model exists yet
     * @throws io.opswatch.anomaly.training.exception.FeatureMismatchException when the model was
     *                                                                        trained on other features
     */
    public Optional<AnomalyEvent> detect(Map<String, MetricSnapshot> snapshots, Instant at) {
        FeatureVector vector = currentVector(snapshots, at);
        MultivariateScore score = scoringService.score(vector);
        if (!score.isAnomalous()) {
            return Optional.empty();
        }
        log.info("Multivariate outlier: score {} below threshold {} (model {})",
                score.getScore(), score.getThreshold(), score.getModelId());
        return Optional.of(AnomalyEvent.builder()
                .metricName(ModelRegistryService.featureSchema(vector.getFeatureOrder()))
                .detectorKind(DetectorKind.MULTIVARIATE)
                .subtype(AnomalySubtype.MULTIVARIATE_OUTLIER)
                .observedValue(score.getScore())
                .baselineValue(score.getThreshold())
                .score(score.getScore())
                .timestamp(at)
                .build());
    }
}
