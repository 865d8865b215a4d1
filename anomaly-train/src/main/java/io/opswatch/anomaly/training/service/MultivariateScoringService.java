package io.opswatch.anomaly.training.service;

import io.opswatch.anomaly.training.dto.FeatureVector;
import io.opswatch.anomaly.training.dto.MultivariateScore;
import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import io.opswatch.anomaly.training.exception.ModelNotTrainedException;
import io.opswatch.anomaly.training.model.TrainedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MultivariateScoringService {

    private final ModelRegistryService modelRegistryService;

    /**
     * Scores a feature vector against the current model of its metric set.
     *
     * @throws ModelNotTrainedException when no model exists for the vector's feature order
     * @throws FeatureMismatchException when the vector does not match the model's feature order
     */
    public MultivariateScore score(FeatureVector vector) {
        ModelRegistryService.LoadedModel loaded = modelRegistryService.loadLatestModel(vector.getFeatureOrder())
                .orElseThrow(() -> new ModelNotTrainedException(
                        ModelRegistryService.metricSetKey(vector.getFeatureOrder())));
        TrainedModel model = loaded.model();
        if (!model.getFeatureOrder().equals(vector.getFeatureOrder())) {
            throw new FeatureMismatchException("Feature order " + vector.getFeatureOrder()
                    + " does not match model feature order " + model.getFeatureOrder());
        }
        double score = model.score(vector.getValues());
        boolean anomalous = model.isAnomalous(score);
        log.debug("Multivariate score={} threshold={} anomalous={} vector={}",
                score, model.getScoreThreshold(), anomalous, vector);
        return MultivariateScore.builder()
                .score(score)
                .threshold(model.getScoreThreshold())
                .anomalous(anomalous)
                .modelId(loaded.id())
                .modelTrainedAt(model.getTrainedAt())
                .build();
    }
}
