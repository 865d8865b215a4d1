package io.opswatch.anomaly.training.service;

import io.opswatch.anomaly.training.dto.FeatureMatrix;
import io.opswatch.anomaly.training.dto.FeatureVector;
import io.opswatch.anomaly.training.dto.MultivariateScore;
import io.opswatch.anomaly.training.dto.TrainingOptions;
import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import io.opswatch.anomaly.training.exception.ModelNotTrainedException;
import io.opswatch.anomaly.training.model.TrainedModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MultivariateScoringServiceTest {

    private static final List<String> FEATURES = List.of("cpu", "memory");
    private static TrainedModel model;

    @Mock
    private ModelRegistryService modelRegistryService;

    private MultivariateScoringService scoringService;

    @BeforeAll
    static void trainModel() {
        Random rnd = new Random(3);
        FeatureMatrix matrix = new FeatureMatrix(FEATURES);
        for (int i = 0; i < 500; i++) {
            matrix.addRow(Instant.EPOCH.plusSeconds(i), new double[]{50 + rnd.nextGaussian(), 100 + 2 * rnd.nextGaussian()});
        }
        model = new TrainIsolationForestService().train(matrix, TrainingOptions.builder().seed(11L).build());
    }

    @BeforeEach
    void setUp() {
        scoringService = new MultivariateScoringService(modelRegistryService);
    }

    @Test
    void scoresAgainstLatestModel() {
        when(modelRegistryService.loadLatestModel(FEATURES))
                .thenReturn(Optional.of(new ModelRegistryService.LoadedModel(9L, model)));

        MultivariateScore typical = scoringService.score(new FeatureVector(FEATURES, new double[]{50, 100}, Instant.now()));
        MultivariateScore extreme = scoringService.score(new FeatureVector(FEATURES, new double[]{100, 200}, Instant.now()));

        assertThat(typical.isAnomalous()).isFalse();
        assertThat(extreme.isAnomalous()).isTrue();
        assertThat(extreme.getScore()).isLessThan(typical.getScore());
        assertThat(extreme.getModelId()).isEqualTo(9L);
    }

    @Test
    void missingModelIsNotTrained() {
        when(modelRegistryService.loadLatestModel(FEATURES)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scoringService.score(new FeatureVector(FEATURES, new double[]{50, 100}, Instant.now())))
                .isInstanceOf(ModelNotTrainedException.class);
    }

    @Test
    void wrongLengthFailsAndLeavesModelUsable() {
        when(modelRegistryService.loadLatestModel(FEATURES))
                .thenReturn(Optional.of(new ModelRegistryService.LoadedModel(9L, model)));
        double thresholdBefore = model.getScoreThreshold();

        assertThatThrownBy(() -> scoringService.score(new FeatureVector(FEATURES, new double[]{50, 100, 7}, Instant.now())))
                .isInstanceOf(FeatureMismatchException.class);

        assertThat(model.getScoreThreshold()).isEqualTo(thresholdBefore);
        assertThat(scoringService.score(new FeatureVector(FEATURES, new double[]{50, 100}, Instant.now())).isAnomalous())
                .isFalse();
        verify(modelRegistryService, never()).save(any());
    }
}
