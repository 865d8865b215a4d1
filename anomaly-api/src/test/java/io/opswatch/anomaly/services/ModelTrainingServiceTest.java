package io.opswatch.anomaly.services;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.dto.TrainingResultDto;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.MetricSample;
import io.opswatch.anomaly.source.MetricSource;
import io.opswatch.anomaly.training.model.TrainedModel;
import io.opswatch.anomaly.training.service.ModelRegistryService;
import io.opswatch.anomaly.training.service.TrainIsolationForestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-09T00:00:00Z");

    @Mock
    private MetricSource metricSource;
    @Mock
    private ModelRegistryService modelRegistryService;

    private AnomalyProperties properties;
    private ModelTrainingService service;

    @BeforeEach
    void setUp() {
        properties = new AnomalyProperties();
        properties.setMetrics(List.of("cpu", "memory"));
        properties.getTraining().setEnsembleSize(25);
        service = new ModelTrainingService(metricSource, new TrainIsolationForestService(), modelRegistryService,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static List<MetricSample> history(String metric, int rows, long seed, double mean) {
        Random rnd = new Random(seed);
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            samples.add(new MetricSample(metric, NOW.minus(Duration.ofMinutes(5L * (rows - i))), mean + rnd.nextGaussian()));
        }
        return samples;
    }

    @Test
    void trainsOnAlignedHistoryAndRegistersModel() {
        Instant start = NOW.minus(Duration.ofDays(7));
        when(metricSource.queryRange("cpu", start, NOW, Duration.ofSeconds(300))).thenReturn(history("cpu", 200, 1, 40));
        // memory is missing its first 20 points
        when(metricSource.queryRange("memory", start, NOW, Duration.ofSeconds(300)))
                .thenReturn(history("memory", 200, 2, 70).subList(20, 200));
        when(modelRegistryService.save(any(TrainedModel.class))).thenReturn(3L);

        TrainingResultDto result = service.train();

        ArgumentCaptor<TrainedModel> saved = ArgumentCaptor.forClass(TrainedModel.class);
        verify(modelRegistryService).save(saved.capture());
        assertThat(saved.getValue().getFeatureOrder()).containsExactly("cpu", "memory");
        assertThat(result.getModelId()).isEqualTo(3L);
        assertThat(result.getTrainedRows()).isEqualTo(180);
        assertThat(result.getTrees()).isEqualTo(25);
        assertThat(result.getContaminationRate()).isEqualTo(0.05);
    }

    @Test
    void tooFewRowsIsInsufficient() {
        when(metricSource.queryRange(eq("cpu"), any(), any(), any())).thenReturn(history("cpu", 10, 1, 40));
        when(metricSource.queryRange(eq("memory"), any(), any(), any())).thenReturn(history("memory", 10, 2, 70));

        assertThatThrownBy(() -> service.train()).isInstanceOf(InsufficientDataException.class);
        verify(modelRegistryService, never()).save(any());
    }

    @Test
    void secondConcurrentTrainingIsRejected() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(metricSource.queryRange(anyString(), any(), any(), any())).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(10, TimeUnit.SECONDS);
            return List.of();
        });

        CompletableFuture<TrainingResultDto> first = CompletableFuture.supplyAsync(service::train);
        assertThat(fetching.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.train())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already in progress");

        release.countDown();
        // the first run ends on its own terms and frees the lock
        assertThatThrownBy(first::join).hasCauseInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> service.train()).isInstanceOf(InsufficientDataException.class);
    }
}
