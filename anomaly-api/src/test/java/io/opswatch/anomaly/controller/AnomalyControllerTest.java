package io.opswatch.anomaly.controller;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.dto.AnomalyEventDto;
import io.opswatch.anomaly.dto.DetectionResultDto;
import io.opswatch.anomaly.dto.TrainingResultDto;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.orchestrator.DetectionOrchestrator;
import io.opswatch.anomaly.services.AnomalyEventService;
import io.opswatch.anomaly.services.BaselineService;
import io.opswatch.anomaly.services.ModelTrainingService;
import io.opswatch.anomaly.services.OnDemandDetectionService;
import io.opswatch.anomaly.services.TimeSeriesScanService;
import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import io.opswatch.anomaly.training.exception.ModelNotTrainedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    private static final Instant TS = Instant.parse("2026-03-02T11:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OnDemandDetectionService onDemandDetectionService;
    @MockBean
    private ModelTrainingService modelTrainingService;
    @MockBean
    private DetectionOrchestrator orchestrator;
    @MockBean
    private BaselineService baselineService;
    @MockBean
    private TimeSeriesScanService scanService;
    @MockBean
    private AnomalyEventService eventService;
    @MockBean
    private AnomalyProperties properties;

    @Test
    void trainReturnsModelSummary() throws Exception {
        when(modelTrainingService.train()).thenReturn(TrainingResultDto.builder()
                .modelId(12L).featureOrder(List.of("cpu", "memory")).trainedRows(2016).trees(100)
                .contaminationRate(0.05).scoreThreshold(0.61).trainedAt(TS).build());

        mockMvc.perform(post("/api/v1/anomaly/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelId").value(12))
                .andExpect(jsonPath("$.featureOrder[1]").value("memory"))
                .andExpect(jsonPath("$.trainedRows").value(2016));
    }

    @Test
    void trainingInProgressIsConflict() throws Exception {
        when(modelTrainingService.train()).thenThrow(new IllegalStateException("Model training already in progress"));

        mockMvc.perform(post("/api/v1/anomaly/train"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Model training already in progress"));
    }

    @Test
    void detectReturnsEvents() throws Exception {
        when(onDemandDetectionService.detectStatistical("node_load1")).thenReturn(DetectionResultDto.builder()
                .metricName("node_load1")
                .events(List.of(AnomalyEventDto.builder().metricName("node_load1").detectorKind("statistical")
                        .subtype("spike").observedValue(95).baselineValue(50).score(12.6).timestamp(TS).build()))
                .skipped(Map.of())
                .build());

        mockMvc.perform(get("/api/v1/anomaly/detect/node_load1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].subtype").value("spike"))
                .andExpect(jsonPath("$.events[0].observedValue").value(95.0));
    }

    @Test
    void insufficientDataIsNotFound() throws Exception {
        when(onDemandDetectionService.detectPatterns("node_load1"))
                .thenThrow(new InsufficientDataException("No samples for node_load1"));

        mockMvc.perform(get("/api/v1/anomaly/patterns/node_load1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void untrainedModelIsConflict() throws Exception {
        when(onDemandDetectionService.scoreCurrent()).thenThrow(new ModelNotTrainedException("1a2b"));

        mockMvc.perform(get("/api/v1/anomaly/ml")).andExpect(status().isConflict());
    }

    @Test
    void featureMismatchIsUnprocessable() throws Exception {
        when(onDemandDetectionService.scoreCurrent()).thenThrow(new FeatureMismatchException("expects 3 features"));

        mockMvc.perform(get("/api/v1/anomaly/ml")).andExpect(status().isUnprocessableEntity());
    }

    @Test
    void sourceOutageIsServiceUnavailable() throws Exception {
        when(onDemandDetectionService.correlations()).thenThrow(new SourceUnavailableException("connection refused"));

        mockMvc.perform(get("/api/v1/anomaly/correlations")).andExpect(status().isServiceUnavailable());
    }

    @Test
    void badSensitivityIsBadRequest() throws Exception {
        when(scanService.scan(eq("node_load1"), anyDouble()))
                .thenThrow(new IllegalArgumentException("sensitivity must be in (0, 1], was 2.0"));

        mockMvc.perform(get("/api/v1/anomaly/scan/node_load1").param("sensitivity", "2"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void eventsSinceInstant() throws Exception {
        when(eventService.findByMetric("node_load1", TS)).thenReturn(List.of(AnomalyEventDto.builder()
                .metricName("node_load1").detectorKind("flatline").subtype("flatline").timestamp(TS).build()));

        mockMvc.perform(get("/api/v1/anomaly/events/node_load1").param("since", "2026-03-02T11:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].detectorKind").value("flatline"));
    }
}
