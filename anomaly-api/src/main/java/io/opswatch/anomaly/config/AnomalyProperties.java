package io.opswatch.anomaly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration, bound once at startup and read-only afterwards.
 * <p>
 * Thresholds here are the global defaults; {@link #overrides} replaces any of them per metric.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    /** Metrics evaluated every cycle, also the default multivariate feature order. */
    @NotEmpty
    private List<String> metrics = new ArrayList<>();

    /** Feature order of the multivariate model; empty means {@link #metrics}. */
    private List<String> multivariateMetrics = new ArrayList<>();

    @Positive
    private double zScoreThreshold = 3.0;

    @Positive
    private int baselineWindowMinutes = 60;

    @Positive
    private int queryStepSeconds = 60;

    @Min(2)
    private int minBaselineSamples = 10;

    @Positive
    private double spikeChangePercent = 200.0;

    @Positive
    private int spikeDelaySeconds = 60;

    /** Slope in metric units per minute; a lower slope is degradation. */
    private double degradationSlopeThreshold = -1.0;

    @Positive
    private int degradationWindowMinutes = 60;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double oscillationCrossingFraction = 0.4;

    @Positive
    private int oscillationWindowMinutes = 30;

    @Min(3)
    private int oscillationMinSamples = 10;

    @Positive
    private double flatlineVarianceEpsilon = 1e-3;

    @Positive
    private int flatlineWindowMinutes = 10;

    @Min(2)
    private int flatlineMinSamples = 5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double correlationThreshold = 0.8;

    @Positive
    private int correlationWindowMinutes = 60;

    @Positive
    private int cycleIntervalSeconds = 60;

    @Positive
    private int correlationCycleMultiple = 10;

    /** Worker threads per cycle; 0 means the number of available processors. */
    @Min(0)
    private int concurrency = 0;

    private boolean schedulerEnabled = true;

    @Valid
    private final Training training = new Training();

    @Valid
    private final Source source = new Source();

    private Map<String, MetricOverrides> overrides = new HashMap<>();

    public List<String> featureOrder() {
        return multivariateMetrics.isEmpty() ? List.copyOf(metrics) : List.copyOf(multivariateMetrics);
    }

    public int effectiveConcurrency() {
        return concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Multivariate model training.
     */
    @Data
    public static class Training {
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("0.5")
        private double contaminationRate = 0.05;

        @Min(1)
        private int ensembleSize = 100;

        @Min(2)
        private int subsampleSize = 256;

        @Positive
        private int windowDays = 7;

        @Positive
        private int stepSeconds = 300;

        /** Days between scheduled retrainings. */
        @Positive
        private int intervalDays = 7;

        /** Minutes between training attempts while no model is stored. */
        @Positive
        private int retryMinutes = 60;

        @Min(2)
        private int minRows = 32;

        private long seed = 42L;
    }

    /**
     * Prometheus-compatible metric source.
     */
    @Data
    public static class Source {
        @NotBlank
        private String url = "http://localhost:9090";

        @Positive
        private int instantTimeoutSeconds = 10;

        @Positive
        private int rangeTimeoutSeconds = 30;
    }

    /**
     * Per-metric threshold overrides. Unset fields fall back to the global defaults.
     */
    @Data
    public static class MetricOverrides {
        private Double zScoreThreshold;
        private Double spikeChangePercent;
        private Double degradationSlopeThreshold;
        private Double oscillationCrossingFraction;
        private Double flatlineVarianceEpsilon;
    }
}
