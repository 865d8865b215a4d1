package io.opswatch.anomaly.detector;

import io.opswatch.anomaly.Series;
import io.opswatch.anomaly.TestThresholds;
import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.AnomalySubtype;
import io.opswatch.anomaly.model.DetectorKind;
import io.opswatch.anomaly.model.MetricSample;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatisticalDetectorTest {

    private static final Duration WINDOW = Duration.ofMinutes(60);

    private final StatisticalDetector detector = new StatisticalDetector();

    @Test
    void zScoreIsZeroWithoutSpread() {
        assertThat(StatisticalDetector.zScore(1_000.0, 5.0, 0.0)).isZero();
        assertThat(StatisticalDetector.zScore(8.0, 5.0, 1.5)).isEqualTo(2.0);
    }

    @Test
    void classifiesSpikeAndDrop() {
        MetricSample high = new MetricSample("m", Series.START, 20.0);
        MetricSample low = new MetricSample("m", Series.START, -20.0);

        Optional<AnomalyEvent> spike = detector.evaluate("m", high, 0.0, 5.0, 3.0);
        Optional<AnomalyEvent> drop = detector.evaluate("m", low, 0.0, 5.0, 3.0);

        assertThat(spike).get().satisfies(event -> {
            assertThat(event.getSubtype()).isEqualTo(AnomalySubtype.SPIKE);
            assertThat(event.getDetectorKind()).isEqualTo(DetectorKind.STATISTICAL);
            assertThat(event.getScore()).isEqualTo(4.0);
            assertThat(event.getBaselineValue()).isZero();
            assertThat(event.getTimestamp()).isEqualTo(Series.START);
        });
        assertThat(drop).get().extracting(AnomalyEvent::getSubtype).isEqualTo(AnomalySubtype.DROP);
        assertThat(detector.evaluate("m", new MetricSample("m", Series.START, 15.0), 0.0, 5.0, 3.0)).isEmpty();
    }

    @Test
    void constantSeriesNeverFlags() {
        for (double level : new double[]{0.0, 0.1, 7.3, 1e9}) {
            List<MetricSample> samples = Series.generate("m", 30, i -> level);
            assertThat(detector.detect(Series.snapshot(samples), WINDOW, TestThresholds.defaults())).isEmpty();
        }
    }

    @Test
    void growingOutlierFlipsToSpikeOnceAndStays() {
        boolean flagged = false;
        for (int outlier = 50; outlier <= 120; outlier++) {
            List<MetricSample> samples = new ArrayList<>(Series.spikeScenario("m").subList(0, 60));
            double value = outlier;
            samples.add(new MetricSample("m", Series.START.plus(Duration.ofMinutes(60)), value));

            boolean anomalous = detector.detect(Series.snapshot(samples), WINDOW, TestThresholds.defaults()).isPresent();
            if (flagged) {
                assertThat(anomalous).as("outlier %d", outlier).isTrue();
            }
            flagged = anomalous;
        }
        assertThat(flagged).isTrue();
    }

    @Test
    void judgesLatestSampleAgainstHistory() {
        Optional<AnomalyEvent> event = detector.detect(Series.snapshot(Series.spikeScenario("m")), WINDOW,
                TestThresholds.defaults());

        assertThat(event).get().satisfies(e -> {
            assertThat(e.getSubtype()).isEqualTo(AnomalySubtype.SPIKE);
            assertThat(e.getObservedValue()).isEqualTo(95.0);
            assertThat(e.getBaselineValue()).isBetween(45.0, 55.0);
        });
    }

    @Test
    void shortHistoryIsInsufficient() {
        List<MetricSample> samples = Series.generate("m", 5, i -> i);

        assertThatThrownBy(() -> detector.detect(Series.snapshot(samples), WINDOW, TestThresholds.defaults()))
                .isInstanceOf(InsufficientDataException.class);
    }
}
