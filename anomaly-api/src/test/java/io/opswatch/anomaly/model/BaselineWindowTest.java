package io.opswatch.anomaly.model;

import io.opswatch.anomaly.Series;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BaselineWindowTest {

    @Test
    void summarizesSamples() {
        BaselineWindow window = BaselineWindow.of("m", Series.of("m", 2, 4, 4, 4, 5, 5, 7, 9));

        assertThat(window.size()).isEqualTo(8);
        assertThat(window.getMean()).isCloseTo(5.0, within(1e-12));
        // sample standard deviation, n - 1
        assertThat(window.getStdDev()).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
        assertThat(window.getP95()).isBetween(7.0, 9.0);
        assertThat(window.getP99()).isGreaterThanOrEqualTo(window.getP95());
    }

    @Test
    void evictsOldestFirst() {
        BaselineWindow window = new BaselineWindow("m", 3);
        Series.of("m", 1, 2, 3, 100).forEach(window::add);

        assertThat(window.size()).isEqualTo(3);
        assertThat(window.getSamples()).extracting(MetricSample::getValue).containsExactly(2.0, 3.0, 100.0);
        assertThat(window.getMean()).isCloseTo(35.0, within(1e-12));
    }

    @Test
    void singleSampleHasNoSpread() {
        BaselineWindow window = new BaselineWindow("m", 10);
        window.add(new MetricSample("m", Series.START, 42.0));

        assertThat(window.getMean()).isEqualTo(42.0);
        assertThat(window.getStdDev()).isZero();
    }

    @Test
    void emptyWindowHasNoStatistics() {
        BaselineWindow window = new BaselineWindow("m", 10);

        assertThat(window.isEmpty()).isTrue();
        assertThat(window.getMean()).isNaN();
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new BaselineWindow("m", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
