package io.opswatch.anomaly.model;

import io.opswatch.anomaly.Series;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricSnapshotTest {

    @Test
    void ordersSamplesByTime() {
        List<MetricSample> shuffled = new ArrayList<>(Series.of("m", 1, 2, 3, 4));
        Collections.reverse(shuffled);

        MetricSnapshot snapshot = Series.snapshot(shuffled);

        assertThat(snapshot.latest()).map(MetricSample::getValue).contains(4.0);
        assertThat(snapshot.history()).extracting(MetricSample::getValue).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void tailKeepsWindowEndingAtLatest() {
        MetricSnapshot snapshot = Series.snapshot(Series.generate("m", 20, i -> i));

        // inclusive on both ends: minutes 9..19
        assertThat(snapshot.tail(Duration.ofMinutes(10))).hasSize(11)
                .first().extracting(MetricSample::getValue).isEqualTo(9.0);
    }

    @Test
    void atFindsLatestSampleNotAfterInstant() {
        MetricSnapshot snapshot = Series.snapshot(Series.generate("m", 5, i -> i * 10));

        assertThat(snapshot.at(Series.START.plus(Duration.ofSeconds(150)))).map(MetricSample::getValue).contains(20.0);
        assertThat(snapshot.at(Series.START.minusSeconds(1))).isEmpty();
    }

    @Test
    void emptySnapshot() {
        MetricSnapshot snapshot = Series.snapshot(List.of());

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.latest()).isEmpty();
        assertThat(snapshot.history()).isEmpty();
        assertThat(snapshot.tail(Duration.ofMinutes(5))).isEmpty();
    }
}
