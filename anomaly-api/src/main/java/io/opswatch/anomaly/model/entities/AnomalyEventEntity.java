package io.opswatch.anomaly.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_anomaly_event", schema = "public",
        indexes = @Index(name = "idx_anomaly_event_metric_ts", columnList = "metric_name, ts_utc"))
public class AnomalyEventEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "anomaly_event_entity_seq_generator")
    @SequenceGenerator(name = "anomaly_event_entity_seq_generator", sequenceName = "anomaly_event_id_seq", allocationSize = 50)
    private Long id;

    @Column(name = "metric_name", nullable = false, length = 2048)
    private String metricName;

    @Column(name = "detector_kind", nullable = false, length = 16)
    private String detectorKind;

    @Column(name = "subtype", nullable = false, length = 32)
    private String subtype;

    @Column(name = "observed_value", nullable = false)
    private Double observedValue;

    @Column(name = "baseline_value", nullable = false)
    private Double baselineValue;

    @Column(name = "score", nullable = false)
    private Double score;

    @Column(name = "ts_utc", nullable = false)
    private Instant tsUtc;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    private void setCreatedAt() {
        this.createdAt = Instant.now();
    }
}
