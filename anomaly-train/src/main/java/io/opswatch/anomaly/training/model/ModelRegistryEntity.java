package io.opswatch.anomaly.training.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_model_registry", schema = "public",
        indexes = @Index(name = "ix_model_registry_key_trained_at", columnList = "metric_set_key, trained_at"))
public class ModelRegistryEntity {

    @Id
    @Column(name = "model_id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "model_registry_entity_seq_generator")
    @SequenceGenerator(name = "model_registry_entity_seq_generator", sequenceName = "model_registry_id_seq", allocationSize = 1)
    private Long id;

    @Column(name = "metric_set_key", nullable = false, length = 64)
    private String metricSetKey;

    @Column(name = "feature_schema", nullable = false, length = Integer.MAX_VALUE)
    private String featureSchema;

    @Column(name = "trees", nullable = false)
    private Integer trees;

    @Column(name = "subsample", nullable = false)
    private Double subsample;

    @Column(name = "trained_rows", nullable = false)
    private Long trainedRows;

    @Column(name = "contamination_rate", nullable = false)
    private Double contaminationRate;

    @Column(name = "score_threshold", nullable = false)
    private Double scoreThreshold;

    @Column(name = "trained_at", nullable = false)
    private Instant trainedAt;

    @Column(name = "notes", length = Integer.MAX_VALUE)
    private String notes;

    @Column(name = "model_bytes", nullable = false)
    private byte[] modelBytes;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    public void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
