package io.opswatch.anomaly.repositories;

import io.opswatch.anomaly.model.entities.AnomalyEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.stream.Stream;

@Repository
public interface AnomalyEventRepository extends JpaRepository<AnomalyEventEntity, Long> {

    Stream<AnomalyEventEntity> findAllByMetricNameAndTsUtcGreaterThanEqualOrderByTsUtcAsc(String metricName, Instant since);

    long countByMetricName(String metricName);
}
