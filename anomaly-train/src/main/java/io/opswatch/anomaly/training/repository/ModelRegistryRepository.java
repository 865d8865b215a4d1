package io.opswatch.anomaly.training.repository;

import io.opswatch.anomaly.training.model.ModelRegistryEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ModelRegistryRepository extends CrudRepository<ModelRegistryEntity, Long> {

    @Query("SELECT e FROM ModelRegistryEntity e WHERE e.metricSetKey = :key ORDER BY e.trainedAt DESC, e.id DESC LIMIT 1")
    Optional<ModelRegistryEntity> findLatestModel(@Param("key") String metricSetKey);

    @Query("SELECT e.id FROM ModelRegistryEntity e WHERE e.metricSetKey = :key ORDER BY e.trainedAt DESC, e.id DESC LIMIT 1")
    Optional<Long> findLatestModelId(@Param("key") String metricSetKey);
}
