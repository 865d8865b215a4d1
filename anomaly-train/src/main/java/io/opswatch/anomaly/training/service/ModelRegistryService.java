package io.opswatch.anomaly.training.service;

import io.opswatch.anomaly.training.exception.AnomalyPersistenceException;
import io.opswatch.anomaly.training.model.ModelRegistryEntity;
import io.opswatch.anomaly.training.model.TrainedModel;
import io.opswatch.anomaly.training.repository.ModelRegistryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable storage of trained models, one current model per metric set.
 * <p>
 * Saving inserts a new registry row; the latest {@code trained_at} wins, so a reader either
 * sees the previous model or the complete new one. Deserialized models are cached by row id
 * and reloaded only when a newer row appears.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private final ModelRegistryRepository modelRegistryRepository;
    private final ConcurrentMap<String, CachedModel> cache = new ConcurrentHashMap<>();

    public static String metricSetKey(List<String> featureOrder) {
        return Integer.toHexString(featureSchema(featureOrder).hashCode());
    }

    public static String featureSchema(List<String> featureOrder) {
        return String.join(",", featureOrder);
    }

    @Transactional
    public long save(TrainedModel model) {
        String key = metricSetKey(model.getFeatureOrder());
        byte[] bytes;
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
             ObjectOutputStream oos = new ObjectOutputStream(bos)) {
            oos.writeObject(model);
            oos.flush();
            bytes = bos.toByteArray();
        } catch (IOException e) {
            throw new AnomalyPersistenceException("Failed to serialize model for metric set " + key, e);
        }

        ModelRegistryEntity entity = new ModelRegistryEntity();
        entity.setMetricSetKey(key);
        entity.setFeatureSchema(featureSchema(model.getFeatureOrder()));
        entity.setTrees(model.getTrees());
        entity.setSubsample(model.getSubsampleRate());
        entity.setTrainedRows(model.getTrainedRows());
        entity.setContaminationRate(model.getContaminationRate());
        entity.setScoreThreshold(model.getScoreThreshold());
        entity.setTrainedAt(model.getTrainedAt());
        entity.setNotes("Isolation forest trained from " + model.getTrainedRows() + " feature vectors");
        entity.setModelBytes(bytes);
        try {
            ModelRegistryEntity saved = modelRegistryRepository.save(entity);
            cache.put(key, new CachedModel(saved.getId(), model));
            log.info("Model {} saved for metric set {} ({} bytes)", saved.getId(), key, bytes.length);
            return saved.getId();
        } catch (DataAccessException e) {
            throw new AnomalyPersistenceException("Failed to save model for metric set " + key, e);
        }
    }

    /**
     * The current model of a metric set, if one has been trained.
     */
    @Transactional(readOnly = true)
    public Optional<LoadedModel> loadLatestModel(List<String> featureOrder) {
        String key = metricSetKey(featureOrder);
        try {
            Optional<Long> latestId = modelRegistryRepository.findLatestModelId(key);
            if (latestId.isEmpty()) {
                return Optional.empty();
            }
            CachedModel cached = cache.get(key);
            if (cached != null && cached.id() == latestId.get()) {
                return Optional.of(new LoadedModel(cached.id(), cached.model()));
            }
            Optional<ModelRegistryEntity> optionalEntity = modelRegistryRepository.findLatestModel(key);
            if (optionalEntity.isEmpty()) {
                return Optional.empty();
            }
            ModelRegistryEntity entity = optionalEntity.get();
            TrainedModel model = deserialize(entity);
            cache.put(key, new CachedModel(entity.getId(), model));
            log.info("Loaded model {} for metric set {} trained at {}", entity.getId(), key, entity.getTrainedAt());
            return Optional.of(new LoadedModel(entity.getId(), model));
        } catch (DataAccessException e) {
            throw new AnomalyPersistenceException("Failed to read model for metric set " + key, e);
        }
    }

    private TrainedModel deserialize(ModelRegistryEntity entity) {
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(entity.getModelBytes()))) {
            return (TrainedModel) ois.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new AnomalyPersistenceException("Failed to deserialize model " + entity.getId(), e);
        }
    }

    public record LoadedModel(long id, TrainedModel model) {
    }

    private record CachedModel(long id, TrainedModel model) {
    }
}
