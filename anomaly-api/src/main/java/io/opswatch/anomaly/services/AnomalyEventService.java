package io.opswatch.anomaly.services;

import io.opswatch.anomaly.dto.AnomalyEventDto;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.model.entities.AnomalyEventEntity;
import io.opswatch.anomaly.repositories.AnomalyEventRepository;
import io.opswatch.anomaly.training.exception.AnomalyPersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only anomaly event log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyEventService {

    private final AnomalyEventRepository anomalyEventRepository;

    /**
     * The insert is flushed immediately, so constraint violations are reported by this call.
     *
     * @return the stored event id
     * @throws AnomalyPersistenceException when the store rejects the write
     */
    @Transactional
    public long append(AnomalyEvent event) {
        AnomalyEventEntity entity = new AnomalyEventEntity();
        entity.setMetricName(event.getMetricName());
        entity.setDetectorKind(event.getDetectorKind().code());
        entity.setSubtype(event.getSubtype().code());
        entity.setObservedValue(event.getObservedValue());
        entity.setBaselineValue(event.getBaselineValue());
        entity.setScore(event.getScore());
        entity.setTsUtc(event.getTimestamp());
        try {
            long id = anomalyEventRepository.saveAndFlush(entity).getId();
            log.debug("Stored anomaly event {} for {}", id, event.getMetricName());
            return id;
        } catch (DataAccessException e) {
            throw new AnomalyPersistenceException("Could not store " + event.getSubtype().code()
                    + " event for " + event.getMetricName(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<AnomalyEventDto> findByMetric(String metricName, Instant since) {
        List<AnomalyEventDto> events = new ArrayList<>();
        try (Stream<AnomalyEventEntity> stream =
                     anomalyEventRepository.findAllByMetricNameAndTsUtcGreaterThanEqualOrderByTsUtcAsc(metricName, since)) {
            stream.forEach(entity -> events.add(AnomalyEventDto.builder()
                    .metricName(entity.getMetricName())
                    .detectorKind(entity.getDetectorKind())
                    .subtype(entity.getSubtype())
                    .observedValue(entity.getObservedValue())
                    .baselineValue(entity.getBaselineValue())
                    .score(entity.getScore())
                    .timestamp(entity.getTsUtc())
                    .build()));
        }
        return events;
    }
}
