package io.opswatch.anomaly.notification;

import io.opswatch.anomaly.model.AnomalyEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes notifications to the application log. Used when no other sink is configured.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(String title, AnomalyEvent event) {
        log.warn("{} | metric={} type={} current={} baseline={} score={} timestamp={}",
                title,
                event.getMetricName(),
                event.getSubtype().code(),
                event.getObservedValue(),
                event.getBaselineValue(),
                event.getScore(),
                event.getTimestamp());
    }
}
