package io.opswatch.anomaly.services;

import io.opswatch.anomaly.correlation.CorrelationReport;
import io.opswatch.anomaly.model.AnomalyEvent;
import io.opswatch.anomaly.notification.NotificationSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyNotificationService {

    static final String UNPERSISTED_PREFIX = "[UNPERSISTED] ";

    private final NotificationSink notificationSink;

    public static String title(AnomalyEvent event, boolean persisted, CorrelationReport correlations) {
        StringBuilder title = new StringBuilder();
        if (!persisted) {
            title.append(UNPERSISTED_PREFIX);
        }
        title.append("Anomaly [").append(event.getDetectorKind().code()).append('/')
                .append(event.getSubtype().code()).append("] ").append(event.getMetricName());
        if (correlations != null) {
            List<String> coupled = correlations.coupledWith(event.getMetricName());
            if (!coupled.isEmpty()) {
                title.append(" (coupled with ").append(String.join(", ", coupled)).append(')');
            }
        }
        return title.toString();
    }

    /**
     * Forwards the event to the sink.
     *
     * @param correlations latest correlation report, may be null
     * @return whether the sink accepted it
     */
    public boolean notify(AnomalyEvent event, boolean persisted, CorrelationReport correlations) {
        String title = title(event, persisted, correlations);
        try {
            notificationSink.send(title, event);
            return true;
        } catch (RuntimeException e) {
            log.error("Notification '{}' failed, event {} at {} is not redelivered", title,
                    event.getMetricName(), event.getTimestamp(), e);
            return false;
        }
    }
}
