package io.opswatch.anomaly.notification;

import io.opswatch.anomaly.model.AnomalyEvent;

/**
 * Delivery channel for detected anomalies. Delivery is best effort: the engine logs a failed
 * send and does not retry it.
 */
public interface NotificationSink {

    void send(String title, AnomalyEvent event);
}
