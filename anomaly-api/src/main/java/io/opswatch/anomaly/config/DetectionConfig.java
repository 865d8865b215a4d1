package io.opswatch.anomaly.config;

import io.opswatch.anomaly.notification.LoggingNotificationSink;
import io.opswatch.anomaly.notification.NotificationSink;
import io.opswatch.anomaly.source.MetricSource;
import io.opswatch.anomaly.source.PrometheusMetricSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(AnomalyProperties.class)
public class DetectionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MetricSource.class)
    public MetricSource metricSource(AnomalyProperties properties, RestTemplateBuilder restTemplateBuilder) {
        AnomalyProperties.Source source = properties.getSource();
        Duration instantTimeout = Duration.ofSeconds(source.getInstantTimeoutSeconds());
        Duration rangeTimeout = Duration.ofSeconds(source.getRangeTimeoutSeconds());
        return new PrometheusMetricSource(source.getUrl(),
                restTemplateBuilder.setConnectTimeout(instantTimeout).setReadTimeout(instantTimeout).build(),
                restTemplateBuilder.setConnectTimeout(rangeTimeout).setReadTimeout(rangeTimeout).build());
    }

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(AnomalyProperties properties) {
        return Executors.newFixedThreadPool(properties.effectiveConcurrency(),
                new CustomizableThreadFactory("anomaly-worker-"));
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }
}
