package io.opswatch.anomaly.orchestrator;

import io.opswatch.anomaly.config.AnomalyProperties;
import io.opswatch.anomaly.services.ModelTrainingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Drives detection cycles at a fixed rate and retrains the multivariate model periodically.
 * <p>
 * Stopping lets the in-flight cycle finish and starts no new one.
 */
@Slf4j
@Component
public class DetectionScheduler implements SmartLifecycle {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 120;

    private final DetectionOrchestrator orchestrator;
    private final ModelTrainingService modelTrainingService;
    private final AnomalyProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public DetectionScheduler(DetectionOrchestrator orchestrator,
                              ModelTrainingService modelTrainingService,
                              AnomalyProperties properties) {
        this.orchestrator = orchestrator;
        this.modelTrainingService = modelTrainingService;
        this.properties = properties;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            if (!properties.isSchedulerEnabled()) {
                log.info("Detection scheduler disabled");
                return;
            }
            // one thread for cycles, one for training so a long training never delays detection
            ScheduledThreadPoolExecutor executor =
                    new ScheduledThreadPoolExecutor(2, new CustomizableThreadFactory("anomaly-scheduler-"));
            // pending one-shot training attempts are dropped on shutdown
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            scheduler = executor;
            running = true;
            scheduler.scheduleAtFixedRate(this::runCycle, 0, properties.getCycleIntervalSeconds(), TimeUnit.SECONDS);

            scheduler.schedule(this::trainAndReschedule, initialTrainingDelay(), TimeUnit.SECONDS);
            log.info("Detection scheduler started: cycle every {}s, training every {} days",
                    properties.getCycleIntervalSeconds(), properties.getTraining().getIntervalDays());
        }
    }

    private long initialTrainingDelay() {
        try {
            return modelTrainingService.hasModel() ? trainingIntervalSeconds() : 0;
        } catch (RuntimeException e) {
            log.warn("Could not look up the current model, training now: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Seconds until the next training attempt: the regular interval once a model is stored,
     * the retry interval until then.
     */
    long nextTrainingDelay() {
        try {
            if (modelTrainingService.hasModel()) {
                return trainingIntervalSeconds();
            }
        } catch (RuntimeException e) {
            log.warn("Could not look up the current model: {}", e.getMessage());
        }
        return Duration.ofMinutes(properties.getTraining().getRetryMinutes()).toSeconds();
    }

    private long trainingIntervalSeconds() {
        return Duration.ofDays(properties.getTraining().getIntervalDays()).toSeconds();
    }

    private void trainAndReschedule() {
        runTraining();
        if (!running) {
            return;
        }
        long delay = nextTrainingDelay();
        try {
            scheduler.schedule(this::trainAndReschedule, delay, TimeUnit.SECONDS);
            log.info("Next model training in {}s", delay);
        } catch (RejectedExecutionException e) {
            log.info("Detection scheduler is stopping, model training not rescheduled");
        }
    }

    // an exception escaping a periodic task would cancel its later runs
    void runCycle() {
        if (!running) {
            return;
        }
        try {
            orchestrator.runCycle();
        } catch (RuntimeException e) {
            log.error("Detection cycle failed", e);
        }
    }

    void runTraining() {
        if (!running) {
            return;
        }
        try {
            modelTrainingService.train();
        } catch (IllegalStateException e) {
            log.warn("Scheduled training skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled model training failed", e);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Detection scheduler did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.warn("Interrupted while waiting for the detection scheduler to stop");
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Detection scheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
