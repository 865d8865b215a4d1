package io.opswatch.anomaly.training.exception;

/**
 * Failure to append an anomaly event or to read/write a trained model.
 */
public class AnomalyPersistenceException extends RuntimeException {

    public AnomalyPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
