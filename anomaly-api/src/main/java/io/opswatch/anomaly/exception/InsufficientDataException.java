package io.opswatch.anomaly.exception;

/**
 * Not enough samples to evaluate a metric. The caller skips that metric or detector for
 * the current cycle; absence of data is never read as "normal".
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
