package io.opswatch.anomaly.controller;

import io.opswatch.anomaly.exception.InsufficientDataException;
import io.opswatch.anomaly.exception.SourceUnavailableException;
import io.opswatch.anomaly.training.exception.AnomalyPersistenceException;
import io.opswatch.anomaly.training.exception.FeatureMismatchException;
import io.opswatch.anomaly.training.exception.ModelNotTrainedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class AnomalyExceptionHandler {

    @ExceptionHandler(InsufficientDataException.class)
    public ProblemDetail insufficientData(InsufficientDataException e) {
        return problem(HttpStatus.NOT_FOUND, "Insufficient data", e);
    }

    @ExceptionHandler(ModelNotTrainedException.class)
    public ProblemDetail modelNotTrained(ModelNotTrainedException e) {
        return problem(HttpStatus.CONFLICT, "Model not trained", e);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail conflict(IllegalStateException e) {
        return problem(HttpStatus.CONFLICT, "Conflict", e);
    }

    @ExceptionHandler(FeatureMismatchException.class)
    public ProblemDetail featureMismatch(FeatureMismatchException e) {
        log.error("Feature mismatch: {}", e.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Feature mismatch", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail badRequest(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "Bad request", e);
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ProblemDetail sourceUnavailable(SourceUnavailableException e) {
        log.warn("Metric source unavailable: {}", e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Metric source unavailable", e);
    }

    @ExceptionHandler(AnomalyPersistenceException.class)
    public ProblemDetail persistence(AnomalyPersistenceException e) {
        log.error("Persistence failure", e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence failure", e);
    }

    private static ProblemDetail problem(HttpStatus status, String title, RuntimeException e) {
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        detail.setTitle(title);
        return detail;
    }
}
