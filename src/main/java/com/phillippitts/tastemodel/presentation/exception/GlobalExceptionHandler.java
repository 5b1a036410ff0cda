package com.phillippitts.tastemodel.presentation.exception;

import com.phillippitts.tastemodel.exception.ConcurrentTrainingException;
import com.phillippitts.tastemodel.exception.CorruptArtifactException;
import com.phillippitts.tastemodel.exception.DeploymentBlockedException;
import com.phillippitts.tastemodel.exception.HealthProbeTimeoutException;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.exception.RegistryInvariantException;
import com.phillippitts.tastemodel.exception.RegistryStorageException;
import com.phillippitts.tastemodel.exception.TrainingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping file system paths and stack traces away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Missing track or model version (HTTP 404).
     */
    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        LOG.info("{} not found: {}", ex.getResource(), ex.getIdentifier());
        return respond(HttpStatus.NOT_FOUND, ex, ex.getResource() + " not found", ex.getMessage());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidInputException.class)
    ResponseEntity<ApiError> handleInvalidInput(InvalidInputException ex) {
        LOG.warn("Invalid input: field={}, reason={}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex, "Invalid input", ex.getMessage());
    }

    /**
     * Malformed request body or parameters (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex, "Malformed request", "Check request parameters and body");
    }

    /**
     * Another run holds the pipeline (HTTP 409).
     */
    @ExceptionHandler(ConcurrentTrainingException.class)
    ResponseEntity<ApiError> handleConcurrentTraining(ConcurrentTrainingException ex) {
        LOG.info("Rejected while pipeline busy: requested={}, active={}", ex.getModelType(), ex.getActiveModelType());
        return respond(HttpStatus.CONFLICT, ex, "Pipeline busy", "Retry after the active run finishes");
    }

    /**
     * Promotion refused by the health gate (HTTP 409).
     */
    @ExceptionHandler(DeploymentBlockedException.class)
    ResponseEntity<ApiError> handleDeploymentBlocked(DeploymentBlockedException ex) {
        LOG.warn("Deployment blocked: {} v{} health={}", ex.getModelType(), ex.getVersion(), ex.getHealthStatus());
        return respond(HttpStatus.CONFLICT, ex, "Deployment blocked", ex.getMessage());
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(HealthProbeTimeoutException.class)
    ResponseEntity<ApiError> handleProbeTimeout(HealthProbeTimeoutException ex) {
        LOG.warn("Serving probe timed out after {}ms", ex.getTimeoutMs());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, "Serving probe timed out", "Please retry in a few seconds");
    }

    /**
     * Stored artifact failed verification (HTTP 500).
     */
    @ExceptionHandler(CorruptArtifactException.class)
    ResponseEntity<ApiError> handleCorruptArtifact(CorruptArtifactException ex) {
        LOG.error("Corrupt artifact: {} v{}: {}", ex.getModelType(), ex.getVersion(), ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Model artifact is corrupt",
                "Roll back to another version or retrain");
    }

    /**
     * Registry I/O failure or broken invariant (HTTP 500).
     */
    @ExceptionHandler({RegistryStorageException.class, RegistryInvariantException.class})
    ResponseEntity<ApiError> handleRegistryFailure(RuntimeException ex) {
        LOG.error("Model registry failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Model registry unavailable",
                "Contact administrator");
    }

    /**
     * Trainer failure surfaced synchronously (HTTP 500).
     */
    @ExceptionHandler(TrainingException.class)
    ResponseEntity<ApiError> handleTrainingFailure(TrainingException ex) {
        LOG.error("Training failed: modelType={}", ex.getModelType(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Training failed", "See pipeline status for details");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
