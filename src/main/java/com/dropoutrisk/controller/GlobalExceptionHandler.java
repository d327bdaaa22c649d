package com.dropoutrisk.controller;

import com.dropoutrisk.exception.InsufficientDataException;
import com.dropoutrisk.exception.ModelLifecycleException;
import com.dropoutrisk.exception.ModelVersionMismatchException;
import com.dropoutrisk.exception.RiskEngineException;
import com.dropoutrisk.exception.ThresholdConfigException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException ex) {
        log.warn("Insufficient data: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(), null);
    }

    @ExceptionHandler(ThresholdConfigException.class)
    public ResponseEntity<ErrorResponse> handleThresholdConfig(ThresholdConfigException ex) {
        log.error("Threshold config rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Threshold Config", ex.getMessage(), null);
    }

    @ExceptionHandler(ModelVersionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleModelVersionMismatch(ModelVersionMismatchException ex) {
        log.error("Model version mismatch: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Model Version Mismatch", ex.getMessage(), null);
    }

    @ExceptionHandler(ModelLifecycleException.class)
    public ResponseEntity<ErrorResponse> handleModelLifecycle(ModelLifecycleException ex) {
        log.error("Model lifecycle error: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Model Lifecycle Error", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach((FieldError error) -> errors.put(error.getField(), error.getDefaultMessage()));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Invalid input parameters", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Invalid request parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getMostSpecificCause().getMessage(), null);
    }

    @ExceptionHandler(RiskEngineException.class)
    public ResponseEntity<ErrorResponse> handleRiskEngine(RiskEngineException ex) {
        log.error("Risk engine error: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Risk Engine Error", ex.getMessage(), null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> validationErrors) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(Instant.now(), status.value(), error, message, validationErrors));
    }

    public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        Map<String, String> validationErrors
    ) {
    }
}
