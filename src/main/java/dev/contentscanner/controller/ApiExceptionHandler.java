package dev.contentscanner.controller;

import dev.contentscanner.dto.ErrorResponse;
import dev.contentscanner.exception.DispatchException;
import dev.contentscanner.exception.JobNotFoundException;
import dev.contentscanner.exception.ValidationException;
import dev.contentscanner.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps job-level failures to HTTP responses. Provider errors never reach this layer.
 */
@Slf4j
@RestControllerAdvice(basePackages = "dev.contentscanner.controller")
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.debug("Rejected submission: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(VersionConflictException ex) {
        log.warn("Concurrent update gave up: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "version_conflict", ex.getMessage());
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ErrorResponse> handleDispatch(DispatchException ex) {
        log.error("Dispatch failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "dispatch_failure", "Failed to enqueue analysis job");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(error, message, status.value(), Instant.now()));
    }
}
