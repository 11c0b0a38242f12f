package dev.contentscanner.exception;

/**
 * Malformed submission, rejected before any job is created.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
