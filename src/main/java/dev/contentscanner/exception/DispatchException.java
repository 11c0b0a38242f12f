package dev.contentscanner.exception;

/**
 * Work could not be handed to the queue.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
