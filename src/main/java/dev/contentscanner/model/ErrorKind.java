package dev.contentscanner.model;

/**
 * Why a single media item could not be scored.
 */
public enum ErrorKind {
    TIMEOUT(true),
    PROVIDER_ERROR(true),
    INVALID_MEDIA(false),
    DISPATCH_FAILURE(false),
    // Redeliveries used up, or the job ran out of recovery attempts
    DELIVERY_FAILURE(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
