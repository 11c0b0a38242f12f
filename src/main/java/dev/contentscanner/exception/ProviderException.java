package dev.contentscanner.exception;

import dev.contentscanner.model.ErrorKind;
import lombok.Getter;

/**
 * Failure raised by a moderation or summary provider adapter.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final ErrorKind kind;

    public ProviderException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ProviderException timeout(String message, Throwable cause) {
        return new ProviderException(ErrorKind.TIMEOUT, message, cause);
    }

    public static ProviderException providerError(String message) {
        return new ProviderException(ErrorKind.PROVIDER_ERROR, message);
    }

    public static ProviderException providerError(String message, Throwable cause) {
        return new ProviderException(ErrorKind.PROVIDER_ERROR, message, cause);
    }

    public static ProviderException invalidMedia(String message) {
        return new ProviderException(ErrorKind.INVALID_MEDIA, message);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
