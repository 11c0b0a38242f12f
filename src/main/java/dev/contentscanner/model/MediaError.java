package dev.contentscanner.model;

import java.util.Objects;

/**
 * Media-scoped failure. Recorded as data on the media item, never fatal to the job.
 */
public record MediaError(ErrorKind reason, String message) {

    public MediaError {
        Objects.requireNonNull(reason, "reason");
    }
}
