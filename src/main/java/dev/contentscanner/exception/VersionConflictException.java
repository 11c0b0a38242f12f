package dev.contentscanner.exception;

import lombok.Getter;

/**
 * A conditional update lost the race against another writer. Callers re-read and retry.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final String jobId;
    private final long expectedVersion;

    public VersionConflictException(String jobId, long expectedVersion) {
        super("Version conflict on job " + jobId + " (expected version " + expectedVersion + ")");
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
    }

    public VersionConflictException(String jobId, long expectedVersion, Throwable cause) {
        super("Version conflict on job " + jobId + " (expected version " + expectedVersion + ")", cause);
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
    }
}
