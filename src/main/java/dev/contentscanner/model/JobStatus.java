package dev.contentscanner.model;

public enum JobStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    COMPLETED_WITH_WARNINGS,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_WARNINGS || this == FAILED;
    }
}
