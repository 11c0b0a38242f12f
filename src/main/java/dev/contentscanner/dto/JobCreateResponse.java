package dev.contentscanner.dto;

import dev.contentscanner.model.JobStatus;

public record JobCreateResponse(String jobId, JobStatus status) {
}
