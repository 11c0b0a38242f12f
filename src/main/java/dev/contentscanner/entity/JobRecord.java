package dev.contentscanner.entity;

import dev.contentscanner.model.JobStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted form of a job. Posts, media outcomes and results live in the JSON document;
 * status and timestamps are columns so stale jobs can be queried.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "analysis_jobs", indexes = {
        @Index(name = "idx_status", columnList = "status"),
        @Index(name = "idx_updated_at", columnList = "updatedAt")
})
public class JobRecord {

    @Id
    @Column(length = 64)
    private String jobId;

    @Column(nullable = false)
    private String campaignId;

    @Column(nullable = false)
    private String creatorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String document;
}
