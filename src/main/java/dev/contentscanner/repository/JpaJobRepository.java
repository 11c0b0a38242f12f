package dev.contentscanner.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contentscanner.entity.JobRecord;
import dev.contentscanner.exception.JobNotFoundException;
import dev.contentscanner.exception.VersionConflictException;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * {@link JobRepository} on top of JPA. The version check is done explicitly against
 * the expected version and again by Hibernate's versioned update on flush.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobRepository implements JobRepository {

    private final JobRecordRepository jobRecordRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public Job create(Job job) {
        if (jobRecordRepository.existsById(job.getJobId())) {
            throw new IllegalStateException("Job already exists: " + job.getJobId());
        }
        JobRecord saved = jobRecordRepository.saveAndFlush(JobRecord.builder()
                .jobId(job.getJobId())
                .campaignId(job.getCampaignId())
                .creatorId(job.getCreatorId())
                .status(job.getStatus())
                .createdAt(toColumn(job.getCreatedAt()))
                .updatedAt(toColumn(job.getUpdatedAt()))
                .document(write(job))
                .build());
        log.debug("Created job record {} (version {})", saved.getJobId(), saved.getVersion());
        return toJob(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Job get(String jobId) {
        return jobRecordRepository.findById(jobId)
                .map(this::toJob)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    @Transactional
    public Job conditionalUpdate(String jobId, long expectedVersion, UnaryOperator<Job> mutation) {
        JobRecord record = jobRecordRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        if (record.getVersion() == null || record.getVersion() != expectedVersion) {
            throw new VersionConflictException(jobId, expectedVersion);
        }

        Job updated = mutation.apply(toJob(record));
        record.setStatus(updated.getStatus());
        record.setUpdatedAt(toColumn(updated.getUpdatedAt()));
        record.setDocument(write(updated));

        try {
            JobRecord saved = jobRecordRepository.saveAndFlush(record);
            updated.setVersion(saved.getVersion());
            return updated;
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new VersionConflictException(jobId, expectedVersion, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findStale(Collection<JobStatus> statuses, Instant updatedBefore) {
        return jobRecordRepository.findStaleJobIds(statuses, toColumn(updatedBefore));
    }

    private Job toJob(JobRecord record) {
        try {
            Job job = objectMapper.readValue(record.getDocument(), Job.class);
            job.setVersion(record.getVersion());
            return job;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt job document for " + record.getJobId(), e);
        }
    }

    private String write(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize job " + job.getJobId(), e);
        }
    }

    private static LocalDateTime toColumn(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
