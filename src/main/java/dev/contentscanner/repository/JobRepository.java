package dev.contentscanner.repository;

import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Durable store for jobs with optimistic concurrency.
 * Every returned job is a private copy; changing it has no effect until written back.
 */
public interface JobRepository {

    /**
     * Store a new job. Its version becomes the initial version.
     */
    Job create(Job job);

    /**
     * Load a job.
     *
     * @throws dev.contentscanner.exception.JobNotFoundException if no job has this id
     */
    Job get(String jobId);

    /**
     * Apply a mutation only if the stored job still has the expected version.
     *
     * @return the stored job after the mutation, with its new version
     * @throws dev.contentscanner.exception.VersionConflictException if another writer got there first
     * @throws dev.contentscanner.exception.JobNotFoundException     if no job has this id
     */
    Job conditionalUpdate(String jobId, long expectedVersion, UnaryOperator<Job> mutation);

    /**
     * Ids of jobs in one of the given statuses not updated since the cutoff.
     */
    List<String> findStale(Collection<JobStatus> statuses, Instant updatedBefore);
}
