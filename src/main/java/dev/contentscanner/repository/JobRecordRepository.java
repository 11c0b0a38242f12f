package dev.contentscanner.repository;

import dev.contentscanner.entity.JobRecord;
import dev.contentscanner.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data access to persisted job records.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    /**
     * Find job ids by status that have not been touched since the cutoff.
     */
    @Query("SELECT j.jobId FROM JobRecord j WHERE j.status IN :statuses AND j.updatedAt < :cutoff ORDER BY j.updatedAt")
    List<String> findStaleJobIds(@Param("statuses") Collection<JobStatus> statuses,
                                 @Param("cutoff") LocalDateTime cutoff);
}
