package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.JobRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobRun entity
 */
@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    /**
     * Newest runs of a job first
     */
    List<JobRun> findByJobIdOrderByStartedAtDescAttemptNumberDesc(String jobId, Pageable pageable);

    @Modifying
    @Query("""
            DELETE FROM JobRun r
            WHERE r.jobId = :jobId
            """)
    int deleteByJobId(@Param("jobId") String jobId);

    /**
     * Delete old run history (for cleanup)
     */
    @Modifying
    @Query("""
            DELETE FROM JobRun r
            WHERE r.createdAt < :cutoff
            """)
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
