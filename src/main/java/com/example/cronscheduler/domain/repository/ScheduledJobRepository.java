package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.ScheduledJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ScheduledJob entity
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    /**
     * Find due jobs ordered by next fire time.
     * <p>
     * Criteria:
     * - Enabled
     * - nextRun has passed
     * - Record not expired
     * - No live lease (running jobs stay out of the batch)
     * <p>
     * Does not claim anything; callers race on the job lease.
     */
    @Query("""
            SELECT j FROM ScheduledJob j
            WHERE j.enabled = true
              AND j.nextRun <= :now
              AND (j.recordExpiresAt IS NULL OR j.recordExpiresAt > :now)
              AND NOT EXISTS (
                  SELECT l.lockKey FROM JobLock l
                  WHERE l.lockKey = CONCAT(:lockPrefix, j.id)
                    AND l.expiresAt > :now)
            ORDER BY j.nextRun ASC, j.id ASC
            """)
    List<ScheduledJob> findDue(@Param("now") Instant now, @Param("lockPrefix") String lockPrefix, Pageable pageable);

    List<ScheduledJob> findAllByOrderByCreatedAtAsc();

    List<ScheduledJob> findByEnabledTrueOrderByCreatedAtAsc();

    /**
     * Delete records whose TTL has elapsed
     */
    @Modifying
    @Query("""
            DELETE FROM ScheduledJob j
            WHERE j.recordExpiresAt IS NOT NULL
              AND j.recordExpiresAt <= :now
            """)
    int deleteExpired(@Param("now") Instant now);
}
