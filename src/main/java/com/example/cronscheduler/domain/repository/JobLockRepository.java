package com.example.cronscheduler.domain.repository;

import com.example.cronscheduler.domain.entity.JobLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Repository for job leases.
 * <p>
 * Acquire and release are single statements so that the ownership check and the
 * write happen atomically in PostgreSQL.
 */
@Repository
public interface JobLockRepository extends JpaRepository<JobLock, String> {

    /**
     * Insert the lease, or take it over when the current one has expired or is already ours.
     *
     * @return 1 if the lease is now held by {@code owner}, 0 if a live lease belongs to someone else
     */
    @Modifying
    @Query(value = """
            INSERT INTO job_locks (lock_key, owner, acquired_at, expires_at)
            VALUES (:lockKey, :owner, :now, :expiresAt)
            ON CONFLICT (lock_key) DO UPDATE
              SET owner = EXCLUDED.owner,
                  acquired_at = EXCLUDED.acquired_at,
                  expires_at = EXCLUDED.expires_at
              WHERE job_locks.expires_at <= :now
                 OR job_locks.owner = :owner
            """, nativeQuery = true)
    int tryAcquire(
            @Param("lockKey") String lockKey,
            @Param("owner") String owner,
            @Param("now") Instant now,
            @Param("expiresAt") Instant expiresAt);

    /**
     * Delete the lease only if {@code owner} still holds it
     *
     * @return number of rows deleted (0 when the lease was taken over or already gone)
     */
    @Modifying
    @Query(value = """
            DELETE FROM job_locks
            WHERE lock_key = :lockKey
              AND owner = :owner
            """, nativeQuery = true)
    int release(@Param("lockKey") String lockKey, @Param("owner") String owner);

    @Modifying
    @Query("""
            DELETE FROM JobLock l
            WHERE l.expiresAt <= :now
            """)
    int deleteExpired(@Param("now") Instant now);
}
