package com.example.cronscheduler.store;

import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.exception.JobVersionConflictException;
import com.example.cronscheduler.exception.StoreUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable storage for job records, job leases and run history.
 * <p>
 * Every operation is safe to call concurrently from several processes sharing
 * the same backend. Any operation may throw {@link StoreUnavailableException}
 * when the backend cannot be reached; callers do not retry in a loop.
 */
public interface TaskStore {

    int MAX_UPDATE_ATTEMPTS = 5;

    /**
     * Store a job record and refresh its record TTL.
     * <p>
     * A job with a null version is inserted. Otherwise the stored record is replaced
     * only if it still carries the same version. On success the job's version is
     * advanced to the stored one.
     *
     * @throws JobVersionConflictException if the record was changed or removed since
     *                                     it was read, or a new job's id is already live
     */
    void put(ScheduledJob job);

    /**
     * Read a job, apply {@code mutation} and write it back with a version check. On a
     * conflict the mutation is applied again to a fresh read, so it must only set the
     * fields its caller owns. A removed job is never recreated.
     *
     * @param mutation changes the job in place; returns false to leave the record untouched
     * @return the job as written, or empty if it does not exist or the mutation declined
     * @throws JobVersionConflictException if every attempt lost a race
     */
    default Optional<ScheduledJob> update(String jobId, Predicate<ScheduledJob> mutation) {
        for (var attempt = 1; ; attempt++) {
            var current = get(jobId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            var job = current.get();
            if (!mutation.test(job)) {
                return Optional.empty();
            }
            try {
                put(job);
                return Optional.of(job);
            } catch (JobVersionConflictException e) {
                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
            }
        }
    }

    Optional<ScheduledJob> get(String jobId);

    /**
     * @return true if a record was removed
     */
    boolean delete(String jobId);

    /**
     * Enabled jobs with {@code nextRun <= now}, earliest first, at most {@code limit}.
     * Jobs under a live lease are left out so running jobs do not fill the batch.
     * Nothing is claimed.
     */
    List<ScheduledJob> listDue(Instant now, int limit);

    List<ScheduledJob> listAll(boolean enabledOnly);

    /**
     * Atomically take the lease on a job.
     *
     * @return true if no live lease existed, or the live lease was already held by
     * {@code owner} (its expiry is then extended); false if another owner holds it
     */
    boolean tryAcquireLock(String jobId, String owner, Duration ttl);

    /**
     * Atomically delete the lease if {@code owner} still holds it.
     *
     * @return false if the lease expired or was taken over
     */
    boolean releaseLock(String jobId, String owner);

    void appendRun(JobRun run);

    /**
     * Run history of a job, newest first
     */
    List<JobRun> listRuns(String jobId, int limit);

    /**
     * Remove expired job records, leases and run history.
     *
     * @return number of entries removed
     */
    int purgeExpired(Instant now);
}
