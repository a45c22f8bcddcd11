package com.example.cronscheduler.store;

import com.example.cronscheduler.config.SchedulerProperties;
import com.example.cronscheduler.domain.entity.JobLock;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.domain.repository.JobLockRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.domain.repository.ScheduledJobRepository;
import com.example.cronscheduler.exception.JobVersionConflictException;
import com.example.cronscheduler.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link TaskStore} on PostgreSQL through Spring Data JPA.
 * <p>
 * Each operation runs in its own short transaction. Lease acquire and release are
 * single conditional statements (see {@link JobLockRepository}), so two instances
 * racing for the same job cannot both win. Job writes are checked against the
 * record's {@code @Version}. Data access failures surface as
 * {@link StoreUnavailableException}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cron-scheduler.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaTaskStore implements TaskStore {

    private final ScheduledJobRepository jobRepository;
    private final JobLockRepository lockRepository;
    private final JobRunRepository runRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration recordTtl;

    public JpaTaskStore(ScheduledJobRepository jobRepository, JobLockRepository lockRepository, JobRunRepository runRepository,
                        PlatformTransactionManager transactionManager, Clock clock, SchedulerProperties properties) {
        this.jobRepository = jobRepository;
        this.lockRepository = lockRepository;
        this.runRepository = runRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.recordTtl = properties.getStore().getRecordTtl();
    }

    @Override
    public void put(ScheduledJob job) {
        ScheduledJob stored;
        try {
            stored = transactionTemplate.execute(status -> write(job, clock.instant()));
        } catch (OptimisticLockingFailureException e) {
            log.debug("Version conflict writing job {}: {}", job.getId(), e.getMessage());
            throw new JobVersionConflictException(job.getId());
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("put", e);
        }
        job.setVersion(stored.getVersion());
        job.setCreatedAt(stored.getCreatedAt());
        job.setUpdatedAt(stored.getUpdatedAt());
        job.setRecordExpiresAt(stored.getRecordExpiresAt());
    }

    /**
     * Version check against the stored row; a change that lands between the check and
     * the flush fails the versioned UPDATE instead.
     */
    private ScheduledJob write(ScheduledJob job, Instant now) {
        var existing = jobRepository.findById(job.getId());
        var live = existing.filter(current -> !current.isRecordExpired(now));
        var stale = job.getVersion() == null
                ? live.isPresent()
                : live.map(current -> !job.getVersion().equals(current.getVersion())).orElse(true);
        if (stale) {
            throw new JobVersionConflictException(job.getId());
        }
        if (job.getVersion() == null && existing.isPresent()) {
            jobRepository.delete(existing.get());
            jobRepository.flush();
        }

        var next = job.copy();
        if (next.getCreatedAt() == null) {
            next.setCreatedAt(now);
        }
        next.setUpdatedAt(now);
        next.setRecordExpiresAt(now.plus(recordTtl));
        return jobRepository.saveAndFlush(next);
    }

    @Override
    public Optional<ScheduledJob> get(String jobId) {
        return inTransaction("get", () -> jobRepository.findById(jobId)
                .filter(job -> !job.isRecordExpired(clock.instant())));
    }

    @Override
    public boolean delete(String jobId) {
        return inTransaction("delete", () -> {
            if (!jobRepository.existsById(jobId)) {
                return false;
            }
            jobRepository.deleteById(jobId);
            runRepository.deleteByJobId(jobId);
            return true;
        });
    }

    @Override
    public List<ScheduledJob> listDue(Instant now, int limit) {
        return inTransaction("listDue", () -> jobRepository.findDue(now, JobLock.KEY_PREFIX, PageRequest.of(0, limit)));
    }

    @Override
    public List<ScheduledJob> listAll(boolean enabledOnly) {
        return inTransaction("listAll", () -> {
            var now = clock.instant();
            var all = enabledOnly
                    ? jobRepository.findByEnabledTrueOrderByCreatedAtAsc()
                    : jobRepository.findAllByOrderByCreatedAtAsc();
            return all.stream().filter(job -> !job.isRecordExpired(now)).toList();
        });
    }

    @Override
    public boolean tryAcquireLock(String jobId, String owner, Duration ttl) {
        return inTransaction("tryAcquireLock", () -> {
            var now = clock.instant();
            return lockRepository.tryAcquire(JobLock.keyFor(jobId), owner, now, now.plus(ttl)) == 1;
        });
    }

    @Override
    public boolean releaseLock(String jobId, String owner) {
        return inTransaction("releaseLock", () -> lockRepository.release(JobLock.keyFor(jobId), owner) == 1);
    }

    @Override
    public void appendRun(JobRun run) {
        inTransaction("appendRun", () -> {
            if (run.getCreatedAt() == null) {
                run.setCreatedAt(clock.instant());
            }
            return runRepository.save(run);
        });
    }

    @Override
    public List<JobRun> listRuns(String jobId, int limit) {
        return inTransaction("listRuns",
                () -> runRepository.findByJobIdOrderByStartedAtDescAttemptNumberDesc(jobId, PageRequest.of(0, limit)));
    }

    @Override
    public int purgeExpired(Instant now) {
        return inTransaction("purgeExpired", () -> {
            var jobsRemoved = jobRepository.deleteExpired(now);
            var locksRemoved = lockRepository.deleteExpired(now);
            var runsRemoved = runRepository.deleteOlderThan(now.minus(recordTtl));
            log.debug("Purged {} jobs, {} leases, {} runs", jobsRemoved, locksRemoved, runsRemoved);
            return jobsRemoved + locksRemoved + runsRemoved;
        });
    }

    private <T> T inTransaction(String operation, Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }
}
