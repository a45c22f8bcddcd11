package com.example.cronscheduler.store;

import com.example.cronscheduler.config.SchedulerProperties;
import com.example.cronscheduler.domain.entity.JobLock;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.exception.JobVersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Process-local {@link TaskStore} backed by concurrent maps.
 * <p>
 * Keys follow the persisted layout ({@code <prefix>job:<id>}, {@code <prefix>lock:<id>}).
 * Lease operations rely on {@link ConcurrentHashMap#compute} and
 * {@link ConcurrentHashMap#remove(Object, Object)} for atomicity. Expired entries are
 * hidden on read and dropped by {@link #purgeExpired(Instant)}. Records are copied
 * on the way in and out; {@link #put} compares versions inside {@link ConcurrentHashMap#compute}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cron-scheduler.store", name = "type", havingValue = "memory")
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, JobLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentLinkedDeque<JobRun>> runs = new ConcurrentHashMap<>();

    private final Clock clock;
    private final String keyPrefix;
    private final Duration recordTtl;
    private final int runHistoryLimit;

    public InMemoryTaskStore(Clock clock, SchedulerProperties properties) {
        this.clock = clock;
        this.keyPrefix = properties.getStore().getKeyPrefix();
        this.recordTtl = properties.getStore().getRecordTtl();
        this.runHistoryLimit = properties.getStore().getRunHistoryLimit();
        log.info("Using in-memory task store (prefix '{}', record TTL {})", keyPrefix, recordTtl);
    }

    @Override
    public void put(ScheduledJob job) {
        var now = clock.instant();
        var expected = job.getVersion();
        var stored = jobs.compute(jobKey(job.getId()), (key, current) -> {
            var live = current != null && !current.isRecordExpired(now) ? current : null;
            var stale = expected == null ? live != null : live == null || !expected.equals(live.getVersion());
            if (stale) {
                throw new JobVersionConflictException(job.getId());
            }
            var next = job.copy();
            next.setVersion(expected == null ? 0L : expected + 1);
            if (next.getCreatedAt() == null) {
                next.setCreatedAt(now);
            }
            next.setUpdatedAt(now);
            next.setRecordExpiresAt(now.plus(recordTtl));
            return next;
        });
        job.setVersion(stored.getVersion());
        job.setCreatedAt(stored.getCreatedAt());
        job.setUpdatedAt(stored.getUpdatedAt());
        job.setRecordExpiresAt(stored.getRecordExpiresAt());
    }

    @Override
    public Optional<ScheduledJob> get(String jobId) {
        var key = jobKey(jobId);
        var job = jobs.get(key);
        if (job == null) {
            return Optional.empty();
        }
        if (job.isRecordExpired(clock.instant())) {
            jobs.remove(key, job);
            return Optional.empty();
        }
        return Optional.of(job.copy());
    }

    @Override
    public boolean delete(String jobId) {
        runs.remove(runsKey(jobId));
        return jobs.remove(jobKey(jobId)) != null;
    }

    @Override
    public List<ScheduledJob> listDue(Instant now, int limit) {
        return jobs.values().stream()
                .filter(job -> job.isDue(now) && !job.isRecordExpired(now) && !isLeased(job.getId(), now))
                .sorted(Comparator.comparing(ScheduledJob::getNextRun).thenComparing(ScheduledJob::getId))
                .limit(limit)
                .map(ScheduledJob::copy)
                .toList();
    }

    @Override
    public List<ScheduledJob> listAll(boolean enabledOnly) {
        var now = clock.instant();
        return jobs.values().stream()
                .filter(job -> !job.isRecordExpired(now))
                .filter(job -> !enabledOnly || job.isEnabled())
                .sorted(Comparator.comparing(ScheduledJob::getCreatedAt).thenComparing(ScheduledJob::getId))
                .map(ScheduledJob::copy)
                .toList();
    }

    @Override
    public boolean tryAcquireLock(String jobId, String owner, Duration ttl) {
        var now = clock.instant();
        var candidate = JobLock.builder()
                .lockKey(JobLock.keyFor(jobId))
                .owner(owner)
                .acquiredAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        var holder = locks.compute(lockKey(jobId), (key, current) ->
                current == null || current.isExpired(now) || current.isHeldBy(owner) ? candidate : current);
        return holder == candidate;
    }

    @Override
    public boolean releaseLock(String jobId, String owner) {
        var key = lockKey(jobId);
        var current = locks.get(key);
        if (current == null || !current.isHeldBy(owner)) {
            return false;
        }
        return locks.remove(key, current);
    }

    @Override
    public void appendRun(JobRun run) {
        if (run.getId() == null) {
            run.setId(UUID.randomUUID());
        }
        if (run.getCreatedAt() == null) {
            run.setCreatedAt(clock.instant());
        }
        var history = runs.computeIfAbsent(runsKey(run.getJobId()), key -> new ConcurrentLinkedDeque<>());
        history.addFirst(run);
        while (history.size() > runHistoryLimit) {
            history.pollLast();
        }
    }

    @Override
    public List<JobRun> listRuns(String jobId, int limit) {
        var history = runs.get(runsKey(jobId));
        if (history == null) {
            return List.of();
        }
        var result = new ArrayList<JobRun>(Math.min(limit, runHistoryLimit));
        for (var run : history) {
            if (result.size() >= limit) {
                break;
            }
            result.add(run);
        }
        return result;
    }

    @Override
    public int purgeExpired(Instant now) {
        var removed = 0;
        for (var entry : jobs.entrySet()) {
            if (entry.getValue().isRecordExpired(now) && jobs.remove(entry.getKey(), entry.getValue())) {
                runs.remove(runsKey(entry.getValue().getId()));
                removed++;
            }
        }
        for (var entry : locks.entrySet()) {
            if (entry.getValue().isExpired(now) && locks.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        var cutoff = now.minus(recordTtl);
        for (var history : runs.values()) {
            var before = history.size();
            history.removeIf(run -> run.getCreatedAt().isBefore(cutoff));
            removed += before - history.size();
        }
        if (removed > 0) {
            log.debug("Purged {} expired entries from in-memory store", removed);
        }
        return removed;
    }

    private boolean isLeased(String jobId, Instant now) {
        var lock = locks.get(lockKey(jobId));
        return lock != null && !lock.isExpired(now);
    }

    private String jobKey(String jobId) {
        return keyPrefix + "job:" + jobId;
    }

    private String lockKey(String jobId) {
        return keyPrefix + JobLock.keyFor(jobId);
    }

    private String runsKey(String jobId) {
        return keyPrefix + "runs:" + jobId;
    }
}
