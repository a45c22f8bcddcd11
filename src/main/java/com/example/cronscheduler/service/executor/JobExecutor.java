package com.example.cronscheduler.service.executor;

import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.dto.ExecutorStats;
import com.example.cronscheduler.service.callback.JobCallback;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs job callbacks on worker threads, at most {@code maxConcurrent} at a time.
 * <p>
 * A slot is taken from a counting semaphore before a callback is handed to a worker
 * and is given back when the worker finishes, whatever the outcome. Callback exceptions
 * become {@link JobExecutionResult.Outcome#FAILURE} results; an {@link Error} completes
 * the returned future exceptionally.
 */
@Slf4j
public class JobExecutor {

    @Getter
    private final int maxConcurrent;

    private final Semaphore slots;
    private final ExecutorService workers;
    private final Clock clock;
    private final String instanceId;
    private final ConcurrentHashMap<String, Integer> runningJobs = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public JobExecutor(int maxConcurrent, Clock clock, String instanceId) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.maxConcurrent = maxConcurrent;
        this.slots = new Semaphore(maxConcurrent);
        this.workers = Executors.newCachedThreadPool(new CustomizableThreadFactory("job-executor-"));
        this.clock = clock;
        this.instanceId = instanceId;
    }

    /**
     * Run a callback and wait for its result, first waiting for a free slot.
     */
    public JobExecutionResult execute(ScheduledJob job, JobCallback callback) throws InterruptedException {
        var future = submit(job, callback);
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure running job " + job.getId(), e.getCause());
        }
    }

    /**
     * Wait for a free slot, then run the callback asynchronously.
     *
     * @throws RejectedExecutionException if the executor has been shut down
     */
    public CompletableFuture<JobExecutionResult> submit(ScheduledJob job, JobCallback callback) throws InterruptedException {
        if (shutdown.get()) {
            throw new RejectedExecutionException("Job executor is shut down");
        }
        slots.acquire();
        return dispatch(job, callback);
    }

    /**
     * Run the callback asynchronously if a slot is free right now.
     *
     * @return empty when every slot is taken or the executor is shut down
     */
    public Optional<CompletableFuture<JobExecutionResult>> trySubmit(ScheduledJob job, JobCallback callback) {
        if (shutdown.get() || !slots.tryAcquire()) {
            return Optional.empty();
        }
        try {
            return Optional.of(dispatch(job, callback));
        } catch (RejectedExecutionException e) {
            log.debug("Worker pool rejected job {}: {}", job.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<JobExecutionResult> dispatch(ScheduledJob job, JobCallback callback) {
        var jobId = job.getId();
        var future = new CompletableFuture<JobExecutionResult>();
        runningJobs.merge(jobId, 1, Integer::sum);

        try {
            workers.execute(() -> {
                try {
                    future.complete(invoke(job, callback));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                } finally {
                    release(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            release(jobId);
            throw e;
        }
        return future;
    }

    private JobExecutionResult invoke(ScheduledJob job, JobCallback callback) {
        var startedAt = clock.instant();
        var startNanos = System.nanoTime();
        log.debug("Running job {} ({}) on {}", job.getId(), job.getName(), Thread.currentThread().getName());

        JobExecutionResult result;
        try {
            result = JobExecutionResult.success(callback.run(job.getCallbackConfig()));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Callback of job {} threw {}", job.getId(), e.getClass().getSimpleName());
            result = JobExecutionResult.failure(e);
        }

        result.setJobId(job.getId());
        result.setStartedAt(startedAt);
        result.setCompletedAt(clock.instant());
        result.setDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        result.setInstanceId(instanceId);
        return result;
    }

    private void release(String jobId) {
        runningJobs.computeIfPresent(jobId, (key, count) -> count == 1 ? null : count - 1);
        slots.release();
    }

    public int getRunningCount() {
        return maxConcurrent - slots.availablePermits();
    }

    public int getFreeSlots() {
        return slots.availablePermits();
    }

    public Set<String> getRunningJobIds() {
        return new TreeSet<>(runningJobs.keySet());
    }

    public ExecutorStats getStats() {
        return ExecutorStats.builder()
                .maxConcurrent(maxConcurrent)
                .runningCount(getRunningCount())
                .freeSlots(getFreeSlots())
                .runningJobIds(getRunningJobIds())
                .build();
    }

    /**
     * Wait until no callback is running.
     *
     * @return false if callbacks were still running when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (slots.tryAcquire(maxConcurrent, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            slots.release(maxConcurrent);
            return true;
        }
        return false;
    }

    /**
     * Refuse new work and let running callbacks finish
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Shutting down job executor ({} running)", getRunningCount());
            workers.shutdown();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }
}
