package com.example.cronscheduler.service.executor;

import com.example.cronscheduler.config.MetricsConfig;
import com.example.cronscheduler.config.SchedulerProperties;
import com.example.cronscheduler.cron.CronEvaluator;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.dto.SchedulerStats;
import com.example.cronscheduler.exception.CallbackNotFoundException;
import com.example.cronscheduler.exception.InvalidCronExpressionException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.exception.StoreUnavailableException;
import com.example.cronscheduler.service.alert.SlackAlertService;
import com.example.cronscheduler.service.callback.CallbackRegistry;
import com.example.cronscheduler.service.callback.JobCallback;
import com.example.cronscheduler.store.TaskStore;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tick loop that finds due jobs, leases them, runs them and records the outcome.
 * <p>
 * Any number of instances may share one {@link TaskStore}; a job lease ensures a due job
 * runs on one instance at a time. Each tick:
 * 1. Lists up to {@code batchSize} due jobs, earliest first
 * 2. Tries to take each job's lease; contended jobs are skipped
 * 3. Re-reads the leased job, marks it RUNNING and hands it to the {@link JobExecutor}
 * 4. On completion, applies the outcome to a fresh copy of the record, appends run
 * history and releases the lease
 * <p>
 * Ticks run on one dedicated thread with a fixed delay and never overlap.
 */
@Slf4j
public class DistributedScheduler {

    private final TaskStore store;
    private final JobExecutor executor;
    private final CronEvaluator cronEvaluator;
    private final CallbackRegistry callbackRegistry;
    private final Clock clock;
    private final SchedulerProperties properties;
    private final MetricsConfig metrics;
    private final SlackAlertService alertService;

    @Getter
    private final String instanceId;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    /**
     * Jobs dispatched from this instance and not yet reconciled
     */
    private final Set<String> localRuns = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService tickExecutor;

    public DistributedScheduler(TaskStore store, JobExecutor executor, CronEvaluator cronEvaluator, CallbackRegistry callbackRegistry,
                                Clock clock, SchedulerProperties properties, MetricsConfig metrics, SlackAlertService alertService,
                                String instanceId) {
        this.store = store;
        this.executor = executor;
        this.cronEvaluator = cronEvaluator;
        this.callbackRegistry = callbackRegistry;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
        this.alertService = alertService;
        this.instanceId = instanceId;
    }

    // === Lifecycle ===

    /**
     * Start ticking in the background. Calling it again while running does nothing.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Scheduler {} already running", instanceId);
            return;
        }

        tickExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("scheduler-tick-"));
        tickExecutor.scheduleWithFixedDelay(this::tick, 0, properties.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);

        log.info("Scheduler {} started (tick {}, batch {}, max concurrent {}, lease {}, zone {})",
                instanceId, properties.getTickInterval(), properties.getBatchSize(), executor.getMaxConcurrent(),
                properties.getLeaseTtl(), cronEvaluator.getZone());
    }

    /**
     * Stop ticking, then wait up to {@code shutdownTimeout} for in-flight runs to finish
     * and be reconciled. Returns after the timeout even if some are still running.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        var timeout = properties.getShutdownTimeout();
        var deadline = System.nanoTime() + timeout.toNanos();
        log.info("Stopping scheduler {} ({} runs in flight)", instanceId, inFlight.size());

        tickExecutor.shutdown();
        try {
            if (!tickExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Current tick did not finish within {}", timeout);
            }
            var remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            if (!awaitIdle(remaining)) {
                log.warn("Scheduler {} stopped with incomplete drain: {} runs still in flight for jobs {}",
                        instanceId, inFlight.size(), localRuns);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping scheduler {}, {} runs still in flight", instanceId, inFlight.size());
        } finally {
            tickExecutor = null;
        }

        log.info("Scheduler {} stopped", instanceId);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Wait until every run dispatched by this instance has been reconciled.
     *
     * @return false if runs were still in flight when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        var pending = inFlight.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            log.error("Run completed with error while draining: {}", e.getCause().getMessage(), e.getCause());
            return inFlight.isEmpty();
        }
    }

    // === Registration & Stats ===

    public void registerCallback(String kind, JobCallback callback) {
        callbackRegistry.register(kind, callback);
    }

    public SchedulerStats getStats() {
        return SchedulerStats.builder()
                .running(running.get())
                .instanceId(instanceId)
                .timeZone(cronEvaluator.getZone().getId())
                .executorStats(executor.getStats())
                .registeredCallbackKinds(callbackRegistry.getRegisteredKinds())
                .generatedAt(clock.instant())
                .build();
    }

    // === Tick ===

    /**
     * Run one scheduling pass. Skipped if another pass is still in progress.
     */
    public void tick() {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            metrics.recordTickSkipped();
            return;
        }

        try {
            var due = store.listDue(clock.instant(), properties.getBatchSize());
            if (due.isEmpty()) {
                return;
            }

            log.debug("Found {} due jobs", due.size());
            for (var job : due) {
                try {
                    dispatch(job.getId(), false);
                } catch (StoreUnavailableException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("Error dispatching job {}: {}", job.getId(), e.getMessage(), e);
                }
            }
        } catch (StoreUnavailableException e) {
            log.error("Task store unavailable, ending tick: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in scheduler tick: {}", e.getMessage(), e);
        } finally {
            ticking.set(false);
        }
    }

    /**
     * Run a job now, whether or not it is due, through the same lease and reconcile path.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public DispatchOutcome triggerNow(String jobId) {
        if (store.get(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Manual trigger of job {}", jobId);
        return dispatch(jobId, true);
    }

    DispatchOutcome dispatch(String jobId, boolean manual) {
        if (!localRuns.add(jobId)) {
            log.debug("Job {} is already running on this instance, skipping", jobId);
            return DispatchOutcome.SKIPPED;
        }

        var handedOff = false;
        try {
            if (!store.tryAcquireLock(jobId, instanceId, properties.getLeaseTtl())) {
                log.debug("Lock contended for job {}, skipping", jobId);
                metrics.recordLockContended();
                return DispatchOutcome.CONTENDED;
            }

            var outcome = dispatchLeased(jobId, manual);
            handedOff = outcome == DispatchOutcome.DISPATCHED;
            return outcome;
        } finally {
            if (!handedOff) {
                localRuns.remove(jobId);
            }
        }
    }

    /**
     * Called with the lease held. Unless the job is dispatched, the lease is released
     * before returning.
     */
    private DispatchOutcome dispatchLeased(String jobId, boolean manual) {
        var leaseOwnedHere = true;
        try {
            var now = clock.instant();
            var job = store.get(jobId).orElse(null);
            if (job == null || (!manual && !job.isDue(now))) {
                log.debug("Job {} was removed, disabled or rescheduled before it could run, skipping", jobId);
                return DispatchOutcome.SKIPPED;
            }

            var kind = job.getCallbackKind();
            var callback = callbackRegistry.getCallback(kind);
            if (callback.isEmpty()) {
                var result = JobExecutionResult.failure(new CallbackNotFoundException(kind));
                result.setJobId(jobId);
                result.setStartedAt(now);
                result.setCompletedAt(now);
                result.setInstanceId(instanceId);
                metrics.recordRun(kind, false);
                leaseOwnedHere = false;
                reconcile(jobId, kind, result);
                return DispatchOutcome.FAILED;
            }

            var previousStatus = job.getStatus();
            var previousLastRun = job.getLastRun();
            var marked = store.update(jobId, current -> {
                if (!manual && !current.isDue(now)) {
                    return false;
                }
                current.setStatus(JobStatus.RUNNING);
                current.setLastRun(now);
                return true;
            });
            if (marked.isEmpty()) {
                log.debug("Job {} was removed, disabled or rescheduled before it could run, skipping", jobId);
                return DispatchOutcome.SKIPPED;
            }

            var timer = metrics.startExecutionTimer();
            var submitted = executor.trySubmit(marked.get(), callback.get());
            if (submitted.isEmpty()) {
                log.info("Executor saturated ({} running), deferring job {} to next tick", executor.getRunningCount(), jobId);
                restore(jobId, now, previousStatus, previousLastRun);
                return DispatchOutcome.DEFERRED;
            }

            leaseOwnedHere = false;
            track(submitted.get().handle((result, error) -> {
                var outcome = result != null ? result : crashed(jobId, error, now);
                recordExecution(timer, kind, outcome);
                reconcile(jobId, kind, outcome);
                return outcome;
            }));
            log.debug("Dispatched job {} ({}) to executor", jobId, kind);
            return DispatchOutcome.DISPATCHED;
        } finally {
            if (leaseOwnedHere) {
                releaseLease(jobId);
            }
        }
    }

    private void track(CompletableFuture<JobExecutionResult> completion) {
        inFlight.add(completion);
        completion.whenComplete((result, error) -> inFlight.remove(completion));
    }

    private JobExecutionResult crashed(String jobId, Throwable error, Instant startedAt) {
        log.error("Job {} crashed its worker: {}", jobId, error.toString());
        var result = JobExecutionResult.failure(error);
        result.setJobId(jobId);
        result.setStartedAt(startedAt);
        result.setCompletedAt(clock.instant());
        result.setInstanceId(instanceId);
        return result;
    }

    private void recordExecution(Timer.Sample timer, String kind, JobExecutionResult result) {
        metrics.recordExecution(timer, kind, result.isSuccess());
        metrics.recordRun(kind, result.isSuccess());
    }

    /**
     * Undo the RUNNING mark of a run that never started, unless something else has
     * written those fields since.
     */
    private void restore(String jobId, Instant markedAt, JobStatus status, Instant lastRun) {
        store.update(jobId, current -> {
            if (current.getStatus() != JobStatus.RUNNING || !markedAt.equals(current.getLastRun())) {
                return false;
            }
            current.setStatus(status);
            current.setLastRun(lastRun);
            return true;
        });
    }

    // === Reconciliation ===

    /**
     * Apply a run outcome to the current record, write run history and release the lease.
     * Only fields owned by the scheduler are written, so edits made during the run survive.
     */
    private void reconcile(String jobId, String kind, JobExecutionResult result) {
        try {
            var autoDisabled = new AtomicBoolean();
            var updated = store.update(jobId, job -> {
                autoDisabled.set(applyResult(job, result));
                return true;
            });
            if (updated.isEmpty()) {
                log.info("Job {} was removed while running, discarding its result", jobId);
                return;
            }

            var job = updated.get();
            if (result.isSuccess()) {
                log.info("Job {} ({}) succeeded in {}ms", job.getId(), job.getName(), result.getDurationMs());
            } else {
                log.warn("Job {} ({}) failed ({} consecutive): {}", job.getId(), job.getName(), job.getFailureCount(), result.getError());
            }
            if (autoDisabled.get()) {
                log.warn("Job {} ({}) disabled after {} consecutive failures", job.getId(), job.getName(), job.getFailureCount());
                metrics.recordAutoDisabled(kind);
                alertService.sendJobAutoDisabledAlert(job.copy());
            }
            store.appendRun(toRun(job, result));
        } catch (Exception e) {
            log.error("Failed to record outcome of job {}: {}", jobId, e.getMessage(), e);
        } finally {
            releaseLease(jobId);
            localRuns.remove(jobId);
        }
    }

    /**
     * Write the scheduler-owned fields of a finished run onto {@code job}.
     *
     * @return true if this outcome disabled the job
     */
    private boolean applyResult(ScheduledJob job, JobExecutionResult result) {
        var disabled = false;
        job.setRunCount(job.getRunCount() + 1);
        job.setLastRun(result.getStartedAt());
        job.setLastDurationMs(result.getDurationMs());

        if (result.isSuccess()) {
            job.setStatus(JobStatus.SUCCESS);
            job.setFailureCount(0);
            job.setLastError(null);
        } else {
            job.setStatus(JobStatus.FAILED);
            job.setFailureCount(job.getFailureCount() + 1);
            job.setLastError(result.getError());
            if (job.getFailureCount() >= properties.getFailureThreshold() && job.isEnabled()) {
                job.setEnabled(false);
                disabled = true;
            }
        }

        try {
            job.setNextRun(cronEvaluator.nextRun(job.getCronExpression(), result.getCompletedAt()));
        } catch (InvalidCronExpressionException e) {
            log.error("Job {} has an unusable cron expression, disabling: {}", job.getId(), e.getMessage());
            job.setEnabled(false);
        }
        return disabled;
    }

    private JobRun toRun(ScheduledJob job, JobExecutionResult result) {
        return JobRun.builder()
                .jobId(job.getId())
                .attemptNumber(job.getRunCount())
                .status(result.isSuccess() ? JobStatus.SUCCESS : JobStatus.FAILED)
                .executorInstance(result.getInstanceId())
                .startedAt(result.getStartedAt())
                .completedAt(result.getCompletedAt())
                .durationMs(result.getDurationMs())
                .errorMessage(result.getError())
                .errorType(result.getErrorType())
                .errorStackTrace(result.getStackTrace())
                .output(result.getOutput())
                .build();
    }

    private void releaseLease(String jobId) {
        try {
            if (!store.releaseLock(jobId, instanceId)) {
                log.info("Lease on job {} was taken over before release", jobId);
                metrics.recordLeaseTakeover();
            }
        } catch (StoreUnavailableException e) {
            log.error("Could not release lease on job {}, it will expire after {}: {}", jobId, properties.getLeaseTtl(), e.getMessage());
        }
    }
}
