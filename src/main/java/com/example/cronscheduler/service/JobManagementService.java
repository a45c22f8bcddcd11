package com.example.cronscheduler.service;

import com.example.cronscheduler.cron.CronDescription;
import com.example.cronscheduler.cron.CronEvaluator;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.ScheduledJob;
import com.example.cronscheduler.domain.enums.JobStatus;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.service.executor.DispatchOutcome;
import com.example.cronscheduler.service.executor.DistributedScheduler;
import com.example.cronscheduler.store.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service for managing job definitions.
 * <p>
 * Provides:
 * - Job creation with cron validation
 * - Partial updates, enable/disable and removal
 * - Listing, lookup and run history
 * - Cron description and preview
 * - Manual triggering
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    public static final int MAX_PREVIEW = 100;

    private final TaskStore taskStore;
    private final CronEvaluator cronEvaluator;
    private final DistributedScheduler scheduler;
    private final Clock clock;

    // === Job Creation ===

    /**
     * Create a job and return its id
     *
     * @throws com.example.cronscheduler.exception.InvalidCronExpressionException if the cron expression is invalid
     */
    public String addJob(String name, String cronExpression, Map<String, Object> callbackConfig, boolean enabled) {
        return addJob(name, null, cronExpression, callbackConfig, enabled, null).getId();
    }

    public ScheduledJob addJob(String name, String description, String cronExpression, Map<String, Object> callbackConfig,
                               boolean enabled, String createdBy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
        var now = clock.instant();
        var cron = cronEvaluator.validate(cronExpression, now);

        var job = ScheduledJob.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description(description)
                .cronExpression(cron.getExpression())
                .callbackConfig(callbackConfig != null ? new HashMap<>(callbackConfig) : new HashMap<>())
                .enabled(enabled)
                .nextRun(cronEvaluator.nextRun(cron, now))
                .status(JobStatus.PENDING)
                .createdAt(now)
                .createdBy(createdBy)
                .build();

        taskStore.put(job);
        log.info("Created job {} '{}' ({}), next run {}", job.getId(), name, job.getCronExpression(), job.getNextRun());
        return job;
    }

    // === Job Updates ===

    public ScheduledJob updateJob(String jobId, String name, String cronExpression, Map<String, Object> callbackConfig, Boolean enabled) {
        return updateJob(jobId, name, null, cronExpression, callbackConfig, enabled);
    }

    /**
     * Apply the non-null fields. A changed cron expression or a re-enable recomputes {@code nextRun}.
     * Only these user-owned fields are written, so a run finishing meanwhile keeps its outcome.
     */
    public ScheduledJob updateJob(String jobId, String name, String description, String cronExpression,
                                  Map<String, Object> callbackConfig, Boolean enabled) {
        if (name != null && name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
        var now = clock.instant();
        var cron = cronExpression != null ? cronEvaluator.validate(cronExpression, now).getExpression() : null;

        var updated = taskStore.update(jobId, job -> applyChanges(job, name, description, cron, callbackConfig, enabled, now));
        if (updated.isEmpty()) {
            return getJob(jobId);
        }
        log.info("Updated job {}, next run {}", jobId, updated.get().getNextRun());
        return updated.get();
    }

    /**
     * Enable a job; enabling an enabled job changes nothing
     */
    public ScheduledJob enableJob(String jobId) {
        return updateJob(jobId, null, null, null, null, true);
    }

    /**
     * Disable a job, keeping its nextRun; disabling a disabled job changes nothing
     */
    public ScheduledJob disableJob(String jobId) {
        var disabled = taskStore.update(jobId, job -> {
            if (!job.isEnabled()) {
                return false;
            }
            job.setEnabled(false);
            return true;
        });
        if (disabled.isEmpty()) {
            return getJob(jobId);
        }
        log.info("Disabled job {}", jobId);
        return disabled.get();
    }

    public void removeJob(String jobId) {
        if (!taskStore.delete(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Removed job {}", jobId);
    }

    /**
     * @return true if anything changed
     */
    private boolean applyChanges(ScheduledJob job, String name, String description, String cronExpression,
                                 Map<String, Object> callbackConfig, Boolean enabled, Instant now) {
        var changed = false;
        var reschedule = false;

        if (name != null && !name.equals(job.getName())) {
            job.setName(name);
            changed = true;
        }
        if (description != null && !description.equals(job.getDescription())) {
            job.setDescription(description);
            changed = true;
        }
        if (cronExpression != null && !cronExpression.equals(job.getCronExpression())) {
            job.setCronExpression(cronExpression);
            reschedule = true;
        }
        if (callbackConfig != null && !callbackConfig.equals(job.getCallbackConfig())) {
            job.setCallbackConfig(new HashMap<>(callbackConfig));
            changed = true;
        }
        if (enabled != null && enabled != job.isEnabled()) {
            job.setEnabled(enabled);
            changed = true;
            if (enabled) {
                job.setFailureCount(0);
                reschedule = true;
            }
        }
        if (reschedule) {
            job.setNextRun(cronEvaluator.nextRun(job.getCronExpression(), now));
        }
        return changed || reschedule;
    }

    // === Job Retrieval ===

    public ScheduledJob getJob(String jobId) {
        return taskStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<ScheduledJob> listJobs(boolean enabledOnly) {
        return taskStore.listAll(enabledOnly);
    }

    /**
     * Run history of a job, newest first
     */
    public List<JobRun> getRunHistory(String jobId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        getJob(jobId);
        return taskStore.listRuns(jobId, limit);
    }

    // === Manual Trigger ===

    public DispatchOutcome triggerJob(String jobId) {
        return scheduler.triggerNow(jobId);
    }

    // === Cron Tools ===

    public CronDescription describeCron(String expression) {
        var description = cronEvaluator.describe(expression);
        description.setNextRuns(previewCron(expression, 5));
        return description;
    }

    /**
     * The next {@code count} fire times from now
     */
    public List<Instant> previewCron(String expression, int count) {
        if (count < 1 || count > MAX_PREVIEW) {
            throw new IllegalArgumentException("Count must be between 1 and " + MAX_PREVIEW);
        }
        var now = clock.instant();
        cronEvaluator.validate(expression, now);
        return cronEvaluator.preview(expression, now, count);
    }
}
