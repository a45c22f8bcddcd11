package com.example.cronscheduler.controller;

import com.example.cronscheduler.cron.CronDescription;
import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.CallbackSpec;
import com.example.cronscheduler.dto.CreateJobRequest;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import com.example.cronscheduler.dto.SchedulerStats;
import com.example.cronscheduler.dto.TriggerResult;
import com.example.cronscheduler.dto.UpdateJobRequest;
import com.example.cronscheduler.mapper.JobMapper;
import com.example.cronscheduler.service.JobManagementService;
import com.example.cronscheduler.service.executor.DispatchOutcome;
import com.example.cronscheduler.service.executor.DistributedScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for job management operations.
 * <p>
 * Provides endpoints for:
 * - Creating, updating and removing jobs
 * - Enabling, disabling and manually triggering jobs
 * - Job details and run history
 * - Scheduler statistics
 * - Cron description and preview
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for managing recurring cron jobs")
public class JobController {

    private final JobManagementService jobManagementService;
    private final DistributedScheduler distributedScheduler;
    private final JobMapper jobMapper;

    // === Job Creation ===

    @PostMapping
    @Operation(summary = "Create a job", description = "Create a recurring job from a cron expression and callback")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job '{}' with cron '{}'", request.getName(), request.getCronExpression());

        var job = jobManagementService.addJob(request.getName(), request.getDescription(), request.getCronExpression(),
                toCallbackConfig(request.getCallback()), request.isEnabled(), request.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(jobMapper.toResponse(job), "Job created successfully"));
    }

    // === Job Retrieval ===

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job by its unique identifier")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job ID") @PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(jobManagementService.getJob(jobId))));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List all jobs, optionally only enabled ones")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs(
            @Parameter(description = "Only enabled jobs") @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponseList(jobManagementService.listJobs(enabledOnly))));
    }

    @GetMapping("/{jobId}/runs")
    @Operation(summary = "Get run history", description = "Most recent runs of a job, newest first")
    public ResponseEntity<ApiResponse<List<JobRunResponse>>> getRunHistory(
            @Parameter(description = "Job ID") @PathVariable String jobId,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "20") int limit) {
        var runs = jobManagementService.getRunHistory(jobId, limit);
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toRunResponses(runs)));
    }

    // === Job Updates ===

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Change any of name, description, cron, callback or enabled")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job ID") @PathVariable String jobId,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {}", jobId);

        var job = jobManagementService.updateJob(jobId, request.getName(), request.getDescription(), request.getCronExpression(),
                request.getCallback() != null ? toCallbackConfig(request.getCallback()) : null, request.getEnabled());
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(job), "Job updated successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Remove a job", description = "Delete a job and its run history")
    public ResponseEntity<ApiResponse<Void>> removeJob(@Parameter(description = "Job ID") @PathVariable String jobId) {
        log.info("API: Remove job {}", jobId);

        jobManagementService.removeJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(null, "Job removed successfully"));
    }

    @PostMapping("/{jobId}/enable")
    @Operation(summary = "Enable a job", description = "Enable a job and schedule its next run from now")
    public ResponseEntity<ApiResponse<JobResponse>> enableJob(@Parameter(description = "Job ID") @PathVariable String jobId) {
        log.info("API: Enable job {}", jobId);

        var job = jobManagementService.enableJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(job), "Job enabled"));
    }

    @PostMapping("/{jobId}/disable")
    @Operation(summary = "Disable a job", description = "Stop a job from being scheduled")
    public ResponseEntity<ApiResponse<JobResponse>> disableJob(@Parameter(description = "Job ID") @PathVariable String jobId) {
        log.info("API: Disable job {}", jobId);

        var job = jobManagementService.disableJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(job), "Job disabled"));
    }

    @PostMapping("/{jobId}/trigger")
    @Operation(summary = "Trigger a job now", description = "Run a job immediately on this instance if its lease is free")
    public ResponseEntity<ApiResponse<TriggerResult>> triggerJob(@Parameter(description = "Job ID") @PathVariable String jobId) {
        log.info("API: Trigger job {}", jobId);

        var outcome = jobManagementService.triggerJob(jobId);
        var result = TriggerResult.builder().jobId(jobId).outcome(outcome).build();
        var status = outcome == DispatchOutcome.DISPATCHED || outcome == DispatchOutcome.FAILED ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(ApiResponse.success(result, "Trigger " + outcome.name().toLowerCase()));
    }

    // === Statistics ===

    @GetMapping("/stats")
    @Operation(summary = "Get scheduler statistics", description = "Instance id, executor slots and registered callback kinds")
    public ResponseEntity<ApiResponse<SchedulerStats>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(distributedScheduler.getStats()));
    }

    // === Cron Tools ===

    @GetMapping("/cron/describe")
    @Operation(summary = "Describe a cron expression", description = "Parsed fields, plain-English description and next fire times")
    public ResponseEntity<ApiResponse<CronDescription>> describeCron(
            @Parameter(description = "Five-field cron expression") @RequestParam String expression) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.describeCron(expression)));
    }

    @GetMapping("/cron/preview")
    @Operation(summary = "Preview fire times", description = "Next fire times of a cron expression from now")
    public ResponseEntity<ApiResponse<List<Instant>>> previewCron(
            @Parameter(description = "Five-field cron expression") @RequestParam String expression,
            @Parameter(description = "Number of fire times") @RequestParam(defaultValue = "5") int count) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.previewCron(expression, count)));
    }

    private static Map<String, Object> toCallbackConfig(CallbackSpec callback) {
        return callback != null ? callback.toCallbackConfig() : Map.of();
    }
}
