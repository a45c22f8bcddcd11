package com.example.cronscheduler.service.executor;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents the result of one callback invocation.
 * <p>
 * Contains everything reconciliation needs to update the job record
 * and write a run history entry.
 */
@Data
@Builder
public class JobExecutionResult {

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    private String jobId;

    private Outcome status;

    /**
     * Error message if failed
     */
    private String error;

    /**
     * Exception class name if failed
     */
    private String errorType;

    /**
     * Truncated stack trace if available
     */
    private String stackTrace;

    /**
     * Map returned by the callback
     */
    @Builder.Default
    private Map<String, Object> output = new HashMap<>();

    private long durationMs;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Scheduler instance that ran the callback
     */
    private String instanceId;

    public boolean isSuccess() {
        return status == Outcome.SUCCESS;
    }

    /**
     * Create a success result with the callback output
     */
    public static JobExecutionResult success(Map<String, Object> output) {
        return JobExecutionResult.builder()
                .status(Outcome.SUCCESS)
                .output(output != null ? new HashMap<>(output) : new HashMap<>())
                .build();
    }

    /**
     * Create a failure result from a throwable
     */
    public static JobExecutionResult failure(Throwable e) {
        return JobExecutionResult.builder()
                .status(Outcome.FAILURE)
                .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    /**
     * Truncate stack trace to keep run history rows small
     */
    private static String truncateStackTrace(Throwable e) {
        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }
}
