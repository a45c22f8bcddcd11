package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String id;
    private String name;
    private String description;
    private String cronExpression;
    private String callbackKind;
    private Map<String, Object> callbackConfig;
    private boolean enabled;
    private Instant nextRun;
    private Instant lastRun;
    private long runCount;
    private int failureCount;
    private JobStatus status;
    private String lastError;
    private Long lastDurationMs;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
}
