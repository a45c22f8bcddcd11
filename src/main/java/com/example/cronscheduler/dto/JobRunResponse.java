package com.example.cronscheduler.dto;

import com.example.cronscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for one run history entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResponse {

    private UUID id;
    private String jobId;
    private Long attemptNumber;
    private JobStatus status;
    private boolean success;
    private String executorInstance;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String errorMessage;
    private String errorType;
    private Map<String, Object> output;
}
