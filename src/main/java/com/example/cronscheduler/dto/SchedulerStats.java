package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * Statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStats {

    private boolean running;
    private String instanceId;
    private String timeZone;
    private ExecutorStats executorStats;
    private Set<String> registeredCallbackKinds;
    private Instant generatedAt;
}
