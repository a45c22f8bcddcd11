package com.example.cronscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Snapshot of the executor's slot usage
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutorStats {

    private int maxConcurrent;
    private int runningCount;
    private int freeSlots;
    private Set<String> runningJobIds;
}
