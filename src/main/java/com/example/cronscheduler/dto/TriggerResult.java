package com.example.cronscheduler.dto;

import com.example.cronscheduler.service.executor.DispatchOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a manual trigger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResult {

    private String jobId;
    private DispatchOutcome outcome;
}
