package com.example.cronscheduler.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Human-readable breakdown of a cron expression
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronDescription {

    private String expression;
    private String description;

    /**
     * Raw field text keyed by field name (minute, hour, day-of-month, month, day-of-week)
     */
    private Map<String, String> fields;

    private String timeZone;

    /**
     * Upcoming fire times, when requested
     */
    private List<Instant> nextRuns;
}
