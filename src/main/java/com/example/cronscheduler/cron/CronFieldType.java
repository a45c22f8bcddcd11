package com.example.cronscheduler.cron;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * The five positional fields of a standard cron expression with their value domains.
 */
@Getter
@RequiredArgsConstructor
public enum CronFieldType {

    MINUTE("minute", 0, 59, Map.of()),

    HOUR("hour", 0, 23, Map.of()),

    DAY_OF_MONTH("day-of-month", 1, 31, Map.of()),

    MONTH("month", 1, 12, Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12))),

    /**
     * 0 and 7 both mean Sunday
     */
    DAY_OF_WEEK("day-of-week", 0, 7, Map.of(
            "sun", 0, "mon", 1, "tue", 2, "wed", 3, "thu", 4, "fri", 5, "sat", 6));

    private final String displayName;
    private final int min;
    private final int max;
    private final Map<String, Integer> names;
}
