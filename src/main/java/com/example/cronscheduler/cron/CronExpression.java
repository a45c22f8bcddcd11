package com.example.cronscheduler.cron;

import com.example.cronscheduler.exception.InvalidCronExpressionException;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Parsed five-field cron expression: {@code minute hour day-of-month month day-of-week}.
 * <p>
 * Immutable and thread-safe. Matching works on wall-clock {@link LocalDateTime}s;
 * time-zone handling is left to {@link CronEvaluator}.
 */
@Getter
public final class CronExpression {

    /**
     * Upper bound of the forward search; covers every leap-day schedule
     */
    static final int SEARCH_YEARS = 5;

    private final String expression;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private final CronField daysOfWeek;

    private CronExpression(String expression, String[] parts) {
        this.expression = expression;
        this.minutes = CronField.parse(parts[0], CronFieldType.MINUTE, expression);
        this.hours = CronField.parse(parts[1], CronFieldType.HOUR, expression);
        this.daysOfMonth = CronField.parse(parts[2], CronFieldType.DAY_OF_MONTH, expression);
        this.months = CronField.parse(parts[3], CronFieldType.MONTH, expression);
        this.daysOfWeek = CronField.parse(parts[4], CronFieldType.DAY_OF_WEEK, expression);
    }

    /**
     * Parse and validate an expression.
     *
     * @throws InvalidCronExpressionException if the expression does not have exactly five
     *                                        fields or a value falls outside its domain
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        var parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields (minute hour day month weekday) but found " + parts.length);
        }
        return new CronExpression(expression.trim(), parts);
    }

    /**
     * Day-of-month and day-of-week: when both are restricted a day matches if either does,
     * otherwise both must match.
     */
    public boolean matchesDay(LocalDate date) {
        var domMatch = daysOfMonth.matches(date.getDayOfMonth());
        var dowMatch = daysOfWeek.matches(date.getDayOfWeek().getValue() % 7);
        if (!daysOfMonth.isUnrestricted() && !daysOfWeek.isUnrestricted()) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    public boolean matches(LocalDateTime time) {
        return time.getSecond() == 0
                && minutes.matches(time.getMinute())
                && hours.matches(time.getHour())
                && months.matches(time.getMonthValue())
                && matchesDay(time.toLocalDate());
    }

    /**
     * First matching wall-clock minute strictly after {@code after}.
     *
     * @return empty if nothing matches within {@value #SEARCH_YEARS} years
     */
    public Optional<LocalDateTime> nextMatch(LocalDateTime after) {
        var candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        var limit = candidate.plusYears(SEARCH_YEARS);

        while (candidate.isBefore(limit)) {
            if (!months.matches(candidate.getMonthValue())) {
                candidate = candidate.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!matchesDay(candidate.toLocalDate())) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.matches(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.matches(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return expression;
    }
}
