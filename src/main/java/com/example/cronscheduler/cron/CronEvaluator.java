package com.example.cronscheduler.cron;

import com.example.cronscheduler.exception.InvalidCronExpressionException;
import lombok.Getter;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Computes cron fire times.
 * <p>
 * All expressions are evaluated as wall-clock times in a single scheduler-wide zone.
 * A local time falling into a DST gap is shifted forward by the gap; candidates that do
 * not land strictly after the reference instant are skipped. Holds no mutable state.
 */
@Getter
public class CronEvaluator {

    private final ZoneId zone;

    public CronEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Validate an expression, including that it fires at least once after {@code reference}.
     *
     * @throws InvalidCronExpressionException if invalid
     */
    public CronExpression validate(String expression, Instant reference) {
        var cron = CronExpression.parse(expression);
        if (cron.nextMatch(ZonedDateTime.ofInstant(reference, zone).toLocalDateTime()).isEmpty()) {
            throw new InvalidCronExpressionException(expression, "expression never fires");
        }
        return cron;
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * @throws InvalidCronExpressionException if the expression is invalid or never fires
     */
    public Instant nextRun(String expression, Instant after) {
        return nextRun(CronExpression.parse(expression), after);
    }

    public Instant nextRun(CronExpression cron, Instant after) {
        var reference = ZonedDateTime.ofInstant(after, zone);
        var candidate = reference.toLocalDateTime();

        while (true) {
            var match = cron.nextMatch(candidate)
                    .orElseThrow(() -> new InvalidCronExpressionException(cron.getExpression(), "expression never fires"));
            var instant = ZonedDateTime.ofLocal(match, zone, reference.getOffset()).toInstant();
            if (instant.isAfter(after)) {
                return instant;
            }
            candidate = match;
        }
    }

    /**
     * The next {@code count} fire times after {@code from}
     */
    public List<Instant> preview(String expression, Instant from, int count) {
        var cron = CronExpression.parse(expression);
        var runs = new ArrayList<Instant>(count);
        var cursor = from;
        for (var i = 0; i < count; i++) {
            cursor = nextRun(cron, cursor);
            runs.add(cursor);
        }
        return runs;
    }

    /**
     * Describe an expression in plain English
     */
    public CronDescription describe(String expression) {
        var cron = CronExpression.parse(expression);

        var fields = new LinkedHashMap<String, String>();
        fields.put(CronFieldType.MINUTE.getDisplayName(), cron.getMinutes().getRaw());
        fields.put(CronFieldType.HOUR.getDisplayName(), cron.getHours().getRaw());
        fields.put(CronFieldType.DAY_OF_MONTH.getDisplayName(), cron.getDaysOfMonth().getRaw());
        fields.put(CronFieldType.MONTH.getDisplayName(), cron.getMonths().getRaw());
        fields.put(CronFieldType.DAY_OF_WEEK.getDisplayName(), cron.getDaysOfWeek().getRaw());

        return CronDescription.builder()
                .expression(cron.getExpression())
                .description(buildDescription(cron))
                .fields(fields)
                .timeZone(zone.getId())
                .build();
    }

    private String buildDescription(CronExpression cron) {
        var phrases = new ArrayList<String>();
        var minutes = cron.getMinutes();
        var hours = cron.getHours();

        if (minutes.isSingleValue() && hours.isSingleValue()) {
            phrases.add(String.format("at %02d:%02d", hours.firstValue(), minutes.firstValue()));
        } else {
            phrases.add(describeStepped(minutes, "every minute", "minute", "minutes"));
            if (!"*".equals(hours.getRaw())) {
                phrases.add(hours.isSingleValue()
                        ? "past hour " + hours.firstValue()
                        : describeStepped(hours, "every hour", "hour", "hours"));
            }
        }

        var days = cron.getDaysOfMonth();
        if (!"*".equals(days.getRaw())) {
            phrases.add("on day-of-month " + days.getRaw());
        }

        var months = cron.getMonths();
        if (!"*".equals(months.getRaw())) {
            phrases.add(months.isSingleValue()
                    ? "in " + Month.of(months.firstValue()).getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                    : "in months " + months.getRaw());
        }

        var weekdays = cron.getDaysOfWeek();
        if (!"*".equals(weekdays.getRaw())) {
            var joiner = days.isUnrestricted() ? "" : "or ";
            phrases.add(weekdays.isSingleValue()
                    ? joiner + "on " + dayName(weekdays.firstValue())
                    : joiner + "on weekdays " + weekdays.getRaw());
        }

        var text = String.join(", ", phrases);
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String describeStepped(CronField field, String every, String singular, String plural) {
        var raw = field.getRaw();
        if ("*".equals(raw)) {
            return every;
        }
        if (raw.startsWith("*/")) {
            return "every " + raw.substring(2) + " " + plural;
        }
        if (field.isSingleValue()) {
            return "at " + singular + " " + field.firstValue();
        }
        return "at " + plural + " " + raw;
    }

    private static String dayName(int value) {
        var day = value == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(value);
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
