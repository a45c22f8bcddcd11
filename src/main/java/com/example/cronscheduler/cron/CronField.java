package com.example.cronscheduler.cron;

import com.example.cronscheduler.exception.InvalidCronExpressionException;
import lombok.Getter;

import java.util.BitSet;
import java.util.Locale;

/**
 * One parsed cron field: the set of values it admits.
 * <p>
 * Supports {@code *}, lists {@code a,b}, ranges {@code a-b}, steps {@code *}{@code /n},
 * {@code a-b/n} and {@code a/n}, and month/weekday names.
 */
@Getter
public final class CronField {

    private final CronFieldType type;
    private final String raw;
    private final BitSet values;

    /**
     * True when the field starts with {@code *}. Decides how day-of-month and
     * day-of-week are combined.
     */
    private final boolean unrestricted;

    private CronField(CronFieldType type, String raw, BitSet values) {
        this.type = type;
        this.raw = raw;
        this.values = values;
        this.unrestricted = raw.startsWith("*");
    }

    static CronField parse(String raw, CronFieldType type, String expression) {
        var values = new BitSet(type.getMax() + 1);

        for (var part : raw.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(expression, type, raw, "empty list element");
            }
            parsePart(part, type, values, expression, raw);
        }

        if (type == CronFieldType.DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }

        return new CronField(type, raw, values);
    }

    private static void parsePart(String part, CronFieldType type, BitSet values, String expression, String raw) {
        var rangePart = part;
        var step = 1;
        var slash = part.indexOf('/');
        if (slash >= 0) {
            rangePart = part.substring(0, slash);
            step = parseNumber(part.substring(slash + 1), expression, type, raw);
            if (step < 1) {
                throw invalid(expression, type, raw, "step must be at least 1");
            }
        }

        var fieldEnd = type == CronFieldType.DAY_OF_WEEK ? 6 : type.getMax();
        int low;
        int high;
        if ("*".equals(rangePart)) {
            low = type.getMin();
            high = fieldEnd;
        } else if (rangePart.indexOf('-') > 0) {
            var dash = rangePart.indexOf('-');
            low = parseValue(rangePart.substring(0, dash), type, expression, raw);
            high = parseValue(rangePart.substring(dash + 1), type, expression, raw);
            if (low > high) {
                throw invalid(expression, type, raw, "range start " + low + " is after range end " + high);
            }
        } else {
            low = parseValue(rangePart, type, expression, raw);
            high = slash >= 0 ? Math.max(low, fieldEnd) : low;
        }

        for (var v = low; v <= high; v += step) {
            values.set(v);
        }
    }

    private static int parseValue(String token, CronFieldType type, String expression, String raw) {
        var named = type.getNames().get(token.toLowerCase(Locale.ROOT));
        var value = named != null ? named : parseNumber(token, expression, type, raw);
        if (value < type.getMin() || value > type.getMax()) {
            throw invalid(expression, type, raw,
                    String.format("value %d outside %d-%d", value, type.getMin(), type.getMax()));
        }
        return value;
    }

    private static int parseNumber(String token, String expression, CronFieldType type, String raw) {
        if (token.isEmpty() || token.length() > 4 || !token.chars().allMatch(Character::isDigit)) {
            throw invalid(expression, type, raw, "'" + token + "' is not a number");
        }
        return Integer.parseInt(token);
    }

    private static InvalidCronExpressionException invalid(String expression, CronFieldType type, String raw, String reason) {
        return new InvalidCronExpressionException(expression,
                String.format("%s field '%s': %s", type.getDisplayName(), raw, reason));
    }

    public boolean matches(int value) {
        return values.get(value);
    }

    /**
     * True when the field admits exactly one value and is written as a plain number or name
     */
    public boolean isSingleValue() {
        return values.cardinality() == 1 && raw.indexOf(',') < 0 && raw.indexOf('-') < 0
                && raw.indexOf('/') < 0 && !unrestricted;
    }

    public int firstValue() {
        return values.nextSetBit(0);
    }
}
