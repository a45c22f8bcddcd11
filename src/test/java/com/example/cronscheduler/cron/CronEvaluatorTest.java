package com.example.cronscheduler.cron;

import com.example.cronscheduler.exception.InvalidCronExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CronEvaluator Tests")
class CronEvaluatorTest {

    private final CronEvaluator utc = new CronEvaluator(ZoneOffset.UTC);

    @Nested
    @DisplayName("Next Run")
    class NextRunTests {

        @ParameterizedTest(name = "{0} after {1} -> {2}")
        @CsvSource({
                "'*/15 * * * *',  2024-01-01T00:07:30Z, 2024-01-01T00:15:00Z",
                "'0 * * * *',     2024-01-01T01:00:00Z, 2024-01-01T02:00:00Z",
                "'5/20 * * * *',  2024-01-01T00:30:00Z, 2024-01-01T00:45:00Z",
                "'0 9 * * 1-5',   2024-06-01T10:00:00Z, 2024-06-03T09:00:00Z",
                "'0 0 * * 7',     2024-06-01T12:00:00Z, 2024-06-02T00:00:00Z",
                "'0 0 13 * 5',    2024-09-01T00:00:00Z, 2024-09-06T00:00:00Z",
                "'0 0 31 * *',    2024-04-01T00:00:00Z, 2024-05-31T00:00:00Z",
                "'0 0 1 1 *',     2024-12-31T23:59:59Z, 2025-01-01T00:00:00Z"
        })
        @DisplayName("Should compute the next fire time in UTC")
        void shouldComputeNextFireTime(String expression, String after, String expected) {
            assertThat(utc.nextRun(expression, Instant.parse(after))).isEqualTo(Instant.parse(expected));
        }

        @Test
        @DisplayName("Should evaluate wall-clock time in the configured zone")
        void shouldEvaluateInConfiguredZone() {
            var shanghai = new CronEvaluator(ZoneId.of("Asia/Shanghai"));

            // 09:00 in Shanghai is 01:00 UTC
            assertThat(shanghai.nextRun("0 9 * * *", Instant.parse("2024-06-01T00:00:00Z")))
                    .isEqualTo(Instant.parse("2024-06-01T01:00:00Z"));
        }

        @Test
        @DisplayName("Should shift a time inside a DST gap forward")
        void shouldShiftTimeInsideDstGap() {
            var newYork = new CronEvaluator(ZoneId.of("America/New_York"));

            // 02:30 does not exist on 2024-03-10; it becomes 03:30 EDT
            assertThat(newYork.nextRun("30 2 * * *", Instant.parse("2024-03-10T05:00:00Z")))
                    .isEqualTo(Instant.parse("2024-03-10T07:30:00Z"));
        }

        @Test
        @DisplayName("Should fire once on a repeated DST hour")
        void shouldFireOnceOnRepeatedHour() {
            var newYork = new CronEvaluator(ZoneId.of("America/New_York"));

            var runs = newYork.preview("30 1 * * *", Instant.parse("2024-11-03T04:00:00Z"), 2);

            assertThat(runs).containsExactly(
                    Instant.parse("2024-11-03T05:30:00Z"),
                    Instant.parse("2024-11-04T06:30:00Z"));
        }

        @Test
        @DisplayName("Should throw when the expression never fires")
        void shouldThrowWhenNeverFires() {
            assertThatThrownBy(() -> utc.nextRun("0 0 31 2 *", Instant.parse("2024-01-01T00:00:00Z")))
                    .isInstanceOf(InvalidCronExpressionException.class)
                    .hasMessageContaining("never fires");
        }
    }

    @Nested
    @DisplayName("Validation and Preview")
    class ValidationTests {

        @Test
        @DisplayName("Should reject an expression that never fires")
        void shouldRejectNeverFiring() {
            assertThatThrownBy(() -> utc.validate("0 0 30 2 *", Instant.parse("2024-01-01T00:00:00Z")))
                    .isInstanceOf(InvalidCronExpressionException.class)
                    .hasMessageContaining("never fires");
        }

        @Test
        @DisplayName("Should return the parsed expression when valid")
        void shouldReturnParsedExpression() {
            assertThat(utc.validate("0 0 29 2 *", Instant.parse("2024-01-01T00:00:00Z")).getExpression())
                    .isEqualTo("0 0 29 2 *");
        }

        @Test
        @DisplayName("Should validate relative to the given reference instant")
        void shouldValidateFromReference() {
            // 2100 is not a leap year, so the next 29 February after 2097 is in 2104
            assertThatThrownBy(() -> utc.validate("0 0 29 2 *", Instant.parse("2097-01-01T00:00:00Z")))
                    .isInstanceOf(InvalidCronExpressionException.class)
                    .hasMessageContaining("never fires");
        }

        @Test
        @DisplayName("Should preview consecutive fire times with day-field OR semantics")
        void shouldPreviewConsecutiveFireTimes() {
            var runs = utc.preview("0 0 13 * 5", Instant.parse("2024-09-01T00:00:00Z"), 4);

            assertThat(runs).containsExactly(
                    Instant.parse("2024-09-06T00:00:00Z"),
                    Instant.parse("2024-09-13T00:00:00Z"),
                    Instant.parse("2024-09-20T00:00:00Z"),
                    Instant.parse("2024-09-27T00:00:00Z"));
        }
    }

    @Nested
    @DisplayName("Description")
    class DescriptionTests {

        @Test
        @DisplayName("Should describe a weekday schedule")
        void shouldDescribeWeekdaySchedule() {
            var description = utc.describe("0 9 * * 1-5");

            assertThat(description.getDescription()).isEqualTo("At 09:00, on weekdays 1-5");
            assertThat(description.getTimeZone()).isEqualTo("Z");
            assertThat(description.getFields())
                    .containsEntry("minute", "0")
                    .containsEntry("hour", "9")
                    .containsEntry("day-of-week", "1-5");
        }

        @Test
        @DisplayName("Should describe a stepped schedule")
        void shouldDescribeSteppedSchedule() {
            assertThat(utc.describe("*/15 * * * *").getDescription()).isEqualTo("Every 15 minutes");
        }

        @Test
        @DisplayName("Should describe both day fields as alternatives")
        void shouldDescribeBothDayFields() {
            assertThat(utc.describe("0 0 13 * 5").getDescription())
                    .isEqualTo("At 00:00, on day-of-month 13, or on Friday");
        }

        @Test
        @DisplayName("Should describe a month")
        void shouldDescribeMonth() {
            assertThat(utc.describe("30 6 1 jan *").getDescription())
                    .isEqualTo("At 06:30, on day-of-month 1, in January");
        }
    }
}
