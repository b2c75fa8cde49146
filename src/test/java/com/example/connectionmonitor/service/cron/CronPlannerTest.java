package com.example.connectionmonitor.service.cron;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CronPlanner Tests")
class CronPlannerTest {

    private final CronPlanner cronPlanner = new CronPlanner();

    @Nested
    @DisplayName("nextRun Tests")
    class NextRunTests {

        @Test
        @DisplayName("Should compute next daily occurrence on the following day")
        void shouldComputeNextDailyOccurrence() {
            // Given
            var from = Instant.parse("2024-01-01T10:00:00Z");

            // When
            var next = cronPlanner.nextRun("0 9 * * *", from);

            // Then
            assertThat(next).contains(Instant.parse("2024-01-02T09:00:00Z"));
        }

        @Test
        @DisplayName("Should return next occurrence strictly after from")
        void shouldReturnOccurrenceStrictlyAfterFrom() {
            // Given
            var from = Instant.parse("2024-01-01T09:00:00Z");

            // When
            var next = cronPlanner.nextRun("0 9 * * *", from);

            // Then
            assertThat(next).contains(Instant.parse("2024-01-02T09:00:00Z"));
        }

        @Test
        @DisplayName("Should compute every-15-minutes occurrence")
        void shouldComputeStepOccurrence() {
            // Given
            var from = Instant.parse("2024-03-10T12:07:30Z");

            // When
            var next = cronPlanner.nextRun("*/15 * * * *", from);

            // Then
            assertThat(next).contains(Instant.parse("2024-03-10T12:15:00Z"));
        }

        @Test
        @DisplayName("Should evaluate day-of-week field in UTC")
        void shouldEvaluateWeeklyInUtc() {
            // Given - 2024-01-01 is a Monday
            var from = Instant.parse("2024-01-01T10:00:00Z");

            // When
            var next = cronPlanner.nextRun("30 8 * * 3", from);

            // Then - next Wednesday
            assertThat(next).contains(Instant.parse("2024-01-03T08:30:00Z"));
        }

        @Test
        @DisplayName("Should be deterministic and monotonic in from")
        void shouldBeMonotonic() {
            // Given
            var earlier = Instant.parse("2024-05-01T00:00:00Z");
            var later = Instant.parse("2024-05-01T13:45:00Z");

            // When
            var first = cronPlanner.nextRun("0 */6 * * *", earlier).orElseThrow();
            var again = cronPlanner.nextRun("0 */6 * * *", earlier).orElseThrow();
            var second = cronPlanner.nextRun("0 */6 * * *", later).orElseThrow();

            // Then
            assertThat(first).isEqualTo(again);
            assertThat(second).isAfterOrEqualTo(first);
            assertThat(first).isAfter(earlier);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "0 9 * *", "0 0 9 * * *", "61 * * * *", "a b c d e"})
        @DisplayName("Should return empty for invalid expressions")
        void shouldReturnEmptyForInvalid(String expression) {
            // When
            var next = cronPlanner.nextRun(expression, Instant.parse("2024-01-01T00:00:00Z"));

            // Then
            assertThat(next).isEmpty();
        }

        @Test
        @DisplayName("Should return empty for null expression")
        void shouldReturnEmptyForNull() {
            assertThat(cronPlanner.nextRun(null, Instant.now())).isEmpty();
        }
    }

    @Nested
    @DisplayName("validate Tests")
    class ValidateTests {

        @Test
        @DisplayName("Should accept a five-field expression with description and next run")
        void shouldAcceptValidExpression() {
            // Given
            var from = Instant.parse("2024-01-01T10:00:00Z");

            // When
            var result = cronPlanner.validate("0 9 * * *", from);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getDescription()).isEqualTo("Daily at 9:00");
            assertThat(result.getNextRunAt()).isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
            assertThat(result.getErrorMessage()).isNull();
        }

        @Test
        @DisplayName("Should reject wrong field count with a descriptive message")
        void shouldRejectWrongFieldCount() {
            // When
            var result = cronPlanner.validate("0 9 * *");

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrorMessage()).contains("5 fields").contains("has 4");
        }

        @Test
        @DisplayName("Should reject out-of-range values without throwing")
        void shouldRejectOutOfRange() {
            // When
            var result = cronPlanner.validate("0 25 * * *");

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrorMessage()).isNotBlank();
        }

        @Test
        @DisplayName("Should accept fields separated by tabs and repeated spaces")
        void shouldAcceptMixedWhitespace() {
            // Given
            var from = Instant.parse("2024-01-01T10:00:00Z");

            // When
            var result = cronPlanner.validate("0\t9  * *\t*", from);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.getNextRunAt()).isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
            assertThat(cronPlanner.nextRun("0\t9  * *\t*", from)).contains(Instant.parse("2024-01-02T09:00:00Z"));
        }

        @Test
        @DisplayName("Should reject an expression with no matching date")
        void shouldRejectExpressionThatNeverFires() {
            // When
            var result = cronPlanner.validate("0 0 31 2 *");

            // Then
            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrorMessage()).contains("never fires");
            assertThat(result.getNextRunAt()).isNull();
            assertThat(cronPlanner.nextRun("0 0 31 2 *", Instant.now())).isEmpty();
        }

        @Test
        @DisplayName("Should reject empty expression")
        void shouldRejectEmpty() {
            var result = cronPlanner.validate("");

            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrorMessage()).isNotBlank();
        }
    }

    @Nested
    @DisplayName("describe Tests")
    class DescribeTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "* * * * *    | Every minute",
                "5 * * * *    | Every hour at minute 5",
                "0 9 * * *    | Daily at 9:00",
                "30 14 * * *  | Daily at 14:30",
                "5 8 * * 1    | Weekly on day 1 at 8:05",
                "0 6 15 * *   | Monthly on day 15 at 6:00",
                "*/5 * * * *  | Custom schedule",
                "0 9 1 1 *    | Custom schedule",
                "0 9 * *      | Invalid cron expression"
        })
        @DisplayName("Should describe common shapes")
        void shouldDescribeCommonShapes(String expression, String expected) {
            assertThat(cronPlanner.describe(expression)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should describe null as invalid")
        void shouldDescribeNullAsInvalid() {
            assertThat(cronPlanner.describe(null)).isEqualTo("Invalid cron expression");
        }
    }
}
