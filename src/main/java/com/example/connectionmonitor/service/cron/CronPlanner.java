package com.example.connectionmonitor.service.cron;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses five-field cron expressions (minute hour day-of-month month day-of-week)
 * and computes next occurrences in UTC.
 * <p>
 * Spring's {@link CronExpression} does the parsing; it expects a leading seconds
 * field, so every expression is evaluated as {@code "0 " + expression}.
 * Nothing here throws on bad input: {@link #validate} reports it and
 * {@link #nextRun} returns empty. An expression with no matching date
 * (e.g. February 31st) fails validation.
 */
@Slf4j
@Component
public class CronPlanner {

    private static final int FIELD_COUNT = 5;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    /**
     * Validate an expression and, when valid, describe it and compute its next run from now.
     */
    public CronValidationResult validate(String expression) {
        return validate(expression, Instant.now());
    }

    public CronValidationResult validate(String expression, Instant from) {
        try {
            var cron = parse(expression);
            var next = cron.next(from.atZone(ZoneOffset.UTC));
            if (next == null) {
                return CronValidationResult.invalid("Cron expression never fires: no matching date exists");
            }
            return CronValidationResult.valid(describe(expression), next.toInstant());
        } catch (IllegalArgumentException e) {
            return CronValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Next occurrence strictly after {@code from}.
     *
     * @return empty when the expression is invalid or never fires again
     */
    public Optional<Instant> nextRun(String expression, Instant from) {
        try {
            var next = parse(expression).next(from.atZone(ZoneOffset.UTC));
            return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to calculate next run time for cron expression '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Human-readable description for the common shapes. Cosmetic only.
     */
    public String describe(String expression) {
        if (expression == null) {
            return "Invalid cron expression";
        }
        var parts = WHITESPACE.split(expression.trim());
        if (parts.length < FIELD_COUNT) {
            return "Invalid cron expression";
        }

        var minute = parts[0];
        var hour = parts[1];
        var day = parts[2];
        var month = parts[3];
        var dayOfWeek = parts[4];

        if (isAny(minute) && isAny(hour) && isAny(day) && isAny(month) && isAny(dayOfWeek)) {
            return "Every minute";
        }
        if (!isNumber(minute) || !isAny(month)) {
            return "Custom schedule";
        }
        if (isAny(hour) && isAny(day) && isAny(dayOfWeek)) {
            return "Every hour at minute " + minute;
        }
        if (!isNumber(hour)) {
            return "Custom schedule";
        }

        var time = hour + ":" + padMinute(minute);
        if (isAny(day) && isAny(dayOfWeek)) {
            return "Daily at " + time;
        }
        if (isAny(day)) {
            return "Weekly on day " + dayOfWeek + " at " + time;
        }
        if (isAny(dayOfWeek)) {
            return "Monthly on day " + day + " at " + time;
        }
        return "Custom schedule";
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be empty");
        }
        var fields = WHITESPACE.split(expression.trim());
        if (fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException(String.format(
                    "Cron expression must have %d fields (minute hour day-of-month month day-of-week) but has %d",
                    FIELD_COUNT, fields.length));
        }
        // Spring splits on single spaces only
        return CronExpression.parse("0 " + String.join(" ", fields));
    }

    private static boolean isAny(String field) {
        return "*".equals(field);
    }

    private static boolean isNumber(String field) {
        return NUMBER.matcher(field).matches();
    }

    private static String padMinute(String minute) {
        return minute.length() == 1 ? "0" + minute : minute;
    }
}
