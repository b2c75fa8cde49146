package com.example.connectionmonitor.exception;

import lombok.Getter;

/**
 * Rejected cron expression on schedule create or update
 */
@Getter
public class InvalidCronExpressionException extends RuntimeException {

    private final String cronExpression;
    private final String reason;

    public InvalidCronExpressionException(String cronExpression, String reason) {
        super("Invalid cron expression: " + reason);
        this.cronExpression = cronExpression;
        this.reason = reason;
    }
}
