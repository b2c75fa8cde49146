package com.example.connectionmonitor.service.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of validating a cron expression. Also returned as-is by the validate-cron endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronValidationResult {

    private boolean valid;
    private String description;
    private Instant nextRunAt;
    private String errorMessage;

    public static CronValidationResult valid(String description, Instant nextRunAt) {
        return CronValidationResult.builder()
                .valid(true)
                .description(description)
                .nextRunAt(nextRunAt)
                .build();
    }

    public static CronValidationResult invalid(String errorMessage) {
        return CronValidationResult.builder()
                .valid(false)
                .errorMessage(errorMessage != null && !errorMessage.isBlank() ? errorMessage : "Invalid cron expression")
                .build();
    }
}
