package com.example.connectionmonitor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or replacing a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertScheduleRequest {

    /**
     * Five-field cron: minute hour day-of-month month day-of-week (UTC)
     */
    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    @Builder.Default
    private boolean enabled = true;
}
