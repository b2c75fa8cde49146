package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private UUID applicationId;
    private String cronExpression;

    /**
     * Human-readable form of the cron, e.g. "Daily at 9:00"
     */
    private String cronDescription;

    private Boolean enabled;
    private Instant lastRunAt;
    private RunStatus lastRunStatus;
    private String lastRunMessage;
    private Long lastRunDurationMs;
    private Instant nextRunAt;
    private Instant createdAt;
    private Instant updatedAt;
}
