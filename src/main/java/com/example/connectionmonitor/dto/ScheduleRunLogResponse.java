package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for one schedule run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRunLogResponse {

    private UUID id;
    private UUID scheduleId;
    private UUID applicationId;
    private RunStatus status;
    private String message;
    private Integer totalConnections;
    private Integer successCount;
    private Integer failureCount;
    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String executorInstance;
}
