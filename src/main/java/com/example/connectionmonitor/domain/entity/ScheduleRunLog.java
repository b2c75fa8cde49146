package com.example.connectionmonitor.domain.entity;

import com.example.connectionmonitor.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * History entry for one execution of a schedule.
 */
@Entity
@Table(name = "schedule_run_logs", indexes = {
        @Index(name = "idx_run_log_schedule_id", columnList = "schedule_id"),
        @Index(name = "idx_run_log_started_at", columnList = "started_at"),
        @Index(name = "idx_run_log_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRunLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "schedule_id", nullable = false)
    private UUID scheduleId;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;

    @Column(name = "total_connections", nullable = false)
    private Integer totalConnections;

    @Column(name = "success_count", nullable = false)
    private Integer successCount;

    @Column(name = "failure_count", nullable = false)
    private Integer failureCount;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Instance that ran the schedule
     */
    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
