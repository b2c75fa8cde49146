package com.example.connectionmonitor.domain.entity;

import com.example.connectionmonitor.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Cron-driven health-check configuration for one application.
 * <p>
 * At most one schedule exists per application. {@code nextRunAt} always holds
 * the cron's next occurrence as of the last recompute (create, update, toggle,
 * or run); null means the schedule will never be picked up as due.
 */
@Entity
@Table(name = "connection_test_schedules",
        uniqueConstraints = @UniqueConstraint(name = "uk_schedule_application", columnNames = "application_id"),
        indexes = @Index(name = "idx_schedule_enabled_next_run", columnList = "enabled, next_run_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConnectionTestSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "application_id", nullable = false, updatable = false)
    private UUID applicationId;

    /**
     * Five-field cron: minute hour day-of-month month day-of-week
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    // === Last Run State (written by the dispatcher only) ===

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status", length = 20)
    private RunStatus lastRunStatus;

    @Column(name = "last_run_message", columnDefinition = "TEXT")
    private String lastRunMessage;

    @Column(name = "last_run_duration_ms")
    private Long lastRunDurationMs;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.enabled == null) {
            this.enabled = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Check if the schedule should run at the given instant
     */
    public boolean isDue(Instant now) {
        return Boolean.TRUE.equals(enabled) && nextRunAt != null && !nextRunAt.isAfter(now);
    }
}
