package com.example.connectionmonitor.domain.repository;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ConnectionTestSchedule entity
 */
@Repository
public interface ConnectionTestScheduleRepository extends JpaRepository<ConnectionTestSchedule, UUID> {

    Optional<ConnectionTestSchedule> findByApplicationId(UUID applicationId);

    /**
     * Enabled schedules whose next run is at or before the given instant,
     * oldest first
     */
    @Query("""
            SELECT s FROM ConnectionTestSchedule s
            WHERE s.enabled = true
              AND s.nextRunAt IS NOT NULL
              AND s.nextRunAt <= :now
            ORDER BY s.nextRunAt ASC
            """)
    List<ConnectionTestSchedule> findDueSchedules(@Param("now") Instant now);

    /**
     * Write the outcome of a run. Touches only run-state columns so a concurrent
     * administrative edit of cron/enabled is not overwritten.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            UPDATE ConnectionTestSchedule s
            SET s.lastRunAt = :lastRunAt,
                s.lastRunStatus = :status,
                s.lastRunMessage = :message,
                s.lastRunDurationMs = :durationMs,
                s.nextRunAt = :nextRunAt,
                s.updatedAt = :lastRunAt
            WHERE s.id = :id
            """)
    int updateRunResult(@Param("id") UUID id,
                        @Param("status") RunStatus status,
                        @Param("message") String message,
                        @Param("durationMs") Long durationMs,
                        @Param("lastRunAt") Instant lastRunAt,
                        @Param("nextRunAt") Instant nextRunAt);

    long countByLastRunStatus(RunStatus status);

    long countByEnabledTrue();
}
