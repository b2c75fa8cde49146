package com.example.connectionmonitor.service.store;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.domain.entity.ScheduleRunLog;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.runner.RunSummary;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persistence operations the scheduling core depends on.
 */
public interface ScheduleStore {

    /**
     * Enabled schedules with a non-null next run at or before {@code now}, earliest first
     */
    List<ConnectionTestSchedule> listDueSchedules(Instant now);

    /**
     * Active connections of an application
     */
    List<ExternalConnection> getConnectionsForApplication(UUID applicationId);

    /**
     * Write run-state columns only; cron and enabled are left alone.
     */
    void saveScheduleRunResult(UUID scheduleId, RunSummary summary, Instant lastRunAt, Instant nextRunAt);

    void recordConnectionTestResult(UUID connectionId, ProbeOutcome outcome, Instant testedAt);

    ScheduleRunLog saveRunLog(ConnectionTestSchedule schedule, RunSummary summary, Instant startedAt, String executorInstance);

    /**
     * Create or replace the schedule of an application.
     */
    ConnectionTestSchedule upsertSchedule(UUID applicationId, String cronExpression, boolean enabled, Instant nextRunAt);

    void deleteSchedule(UUID scheduleId);
}
