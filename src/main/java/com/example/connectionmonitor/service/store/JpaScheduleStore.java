package com.example.connectionmonitor.service.store;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.domain.entity.ScheduleRunLog;
import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.repository.ConnectionTestScheduleRepository;
import com.example.connectionmonitor.domain.repository.ExternalConnectionRepository;
import com.example.connectionmonitor.domain.repository.ScheduleRunLogRepository;
import com.example.connectionmonitor.exception.ResourceNotFoundException;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.runner.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaScheduleStore implements ScheduleStore {

    private final ConnectionTestScheduleRepository scheduleRepository;
    private final ExternalConnectionRepository connectionRepository;
    private final ScheduleRunLogRepository runLogRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ConnectionTestSchedule> listDueSchedules(Instant now) {
        return scheduleRepository.findDueSchedules(now);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExternalConnection> getConnectionsForApplication(UUID applicationId) {
        return connectionRepository.findByApplicationIdAndActiveTrueOrderByNameAsc(applicationId);
    }

    @Override
    @Transactional
    public void saveScheduleRunResult(UUID scheduleId, RunSummary summary, Instant lastRunAt, Instant nextRunAt) {
        var updated = scheduleRepository.updateRunResult(scheduleId, summary.getStatus(), summary.getMessage(),
                summary.getDurationMs(), lastRunAt, nextRunAt);
        if (updated == 0) {
            throw new ResourceNotFoundException("Schedule", scheduleId);
        }
    }

    @Override
    @Transactional
    public void recordConnectionTestResult(UUID connectionId, ProbeOutcome outcome, Instant testedAt) {
        var connection = connectionRepository.findById(connectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Connection", connectionId));

        connection.setStatus(ConnectionStatus.fromProbe(outcome.isSuccess()));
        connection.setLastTestedAt(testedAt);
        connection.setLastTestMessage(outcome.getMessage());
        connection.setLastTestErrorCode(outcome.isSuccess() ? null : outcome.getErrorCode());
        connectionRepository.save(connection);
    }

    @Override
    @Transactional
    public ScheduleRunLog saveRunLog(ConnectionTestSchedule schedule, RunSummary summary, Instant startedAt, String executorInstance) {
        var runLog = ScheduleRunLog.builder()
                .scheduleId(schedule.getId())
                .applicationId(schedule.getApplicationId())
                .status(summary.getStatus())
                .message(summary.getMessage())
                .totalConnections(summary.getTotalConnections())
                .successCount(summary.getSuccessCount())
                .failureCount(summary.getFailureCount())
                .startedAt(startedAt)
                .completedAt(startedAt.plusMillis(summary.getDurationMs()))
                .durationMs(summary.getDurationMs())
                .executorInstance(executorInstance)
                .build();
        return runLogRepository.save(runLog);
    }

    @Override
    @Transactional
    public ConnectionTestSchedule upsertSchedule(UUID applicationId, String cronExpression, boolean enabled, Instant nextRunAt) {
        var schedule = scheduleRepository.findByApplicationId(applicationId)
                .orElseGet(() -> ConnectionTestSchedule.builder().applicationId(applicationId).build());

        schedule.setCronExpression(cronExpression.trim());
        schedule.setEnabled(enabled);
        schedule.setNextRunAt(nextRunAt);

        schedule = scheduleRepository.save(schedule);
        log.info("Saved schedule {} for application {}: cron='{}', enabled={}, nextRunAt={}",
                schedule.getId(), applicationId, cronExpression, enabled, nextRunAt);
        return schedule;
    }

    @Override
    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ResourceNotFoundException("Schedule", scheduleId);
        }
        runLogRepository.deleteByScheduleId(scheduleId);
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }
}
