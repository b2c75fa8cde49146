package com.example.connectionmonitor.service;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.repository.ApplicationRepository;
import com.example.connectionmonitor.domain.repository.ConnectionTestScheduleRepository;
import com.example.connectionmonitor.domain.repository.ScheduleRunLogRepository;
import com.example.connectionmonitor.dto.ScheduleResponse;
import com.example.connectionmonitor.dto.ScheduleRunLogResponse;
import com.example.connectionmonitor.dto.UpsertScheduleRequest;
import com.example.connectionmonitor.exception.InvalidCronExpressionException;
import com.example.connectionmonitor.exception.ResourceNotFoundException;
import com.example.connectionmonitor.mapper.ScheduleMapper;
import com.example.connectionmonitor.service.cron.CronPlanner;
import com.example.connectionmonitor.service.cron.CronValidationResult;
import com.example.connectionmonitor.service.dispatcher.ScheduleDispatcher;
import com.example.connectionmonitor.service.runner.RunSummary;
import com.example.connectionmonitor.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing connection test schedules.
 * <p>
 * Provides:
 * - Upsert (one schedule per application) with cron validation
 * - Update, toggle and delete
 * - Queries and run history
 * - Manual run
 * <p>
 * Every write that touches cron or enabled recomputes the next run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    private final ConnectionTestScheduleRepository scheduleRepository;
    private final ApplicationRepository applicationRepository;
    private final ScheduleRunLogRepository runLogRepository;
    private final ScheduleStore scheduleStore;
    private final ScheduleDispatcher scheduleDispatcher;
    private final CronPlanner cronPlanner;
    private final ScheduleMapper scheduleMapper;

    // === Writes ===

    /**
     * Create the application's schedule, or replace cron and enabled on the existing one
     */
    @Transactional
    public ScheduleResponse upsertForApplication(UUID applicationId, UpsertScheduleRequest request) {
        log.info("Upserting schedule for application {} with cron '{}'", applicationId, request.getCronExpression());

        if (!applicationRepository.existsById(applicationId)) {
            throw new ResourceNotFoundException("Application", applicationId);
        }

        var nextRunAt = requireNextRun(request.getCronExpression());
        var schedule = scheduleStore.upsertSchedule(applicationId, request.getCronExpression(), request.isEnabled(), nextRunAt);
        return toResponse(schedule);
    }

    @Transactional
    public ScheduleResponse updateSchedule(UUID scheduleId, UpsertScheduleRequest request) {
        var schedule = findSchedule(scheduleId);
        var nextRunAt = requireNextRun(request.getCronExpression());

        schedule = scheduleStore.upsertSchedule(schedule.getApplicationId(), request.getCronExpression(), request.isEnabled(), nextRunAt);
        return toResponse(schedule);
    }

    /**
     * Flip enabled and recompute the next run from now in both directions.
     */
    @Transactional
    public ScheduleResponse toggleSchedule(UUID scheduleId) {
        var schedule = findSchedule(scheduleId);
        var enable = !Boolean.TRUE.equals(schedule.getEnabled());

        schedule.setEnabled(enable);
        schedule.setNextRunAt(cronPlanner.nextRun(schedule.getCronExpression(), Instant.now()).orElse(null));

        schedule = scheduleRepository.save(schedule);
        log.info("Schedule {} {}", scheduleId, enable ? "enabled" : "disabled");
        return toResponse(schedule);
    }

    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        scheduleStore.deleteSchedule(scheduleId);
    }

    // === Queries ===

    @Transactional(readOnly = true)
    public ScheduleResponse getSchedule(UUID scheduleId) {
        return toResponse(findSchedule(scheduleId));
    }

    @Transactional(readOnly = true)
    public ScheduleResponse getScheduleForApplication(UUID applicationId) {
        return scheduleRepository.findByApplicationId(applicationId)
                .map(this::toResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule for application", applicationId));
    }

    @Transactional(readOnly = true)
    public List<ScheduleResponse> listSchedules() {
        return scheduleRepository.findAll(Sort.by("createdAt")).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ScheduleRunLogResponse> getRecentRuns(UUID scheduleId, int limit) {
        findSchedule(scheduleId);
        var runLogs = runLogRepository.findByScheduleIdOrderByStartedAtDesc(scheduleId, PageRequest.of(0, Math.max(1, limit)));
        return scheduleMapper.toRunLogResponses(runLogs);
    }

    public CronValidationResult validateCron(String cronExpression) {
        return cronPlanner.validate(cronExpression);
    }

    // === Manual Run ===

    /**
     * Run the schedule now through the dispatcher's normal path
     */
    public RunSummary runNow(UUID scheduleId) {
        var schedule = findSchedule(scheduleId);
        return scheduleDispatcher.runNow(schedule);
    }

    private ConnectionTestSchedule findSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule", scheduleId));
    }

    private Instant requireNextRun(String cronExpression) {
        var validation = cronPlanner.validate(cronExpression);
        if (!validation.isValid()) {
            throw new InvalidCronExpressionException(cronExpression, validation.getErrorMessage());
        }
        return validation.getNextRunAt();
    }

    private ScheduleResponse toResponse(ConnectionTestSchedule schedule) {
        var response = scheduleMapper.toResponse(schedule);
        response.setCronDescription(cronPlanner.describe(schedule.getCronExpression()));
        return response;
    }
}
