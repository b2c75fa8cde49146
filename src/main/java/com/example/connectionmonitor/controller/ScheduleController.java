package com.example.connectionmonitor.controller;

import com.example.connectionmonitor.dto.ApiResponse;
import com.example.connectionmonitor.dto.CronValidationRequest;
import com.example.connectionmonitor.dto.ScheduleResponse;
import com.example.connectionmonitor.dto.ScheduleRunLogResponse;
import com.example.connectionmonitor.dto.UpsertScheduleRequest;
import com.example.connectionmonitor.service.ScheduleManagementService;
import com.example.connectionmonitor.service.cron.CronValidationResult;
import com.example.connectionmonitor.service.runner.RunSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for connection test schedules.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "APIs for managing connection test schedules")
public class ScheduleController {

    private final ScheduleManagementService scheduleManagementService;

    // === Writes ===

    @PutMapping("/applications/{applicationId}")
    @Operation(summary = "Create or replace an application's schedule", description = "One schedule per application; cron is five fields, evaluated in UTC")
    public ResponseEntity<ApiResponse<ScheduleResponse>> upsertSchedule(
            @Parameter(description = "Application UUID") @PathVariable UUID applicationId,
            @Valid @RequestBody UpsertScheduleRequest request) {
        log.info("API: Upsert schedule for application {}", applicationId);

        var response = scheduleManagementService.upsertForApplication(applicationId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule saved successfully"));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Update a schedule", description = "Replace cron expression and enabled flag")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Valid @RequestBody UpsertScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        var response = scheduleManagementService.updateSchedule(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule updated successfully"));
    }

    @PostMapping("/{scheduleId}/toggle")
    @Operation(summary = "Enable or disable a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> toggleSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Toggle schedule {}", scheduleId);

        var response = scheduleManagementService.toggleSchedule(scheduleId);
        var message = Boolean.TRUE.equals(response.getEnabled()) ? "Schedule enabled" : "Schedule disabled";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule", description = "Deletes the schedule and its run history")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        scheduleManagementService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Schedule deleted successfully"));
    }

    // === Queries ===

    @GetMapping
    @Operation(summary = "List schedules")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedules() {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.listSchedules()));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedule(scheduleId)));
    }

    @GetMapping("/applications/{applicationId}")
    @Operation(summary = "Get an application's schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getScheduleForApplication(
            @Parameter(description = "Application UUID") @PathVariable UUID applicationId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getScheduleForApplication(applicationId)));
    }

    @GetMapping("/{scheduleId}/runs")
    @Operation(summary = "Recent runs", description = "Latest run log entries, newest first")
    public ResponseEntity<ApiResponse<List<ScheduleRunLogResponse>>> getRecentRuns(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getRecentRuns(scheduleId, limit)));
    }

    // === Operations ===

    @PostMapping("/{scheduleId}/run")
    @Operation(summary = "Run a schedule now", description = "Tests all active connections of the schedule's application immediately")
    public ResponseEntity<ApiResponse<RunSummary>> runNow(@Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId) {
        log.info("API: Run schedule {} now", scheduleId);

        var summary = scheduleManagementService.runNow(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(summary, summary.getMessage()));
    }

    @PostMapping("/validate-cron")
    @Operation(summary = "Validate a cron expression", description = "Returns validity, description and next run")
    public ResponseEntity<ApiResponse<CronValidationResult>> validateCron(@Valid @RequestBody CronValidationRequest request) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.validateCron(request.getCronExpression())));
    }
}
