package com.example.connectionmonitor.service.dispatcher;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.config.MetricsConfig;
import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.repository.ScheduleRunLogRepository;
import com.example.connectionmonitor.service.alert.SlackAlertService;
import com.example.connectionmonitor.service.cron.CronPlanner;
import com.example.connectionmonitor.service.runner.RunSummary;
import com.example.connectionmonitor.service.runner.ScheduleRunner;
import com.example.connectionmonitor.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls for due schedules and runs them one after another.
 * <p>
 * ShedLock keeps the poll on a single instance across the cluster; the
 * in-process guard skips a tick while the previous cycle is still running.
 * <p>
 * Per due schedule:
 * 1. Run all of its active connections
 * 2. Persist last-run state and the next occurrence from the cron planner
 * 3. Write a run log, record metrics, alert on failed/error
 * <p>
 * Failures after step 1 are logged and the loop moves on. On shutdown the
 * current schedule finishes and no further schedule is started.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleDispatcher implements SmartLifecycle {

    private final ScheduleStore scheduleStore;
    private final ScheduleRunner scheduleRunner;
    private final CronPlanner cronPlanner;
    private final ScheduleRunLogRepository runLogRepository;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final ConnectionMonitorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    // === Lifecycle ===

    @Override
    public void start() {
        running.set(true);
        log.info("Schedule dispatcher started on instance {}", getInstanceId());
    }

    @Override
    public void stop() {
        running.set(false);
        log.info("Schedule dispatcher stopping");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // === Polling ===

    /**
     * Main polling job: run every enabled schedule whose next run has passed.
     */
    @Scheduled(fixedDelayString = "${connection-monitor.poll-interval-ms:60000}",
            initialDelayString = "${connection-monitor.initial-delay-ms:10000}")
    @SchedulerLock(name = "scheduleDispatcher", lockAtLeastFor = "5s", lockAtMostFor = "30m")
    public void pollDueSchedules() {
        if (!running.get()) {
            log.debug("Dispatcher is stopped, skipping polling cycle");
            return;
        }
        if (!cycleInProgress.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var now = Instant.now();
            var dueSchedules = scheduleStore.listDueSchedules(now);

            if (dueSchedules.isEmpty()) {
                log.debug("No schedules due");
                return;
            }

            log.info("Found {} due schedules", dueSchedules.size());

            var processed = 0;
            for (var schedule : dueSchedules) {
                if (!running.get()) {
                    log.info("Dispatcher stopping, {} due schedules left for the next instance", dueSchedules.size() - processed);
                    break;
                }
                runSchedule(schedule);
                processed++;
            }

            log.info("Polling cycle completed, ran {} schedules", processed);
        } catch (Exception e) {
            log.error("Error in schedule polling cycle: {}", e.getMessage(), e);
        } finally {
            cycleInProgress.set(false);
        }
    }

    /**
     * Run one schedule now, outside the polling cycle (manual trigger).
     */
    public RunSummary runNow(ConnectionTestSchedule schedule) {
        log.info("Manual run requested for schedule {}", schedule.getId());
        return runSchedule(schedule);
    }

    /**
     * Run a schedule and persist everything that follows from it.
     */
    RunSummary runSchedule(ConnectionTestSchedule schedule) {
        var startedAt = Instant.now();
        var summary = scheduleRunner.run(schedule);
        var nextRunAt = cronPlanner.nextRun(schedule.getCronExpression(), startedAt).orElse(null);

        try {
            scheduleStore.saveScheduleRunResult(schedule.getId(), summary, startedAt, nextRunAt);
        } catch (Exception e) {
            log.error("Failed to save run result for schedule {}: {}", schedule.getId(), e.getMessage(), e);
        }

        try {
            scheduleStore.saveRunLog(schedule, summary, startedAt, getInstanceId());
        } catch (Exception e) {
            log.error("Failed to write run log for schedule {}: {}", schedule.getId(), e.getMessage(), e);
        }

        metricsConfig.recordScheduleRun(summary.getStatus());

        if (summary.getStatus().isAlertable()) {
            slackAlertService.sendScheduleFailureAlert(schedule, summary);
        }

        log.info("Schedule {} ran with status {} in {}ms, next run at {}",
                schedule.getId(), summary.getStatus(), summary.getDurationMs(), nextRunAt);
        return summary;
    }

    // === Housekeeping ===

    /**
     * Delete run logs older than the retention period.
     */
    @Scheduled(fixedDelayString = "${connection-monitor.run-log-cleanup-interval-ms:3600000}")
    @SchedulerLock(name = "runLogCleanup", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void purgeOldRunLogs() {
        try {
            var cutoff = Instant.now().minus(properties.getRunLogRetentionDays(), ChronoUnit.DAYS);
            var deleted = runLogRepository.deleteOldLogs(cutoff);
            if (deleted > 0) {
                log.info("Deleted {} run logs older than {}", deleted, cutoff);
            }
        } catch (Exception e) {
            log.error("Error cleaning up run logs: {}", e.getMessage(), e);
        }
    }

    private String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }
}
