package com.example.connectionmonitor.config;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.domain.enums.RunStatus;
import com.example.connectionmonitor.domain.repository.ConnectionTestScheduleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the connection monitor.
 * <p>
 * Exposes Prometheus metrics for:
 * - Schedules by last run status, and enabled schedule count
 * - Probe duration by connection type and outcome
 * - Probe failures by error kind
 * - Schedule runs by status
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ConnectionTestScheduleRepository scheduleRepository;

    private final ConcurrentHashMap<String, AtomicLong> scheduleCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : RunStatus.values()) {
            var key = "last_status_" + status.getCode();
            scheduleCounters.put(key, new AtomicLong(0));

            Gauge.builder("connection_monitor_schedules", scheduleCounters.get(key), AtomicLong::get)
                    .tag("last_status", status.getCode())
                    .description("Number of schedules by last run status")
                    .register(meterRegistry);
        }

        scheduleCounters.put("enabled", new AtomicLong(0));
        Gauge.builder("connection_monitor_schedules_enabled", scheduleCounters.get("enabled"), AtomicLong::get)
                .description("Number of enabled schedules")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the database
     */
    @Scheduled(fixedDelayString = "${connection-monitor.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : RunStatus.values()) {
                scheduleCounters.get("last_status_" + status.getCode())
                        .set(scheduleRepository.countByLastRunStatus(status));
            }
            scheduleCounters.get("enabled").set(scheduleRepository.countByEnabledTrue());
        } catch (Exception e) {
            log.error("Error updating schedule metrics: {}", e.getMessage(), e);
        }
    }

    public void recordProbe(ConnectionType type, boolean success, long durationMs) {
        Timer.builder("connection_monitor_probe_time")
                .tag("type", type.name().toLowerCase())
                .tag("success", String.valueOf(success))
                .description("Connection probe duration")
                .register(meterRegistry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordProbeFailure(ConnectionType type, ProbeErrorKind kind) {
        meterRegistry.counter("connection_monitor_probe_failures",
                "type", type.name().toLowerCase(),
                "error_kind", kind != null ? kind.getCode() : ProbeErrorKind.UNKNOWN.getCode()
        ).increment();
    }

    public void recordScheduleRun(RunStatus status) {
        meterRegistry.counter("connection_monitor_schedule_runs",
                "status", status.getCode()
        ).increment();
    }
}
