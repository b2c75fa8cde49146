package com.example.connectionmonitor.service.runner;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.service.probe.ConnectionTestService;
import com.example.connectionmonitor.service.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every active connection of a schedule's application through the probe
 * layer and aggregates the outcomes.
 * <p>
 * Flow:
 * 1. Load active connections; none means SKIPPED and no probes
 * 2. Probe each connection (sequentially, or on the probe pool when parallelism is above 1)
 * 3. Record each outcome on its connection; a failed write does not change the counts
 * 4. Aggregate counts into a status
 * <p>
 * Never throws and never writes schedule fields.
 */
@Slf4j
@Service
public class ScheduleRunner {

    private final ScheduleStore scheduleStore;
    private final ConnectionTestService connectionTestService;
    private final ConnectionMonitorProperties properties;
    private final ExecutorService probeExecutor;

    public ScheduleRunner(ScheduleStore scheduleStore, ConnectionTestService connectionTestService, ConnectionMonitorProperties properties,
                          @Qualifier("probeExecutor") ExecutorService probeExecutor) {
        this.scheduleStore = scheduleStore;
        this.connectionTestService = connectionTestService;
        this.properties = properties;
        this.probeExecutor = probeExecutor;
    }

    public RunSummary run(ConnectionTestSchedule schedule) {
        var startedAt = Instant.now();
        var applicationId = schedule.getApplicationId();

        try {
            var connections = scheduleStore.getConnectionsForApplication(applicationId);

            if (connections.isEmpty()) {
                log.info("Schedule {} skipped: application {} has no active connections", schedule.getId(), applicationId);
                return RunSummary.skipped(elapsedMs(startedAt));
            }

            log.info("Schedule {} testing {} connections for application {}", schedule.getId(), connections.size(), applicationId);

            var successCount = new AtomicInteger();
            var failureCount = new AtomicInteger();

            if (properties.getProbeParallelism() > 1 && connections.size() > 1) {
                probeInParallel(connections, successCount, failureCount);
            } else {
                for (var connection : connections) {
                    probe(connection, successCount, failureCount);
                }
            }

            var summary = RunSummary.fromCounts(successCount.get(), failureCount.get(), elapsedMs(startedAt));
            log.info("Schedule {} finished with status {}: {}", schedule.getId(), summary.getStatus(), summary.getMessage());
            return summary;
        } catch (Exception e) {
            log.error("Schedule {} run failed: {}", schedule.getId(), e.getMessage(), e);
            return RunSummary.error(e.getMessage(), elapsedMs(startedAt));
        }
    }

    private void probeInParallel(List<ExternalConnection> connections, AtomicInteger successCount, AtomicInteger failureCount) {
        var futures = connections.stream()
                .map(connection -> CompletableFuture.runAsync(
                        () -> probe(connection, successCount, failureCount),
                        probeExecutor
                )).toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Probe one connection and count it. Any failure in this step counts as a failed probe.
     */
    private void probe(ExternalConnection connection, AtomicInteger successCount, AtomicInteger failureCount) {
        boolean success;
        try {
            var outcome = connectionTestService.test(connection);
            success = outcome.isSuccess();
            try {
                scheduleStore.recordConnectionTestResult(connection.getId(), outcome, Instant.now());
            } catch (Exception e) {
                log.error("Failed to record test result for connection {}: {}", connection.getId(), e.getMessage(), e);
            }
        } catch (Exception e) {
            log.error("Error testing connection {}: {}", connection.getId(), e.getMessage(), e);
            success = false;
        }

        if (success) {
            successCount.incrementAndGet();
        } else {
            failureCount.incrementAndGet();
        }
    }

    private static long elapsedMs(Instant startedAt) {
        return Duration.between(startedAt, Instant.now()).toMillis();
    }
}
