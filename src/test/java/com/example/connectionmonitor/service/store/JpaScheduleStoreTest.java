package com.example.connectionmonitor.service.store;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.domain.enums.RunStatus;
import com.example.connectionmonitor.domain.repository.ConnectionTestScheduleRepository;
import com.example.connectionmonitor.domain.repository.ExternalConnectionRepository;
import com.example.connectionmonitor.domain.repository.ScheduleRunLogRepository;
import com.example.connectionmonitor.exception.ResourceNotFoundException;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.runner.RunSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaScheduleStore.class)
@DisplayName("JpaScheduleStore Tests")
class JpaScheduleStoreTest {

    @Autowired
    private JpaScheduleStore store;

    @Autowired
    private ConnectionTestScheduleRepository scheduleRepository;

    @Autowired
    private ExternalConnectionRepository connectionRepository;

    @Autowired
    private ScheduleRunLogRepository runLogRepository;

    private final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    private ConnectionTestSchedule saveSchedule(boolean enabled, Instant nextRunAt) {
        return scheduleRepository.saveAndFlush(ConnectionTestSchedule.builder()
                .applicationId(UUID.randomUUID())
                .cronExpression("*/5 * * * *")
                .enabled(enabled)
                .nextRunAt(nextRunAt)
                .build());
    }

    private ExternalConnection saveConnection(UUID applicationId, String name, boolean active) {
        return connectionRepository.saveAndFlush(ExternalConnection.builder()
                .applicationId(applicationId)
                .name(name)
                .type(ConnectionType.POSTGRESQL)
                .server("db.internal")
                .active(active)
                .build());
    }

    @Nested
    @DisplayName("listDueSchedules Tests")
    class ListDueSchedulesTests {

        @Test
        @DisplayName("Should return enabled schedules at or before now, earliest first")
        void shouldReturnDueSchedulesInOrder() {
            // Given
            var later = saveSchedule(true, now.minusSeconds(10));
            var earlier = saveSchedule(true, now.minusSeconds(600));
            var exactlyNow = saveSchedule(true, now);

            // When
            var due = store.listDueSchedules(now);

            // Then
            assertThat(due).extracting(ConnectionTestSchedule::getId)
                    .containsExactly(earlier.getId(), later.getId(), exactlyNow.getId());
        }

        @Test
        @DisplayName("Should exclude disabled, future and never-scheduled entries")
        void shouldExcludeNotDueSchedules() {
            // Given
            saveSchedule(false, now.minusSeconds(60));
            saveSchedule(true, now.plusSeconds(60));
            saveSchedule(true, null);

            // When
            var due = store.listDueSchedules(now);

            // Then
            assertThat(due).isEmpty();
        }
    }

    @Nested
    @DisplayName("Run Result Tests")
    class RunResultTests {

        @Test
        @DisplayName("Should write run state without touching cron or enabled")
        void shouldWriteRunStateOnly() {
            // Given
            var schedule = saveSchedule(true, now.minusSeconds(60));
            var summary = RunSummary.fromCounts(1, 1, 250);
            var nextRun = now.plusSeconds(300);

            // When
            store.saveScheduleRunResult(schedule.getId(), summary, now, nextRun);

            // Then
            var reloaded = scheduleRepository.findById(schedule.getId()).orElseThrow();
            assertThat(reloaded.getLastRunStatus()).isEqualTo(RunStatus.PARTIAL);
            assertThat(reloaded.getLastRunMessage()).isEqualTo("Tested 2 connections: 1 successful, 1 failed");
            assertThat(reloaded.getLastRunDurationMs()).isEqualTo(250L);
            assertThat(reloaded.getLastRunAt()).isEqualTo(now);
            assertThat(reloaded.getNextRunAt()).isEqualTo(nextRun);
            assertThat(reloaded.getCronExpression()).isEqualTo("*/5 * * * *");
            assertThat(reloaded.getEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should throw when the schedule no longer exists")
        void shouldThrowForMissingSchedule() {
            assertThatThrownBy(() -> store.saveScheduleRunResult(UUID.randomUUID(), RunSummary.skipped(1), now, null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Should write a run log with completion time derived from the duration")
        void shouldWriteRunLog() {
            // Given
            var schedule = saveSchedule(true, now);
            var summary = RunSummary.fromCounts(0, 2, 1500);

            // When
            var runLog = store.saveRunLog(schedule, summary, now, "host-1");

            // Then
            var logs = runLogRepository.findByScheduleIdOrderByStartedAtDesc(schedule.getId(), PageRequest.of(0, 10));
            assertThat(logs).hasSize(1);
            assertThat(runLog.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(runLog.getCompletedAt()).isEqualTo(now.plusMillis(1500));
            assertThat(runLog.getFailureCount()).isEqualTo(2);
            assertThat(runLog.getExecutorInstance()).isEqualTo("host-1");
        }
    }

    @Nested
    @DisplayName("Connection Tests")
    class ConnectionTests {

        @Test
        @DisplayName("Should list only active connections of the application by name")
        void shouldListActiveConnections() {
            // Given
            var applicationId = UUID.randomUUID();
            saveConnection(applicationId, "orders-db", true);
            saveConnection(applicationId, "audit-db", true);
            saveConnection(applicationId, "legacy-db", false);
            saveConnection(UUID.randomUUID(), "other-app-db", true);

            // When
            var connections = store.getConnectionsForApplication(applicationId);

            // Then
            assertThat(connections).extracting(ExternalConnection::getName)
                    .containsExactly("audit-db", "orders-db");
        }

        @Test
        @DisplayName("Should record success and clear the previous error code")
        void shouldRecordSuccess() {
            // Given
            var connection = saveConnection(UUID.randomUUID(), "orders-db", true);
            store.recordConnectionTestResult(connection.getId(),
                    ProbeOutcome.failure(ProbeErrorKind.TIMEOUT, "TIMEOUT", "Connection timeout"), now.minusSeconds(60));

            // When
            store.recordConnectionTestResult(connection.getId(), ProbeOutcome.success("PostgreSQL connection successful"), now);

            // Then
            var reloaded = connectionRepository.findById(connection.getId()).orElseThrow();
            assertThat(reloaded.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
            assertThat(reloaded.getLastTestedAt()).isEqualTo(now);
            assertThat(reloaded.getLastTestMessage()).isEqualTo("PostgreSQL connection successful");
            assertThat(reloaded.getLastTestErrorCode()).isNull();
        }

        @Test
        @DisplayName("Should record failure with its error code")
        void shouldRecordFailure() {
            // Given
            var connection = saveConnection(UUID.randomUUID(), "orders-db", true);

            // When
            store.recordConnectionTestResult(connection.getId(),
                    ProbeOutcome.failure(ProbeErrorKind.UNAUTHORIZED, "PG_28P01", "Database connection failed: Login failed"), now);

            // Then
            var reloaded = connectionRepository.findById(connection.getId()).orElseThrow();
            assertThat(reloaded.getStatus()).isEqualTo(ConnectionStatus.FAILED);
            assertThat(reloaded.getLastTestErrorCode()).isEqualTo("PG_28P01");
        }
    }

    @Nested
    @DisplayName("Upsert and Delete Tests")
    class UpsertAndDeleteTests {

        @Test
        @DisplayName("Should create then replace the single schedule of an application")
        void shouldUpsertSchedule() {
            // Given
            var applicationId = UUID.randomUUID();
            var created = store.upsertSchedule(applicationId, " 0 * * * * ", true, now.plusSeconds(60));

            // When
            var updated = store.upsertSchedule(applicationId, "30 2 * * *", false, now.plusSeconds(3600));

            // Then
            assertThat(updated.getId()).isEqualTo(created.getId());
            assertThat(updated.getCronExpression()).isEqualTo("30 2 * * *");
            assertThat(updated.getEnabled()).isFalse();
            assertThat(updated.getNextRunAt()).isEqualTo(now.plusSeconds(3600));
            assertThat(scheduleRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should trim the stored cron expression")
        void shouldTrimCron() {
            var created = store.upsertSchedule(UUID.randomUUID(), "  15 * * * *\t", true, null);

            assertThat(created.getCronExpression()).isEqualTo("15 * * * *");
        }

        @Test
        @DisplayName("Should delete a schedule together with its run logs")
        void shouldDeleteScheduleAndLogs() {
            // Given
            var schedule = saveSchedule(true, now);
            store.saveRunLog(schedule, RunSummary.skipped(1), now, "host-1");
            runLogRepository.flush();

            // When
            store.deleteSchedule(schedule.getId());

            // Then
            assertThat(scheduleRepository.existsById(schedule.getId())).isFalse();
            assertThat(runLogRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should throw when deleting an unknown schedule")
        void shouldThrowWhenDeletingUnknown() {
            assertThatThrownBy(() -> store.deleteSchedule(UUID.randomUUID()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
