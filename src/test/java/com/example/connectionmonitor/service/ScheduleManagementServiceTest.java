package com.example.connectionmonitor.service;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.repository.ApplicationRepository;
import com.example.connectionmonitor.domain.repository.ConnectionTestScheduleRepository;
import com.example.connectionmonitor.domain.repository.ScheduleRunLogRepository;
import com.example.connectionmonitor.dto.ScheduleResponse;
import com.example.connectionmonitor.dto.UpsertScheduleRequest;
import com.example.connectionmonitor.exception.InvalidCronExpressionException;
import com.example.connectionmonitor.exception.ResourceNotFoundException;
import com.example.connectionmonitor.mapper.ScheduleMapper;
import com.example.connectionmonitor.service.cron.CronPlanner;
import com.example.connectionmonitor.service.dispatcher.ScheduleDispatcher;
import com.example.connectionmonitor.service.runner.RunSummary;
import com.example.connectionmonitor.service.store.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleManagementService Tests")
class ScheduleManagementServiceTest {

    @Mock
    private ConnectionTestScheduleRepository scheduleRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private ScheduleRunLogRepository runLogRepository;

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private ScheduleDispatcher scheduleDispatcher;

    @Spy
    private CronPlanner cronPlanner = new CronPlanner();

    @Mock
    private ScheduleMapper scheduleMapper;

    @InjectMocks
    private ScheduleManagementService scheduleManagementService;

    @Captor
    private ArgumentCaptor<Instant> nextRunCaptor;

    @Captor
    private ArgumentCaptor<ConnectionTestSchedule> scheduleCaptor;

    private UUID applicationId;
    private ConnectionTestSchedule testSchedule;

    @BeforeEach
    void setUp() {
        applicationId = UUID.randomUUID();
        testSchedule = ConnectionTestSchedule.builder()
                .id(UUID.randomUUID())
                .applicationId(applicationId)
                .cronExpression("0 9 * * *")
                .enabled(true)
                .build();
    }

    private void stubMapper() {
        when(scheduleMapper.toResponse(any())).thenAnswer(invocation -> {
            ConnectionTestSchedule schedule = invocation.getArgument(0);
            return ScheduleResponse.builder()
                    .id(schedule.getId())
                    .applicationId(schedule.getApplicationId())
                    .cronExpression(schedule.getCronExpression())
                    .enabled(schedule.getEnabled())
                    .nextRunAt(schedule.getNextRunAt())
                    .build();
        });
    }

    @Nested
    @DisplayName("Upsert Tests")
    class UpsertTests {

        @Test
        @DisplayName("Should store the schedule with the cron's next run")
        void shouldUpsertWithNextRun() {
            // Given
            stubMapper();
            when(applicationRepository.existsById(applicationId)).thenReturn(true);
            when(scheduleStore.upsertSchedule(eq(applicationId), eq("0 9 * * *"), eq(true), any())).thenReturn(testSchedule);
            var request = UpsertScheduleRequest.builder().cronExpression("0 9 * * *").build();

            // When
            var response = scheduleManagementService.upsertForApplication(applicationId, request);

            // Then
            verify(scheduleStore).upsertSchedule(eq(applicationId), eq("0 9 * * *"), eq(true), nextRunCaptor.capture());
            assertThat(nextRunCaptor.getValue()).isAfter(Instant.now());
            assertThat(response.getCronDescription()).isEqualTo("Daily at 9:00");
        }

        @Test
        @DisplayName("Should reject an invalid cron without writing")
        void shouldRejectInvalidCron() {
            // Given
            when(applicationRepository.existsById(applicationId)).thenReturn(true);
            var request = UpsertScheduleRequest.builder().cronExpression("61 * * * *").build();

            // When / Then
            assertThatThrownBy(() -> scheduleManagementService.upsertForApplication(applicationId, request))
                    .isInstanceOf(InvalidCronExpressionException.class);
            verifyNoInteractions(scheduleStore);
        }

        @Test
        @DisplayName("Should reject an unknown application")
        void shouldRejectUnknownApplication() {
            // Given
            when(applicationRepository.existsById(applicationId)).thenReturn(false);
            var request = UpsertScheduleRequest.builder().cronExpression("0 9 * * *").build();

            // When / Then
            assertThatThrownBy(() -> scheduleManagementService.upsertForApplication(applicationId, request))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(scheduleStore);
        }

        @Test
        @DisplayName("Should keep next run populated when saving a disabled schedule")
        void shouldComputeNextRunWhenDisabled() {
            // Given
            stubMapper();
            when(scheduleRepository.findById(testSchedule.getId())).thenReturn(Optional.of(testSchedule));
            when(scheduleStore.upsertSchedule(any(), anyString(), eq(false), any())).thenReturn(testSchedule);
            var request = UpsertScheduleRequest.builder().cronExpression("*/10 * * * *").enabled(false).build();

            // When
            scheduleManagementService.updateSchedule(testSchedule.getId(), request);

            // Then
            verify(scheduleStore).upsertSchedule(eq(applicationId), eq("*/10 * * * *"), eq(false), nextRunCaptor.capture());
            assertThat(nextRunCaptor.getValue()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Toggle Tests")
    class ToggleTests {

        @Test
        @DisplayName("Should recompute next run from now when enabling")
        void shouldRecomputeWhenEnabling() {
            // Given
            stubMapper();
            var stale = Instant.now().minusSeconds(86400);
            testSchedule.setEnabled(false);
            testSchedule.setNextRunAt(stale);
            when(scheduleRepository.findById(testSchedule.getId())).thenReturn(Optional.of(testSchedule));
            when(scheduleRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            var response = scheduleManagementService.toggleSchedule(testSchedule.getId());

            // Then
            verify(scheduleRepository).save(scheduleCaptor.capture());
            assertThat(scheduleCaptor.getValue().getEnabled()).isTrue();
            assertThat(scheduleCaptor.getValue().getNextRunAt()).isAfter(Instant.now());
            assertThat(response.getEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should recompute next run from now when disabling")
        void shouldRecomputeWhenDisabling() {
            // Given
            stubMapper();
            var stale = Instant.now().plusSeconds(30L * 86400);
            testSchedule.setNextRunAt(stale);
            when(scheduleRepository.findById(testSchedule.getId())).thenReturn(Optional.of(testSchedule));
            when(scheduleRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
            var before = Instant.now();

            // When
            scheduleManagementService.toggleSchedule(testSchedule.getId());

            // Then
            verify(scheduleRepository).save(scheduleCaptor.capture());
            var saved = scheduleCaptor.getValue();
            assertThat(saved.getEnabled()).isFalse();
            assertThat(saved.getNextRunAt())
                    .isNotEqualTo(stale)
                    .isAfter(before)
                    .isEqualTo(cronPlanner.nextRun(saved.getCronExpression(), before).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Query and Run Tests")
    class QueryAndRunTests {

        @Test
        @DisplayName("Should throw for a missing schedule")
        void shouldThrowForMissingSchedule() {
            // Given
            var scheduleId = UUID.randomUUID();
            when(scheduleRepository.findById(scheduleId)).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> scheduleManagementService.getSchedule(scheduleId))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining(scheduleId.toString());
        }

        @Test
        @DisplayName("Should throw when the application has no schedule")
        void shouldThrowWhenApplicationHasNoSchedule() {
            // Given
            when(scheduleRepository.findByApplicationId(applicationId)).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> scheduleManagementService.getScheduleForApplication(applicationId))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Should run a schedule through the dispatcher")
        void shouldRunNow() {
            // Given
            var summary = RunSummary.fromCounts(2, 0, 15);
            when(scheduleRepository.findById(testSchedule.getId())).thenReturn(Optional.of(testSchedule));
            when(scheduleDispatcher.runNow(testSchedule)).thenReturn(summary);

            // When
            var result = scheduleManagementService.runNow(testSchedule.getId());

            // Then
            assertThat(result).isSameAs(summary);
        }

        @Test
        @DisplayName("Should delete through the store")
        void shouldDelete() {
            // When
            scheduleManagementService.deleteSchedule(testSchedule.getId());

            // Then
            verify(scheduleStore).deleteSchedule(testSchedule.getId());
        }
    }
}
