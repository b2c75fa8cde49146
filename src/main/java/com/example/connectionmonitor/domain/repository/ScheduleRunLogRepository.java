package com.example.connectionmonitor.domain.repository;

import com.example.connectionmonitor.domain.entity.ScheduleRunLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for ScheduleRunLog entity
 */
@Repository
public interface ScheduleRunLogRepository extends JpaRepository<ScheduleRunLog, UUID> {

    List<ScheduleRunLog> findByScheduleIdOrderByStartedAtDesc(UUID scheduleId, Pageable pageable);

    /**
     * Delete old run logs (for cleanup)
     */
    @Modifying
    @Transactional
    @Query("""
            DELETE FROM ScheduleRunLog rl
            WHERE rl.createdAt < :cutoff
            """)
    int deleteOldLogs(@Param("cutoff") Instant cutoff);

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM ScheduleRunLog rl
            WHERE rl.scheduleId = :scheduleId
            """)
    int deleteByScheduleId(@Param("scheduleId") UUID scheduleId);
}
