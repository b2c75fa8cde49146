package com.example.connectionmonitor.mapper;

import com.example.connectionmonitor.domain.entity.ConnectionTestSchedule;
import com.example.connectionmonitor.domain.entity.ScheduleRunLog;
import com.example.connectionmonitor.dto.ScheduleResponse;
import com.example.connectionmonitor.dto.ScheduleRunLogResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for schedules and their run history
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    /**
     * The cron description is filled in by the service
     */
    @Mapping(target = "cronDescription", ignore = true)
    ScheduleResponse toResponse(ConnectionTestSchedule schedule);

    ScheduleRunLogResponse toRunLogResponse(ScheduleRunLog runLog);

    List<ScheduleRunLogResponse> toRunLogResponses(List<ScheduleRunLog> runLogs);
}
