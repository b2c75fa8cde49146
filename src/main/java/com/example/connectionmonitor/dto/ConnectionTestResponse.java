package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response DTO for an on-demand connection test
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionTestResponse {

    private UUID connectionId;
    private boolean success;
    private ConnectionStatus status;
    private String message;
    private ProbeErrorKind errorKind;
    private String errorCode;
    private String errorDetails;
    private long durationMs;
    private Map<String, Object> metadata;
    private Instant testedAt;
}
