package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for connection data.
 * Secrets are never returned, only whether each one is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionResponse {

    private UUID id;
    private UUID applicationId;
    private String name;
    private String description;
    private ConnectionType type;
    private Integer typeCode;
    private String typeDisplayName;
    private String server;
    private Integer port;
    private String databaseName;
    private String apiBaseUrl;
    private String additionalSettings;
    private String username;
    private boolean hasPassword;
    private boolean hasConnectionString;
    private boolean hasApiKey;
    private boolean hasGitHubToken;
    private String gitHubOrganization;
    private String gitHubRepository;
    private Boolean active;
    private ConnectionStatus status;
    private Instant lastTestedAt;
    private String lastTestMessage;
    private String lastTestErrorCode;
    private Instant createdAt;
    private Instant updatedAt;
}
