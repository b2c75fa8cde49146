package com.example.connectionmonitor.dto;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.UUID;

/**
 * Request DTO for creating a connection.
 * Secrets arrive in plaintext and are encrypted before they are stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConnectionRequest {

    private UUID applicationId;

    @NotBlank(message = "Name is required")
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull(message = "Connection type is required")
    private ConnectionType type;

    private String server;

    @Min(1)
    @Max(65535)
    private Integer port;

    private String databaseName;

    private String apiBaseUrl;

    /**
     * Extra driver settings, "key=value" pairs separated by ';' or '&'
     */
    private String additionalSettings;

    private String username;

    @ToString.Exclude
    private String password;

    @ToString.Exclude
    private String connectionString;

    @ToString.Exclude
    private String apiKey;

    @ToString.Exclude
    private String gitHubToken;

    private String gitHubOrganization;

    private String gitHubRepository;

    @Builder.Default
    private boolean active = true;
}
