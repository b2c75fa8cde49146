package com.example.connectionmonitor.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for updating a connection.
 * <p>
 * Null fields are left unchanged. For secrets an empty string clears the
 * stored value. The connection type cannot be changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateConnectionRequest {

    @Size(max = 200)
    private String name;

    private String description;

    private String server;

    @Min(1)
    @Max(65535)
    private Integer port;

    private String databaseName;

    private String apiBaseUrl;

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
}
