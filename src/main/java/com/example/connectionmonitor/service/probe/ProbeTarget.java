package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Decrypted, probe-ready view of a connection.
 * <p>
 * Lives only for the duration of one probe call; secrets are excluded from
 * {@code toString} so the object can be logged.
 */
@Getter
@Builder
@ToString
public class ProbeTarget {

    private final UUID connectionId;
    private final String name;
    private final ConnectionType type;

    private final String server;
    private final Integer port;
    private final String databaseName;
    private final String apiBaseUrl;
    private final String additionalSettings;

    private final String username;

    @ToString.Exclude
    private final String password;

    @ToString.Exclude
    private final String connectionString;

    @ToString.Exclude
    private final String apiKey;

    @ToString.Exclude
    private final String gitHubToken;

    private final String gitHubOrganization;
    private final String gitHubRepository;

    public boolean hasConnectionString() {
        return connectionString != null && !connectionString.isBlank();
    }

    public boolean hasUsername() {
        return username != null && !username.isBlank();
    }
}
