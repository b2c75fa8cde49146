package com.example.connectionmonitor.service;

import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.repository.ApplicationRepository;
import com.example.connectionmonitor.domain.repository.ExternalConnectionRepository;
import com.example.connectionmonitor.dto.ConnectionResponse;
import com.example.connectionmonitor.dto.ConnectionStringValidationRequest;
import com.example.connectionmonitor.dto.ConnectionStringValidationResponse;
import com.example.connectionmonitor.dto.ConnectionTestResponse;
import com.example.connectionmonitor.dto.CreateConnectionRequest;
import com.example.connectionmonitor.dto.UpdateConnectionRequest;
import com.example.connectionmonitor.exception.ResourceNotFoundException;
import com.example.connectionmonitor.mapper.ConnectionMapper;
import com.example.connectionmonitor.service.crypto.CredentialCipher;
import com.example.connectionmonitor.service.probe.ConnectionTestService;
import com.example.connectionmonitor.service.probe.jdbc.ConnectionStringBuilder;
import com.example.connectionmonitor.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing external connections.
 * <p>
 * Secrets are encrypted on the way in and never returned. On update a null
 * secret keeps the stored value and an empty one clears it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionManagementService {

    private final ExternalConnectionRepository connectionRepository;
    private final ApplicationRepository applicationRepository;
    private final CredentialCipher credentialCipher;
    private final ConnectionStringBuilder connectionStringBuilder;
    private final ConnectionTestService connectionTestService;
    private final ScheduleStore scheduleStore;
    private final ConnectionMapper connectionMapper;

    // === Writes ===

    @Transactional
    public ConnectionResponse createConnection(CreateConnectionRequest request) {
        log.info("Creating {} connection '{}' for application {}", request.getType(), request.getName(), request.getApplicationId());

        if (request.getApplicationId() != null && !applicationRepository.existsById(request.getApplicationId())) {
            throw new ResourceNotFoundException("Application", request.getApplicationId());
        }
        checkConnectionString(request.getType(), request.getConnectionString());

        var connection = ExternalConnection.builder()
                .applicationId(request.getApplicationId())
                .name(request.getName().trim())
                .description(request.getDescription())
                .type(request.getType())
                .server(request.getServer())
                .port(request.getPort())
                .databaseName(request.getDatabaseName())
                .apiBaseUrl(request.getApiBaseUrl())
                .additionalSettings(request.getAdditionalSettings())
                .username(request.getUsername())
                .passwordEncrypted(encryptOrNull(request.getPassword()))
                .connectionStringEncrypted(encryptOrNull(request.getConnectionString()))
                .apiKeyEncrypted(encryptOrNull(request.getApiKey()))
                .gitHubTokenEncrypted(encryptOrNull(request.getGitHubToken()))
                .gitHubOrganization(request.getGitHubOrganization())
                .gitHubRepository(request.getGitHubRepository())
                .active(request.isActive())
                .status(ConnectionStatus.UNTESTED)
                .build();

        connection = connectionRepository.save(connection);
        log.info("Created connection {}", connection.getId());
        return connectionMapper.toResponse(connection);
    }

    @Transactional
    public ConnectionResponse updateConnection(UUID connectionId, UpdateConnectionRequest request) {
        var connection = findConnection(connectionId);

        if (request.getName() != null) {
            connection.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            connection.setDescription(request.getDescription());
        }
        if (request.getServer() != null) {
            connection.setServer(request.getServer());
        }
        if (request.getPort() != null) {
            connection.setPort(request.getPort());
        }
        if (request.getDatabaseName() != null) {
            connection.setDatabaseName(request.getDatabaseName());
        }
        if (request.getApiBaseUrl() != null) {
            connection.setApiBaseUrl(request.getApiBaseUrl());
        }
        if (request.getAdditionalSettings() != null) {
            connection.setAdditionalSettings(request.getAdditionalSettings());
        }
        if (request.getUsername() != null) {
            connection.setUsername(request.getUsername());
        }
        if (request.getGitHubOrganization() != null) {
            connection.setGitHubOrganization(request.getGitHubOrganization());
        }
        if (request.getGitHubRepository() != null) {
            connection.setGitHubRepository(request.getGitHubRepository());
        }

        if (request.getPassword() != null) {
            connection.setPasswordEncrypted(encryptOrNull(request.getPassword()));
        }
        if (request.getConnectionString() != null) {
            checkConnectionString(connection.getType(), request.getConnectionString());
            connection.setConnectionStringEncrypted(encryptOrNull(request.getConnectionString()));
        }
        if (request.getApiKey() != null) {
            connection.setApiKeyEncrypted(encryptOrNull(request.getApiKey()));
        }
        if (request.getGitHubToken() != null) {
            connection.setGitHubTokenEncrypted(encryptOrNull(request.getGitHubToken()));
        }

        connection = connectionRepository.save(connection);
        log.info("Updated connection {}", connectionId);
        return connectionMapper.toResponse(connection);
    }

    @Transactional
    public ConnectionResponse toggleConnection(UUID connectionId) {
        var connection = findConnection(connectionId);
        connection.setActive(!connection.isActiveConnection());

        connection = connectionRepository.save(connection);
        log.info("Connection {} {}", connectionId, connection.isActiveConnection() ? "activated" : "deactivated");
        return connectionMapper.toResponse(connection);
    }

    @Transactional
    public void deleteConnection(UUID connectionId) {
        var connection = findConnection(connectionId);
        connectionRepository.delete(connection);
        log.info("Deleted connection {}", connectionId);
    }

    // === Queries ===

    @Transactional(readOnly = true)
    public ConnectionResponse getConnection(UUID connectionId) {
        return connectionMapper.toResponse(findConnection(connectionId));
    }

    @Transactional(readOnly = true)
    public List<ConnectionResponse> listConnections(UUID applicationId) {
        if (applicationId != null) {
            return connectionMapper.toResponseList(connectionRepository.findByApplicationIdOrderByNameAsc(applicationId));
        }
        return connectionMapper.toResponseList(connectionRepository.findAll(Sort.by("name")));
    }

    // === Testing ===

    /**
     * Probe the connection now and record the outcome on it
     */
    public ConnectionTestResponse testConnection(UUID connectionId) {
        var connection = findConnection(connectionId);
        var outcome = connectionTestService.test(connection);
        var testedAt = Instant.now();

        try {
            scheduleStore.recordConnectionTestResult(connectionId, outcome, testedAt);
        } catch (Exception e) {
            log.error("Failed to record test result for connection {}: {}", connectionId, e.getMessage(), e);
        }

        return ConnectionTestResponse.builder()
                .connectionId(connectionId)
                .success(outcome.isSuccess())
                .status(ConnectionStatus.fromProbe(outcome.isSuccess()))
                .message(outcome.getMessage())
                .errorKind(outcome.getErrorKind())
                .errorCode(outcome.getErrorCode())
                .errorDetails(outcome.getErrorDetails())
                .durationMs(outcome.getDurationMs())
                .metadata(outcome.getMetadata())
                .testedAt(testedAt)
                .build();
    }

    public ConnectionStringValidationResponse validateConnectionString(ConnectionStringValidationRequest request) {
        var error = connectionStringBuilder.validate(request.getType(), request.getConnectionString());
        return error == null
                ? ConnectionStringValidationResponse.valid()
                : ConnectionStringValidationResponse.invalid(error);
    }

    private ExternalConnection findConnection(UUID connectionId) {
        return connectionRepository.findById(connectionId)
                .orElseThrow(() -> new ResourceNotFoundException("Connection", connectionId));
    }

    /**
     * Reject a malformed JDBC connection string up front. Non-JDBC types and
     * empty strings are not checked.
     */
    private void checkConnectionString(ConnectionType type, String connectionString) {
        if (connectionString == null || connectionString.isEmpty() || !connectionStringBuilder.supports(type)) {
            return;
        }
        var error = connectionStringBuilder.validate(type, connectionString);
        if (error != null) {
            throw new IllegalArgumentException("Invalid connection string: " + error);
        }
    }

    private String encryptOrNull(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return null;
        }
        return credentialCipher.encrypt(plaintext);
    }
}
