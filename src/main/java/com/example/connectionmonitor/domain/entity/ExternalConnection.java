package com.example.connectionmonitor.domain.entity;

import com.example.connectionmonitor.domain.enums.ConnectionStatus;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A typed definition of an external resource (database, REST API, GitHub).
 * <p>
 * Columns suffixed {@code _encrypted} only ever hold CredentialCipher output.
 * The scheduler mutates nothing here except the last-test fields.
 */
@Entity
@Table(name = "external_connections", indexes = {
        @Index(name = "idx_connection_application", columnList = "application_id, active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class ExternalConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    @ToString.Include
    private UUID id;

    /**
     * Owning application, null when unassigned
     */
    @Column(name = "application_id")
    @ToString.Include
    private UUID applicationId;

    @Column(name = "name", nullable = false, length = 200)
    @ToString.Include
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "connection_type", nullable = false, length = 30)
    @ToString.Include
    private ConnectionType type;

    // === Location ===

    @Column(name = "server", length = 255)
    private String server;

    @Column(name = "port")
    private Integer port;

    @Column(name = "database_name", length = 255)
    private String databaseName;

    @Column(name = "api_base_url", length = 500)
    private String apiBaseUrl;

    /**
     * Extra driver settings as key=value pairs separated by ';' or '&'
     */
    @Column(name = "additional_settings", columnDefinition = "TEXT")
    private String additionalSettings;

    // === Credentials ===

    @Column(name = "username", length = 255)
    private String username;

    @Column(name = "password_encrypted", columnDefinition = "TEXT")
    private String passwordEncrypted;

    @Column(name = "connection_string_encrypted", columnDefinition = "TEXT")
    private String connectionStringEncrypted;

    @Column(name = "api_key_encrypted", columnDefinition = "TEXT")
    private String apiKeyEncrypted;

    @Column(name = "github_token_encrypted", columnDefinition = "TEXT")
    private String gitHubTokenEncrypted;

    @Column(name = "github_organization", length = 255)
    private String gitHubOrganization;

    @Column(name = "github_repository", length = 255)
    private String gitHubRepository;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    // === Last Test Result ===

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private ConnectionStatus status = ConnectionStatus.UNTESTED;

    @Column(name = "last_tested_at")
    private Instant lastTestedAt;

    @Column(name = "last_test_message", columnDefinition = "TEXT")
    private String lastTestMessage;

    @Column(name = "last_test_error_code", length = 100)
    private String lastTestErrorCode;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.active == null) {
            this.active = true;
        }
        if (this.status == null) {
            this.status = ConnectionStatus.UNTESTED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isActiveConnection() {
        return Boolean.TRUE.equals(active);
    }
}
