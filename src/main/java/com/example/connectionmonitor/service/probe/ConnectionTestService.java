package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.config.MetricsConfig;
import com.example.connectionmonitor.domain.entity.ExternalConnection;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.service.crypto.CredentialCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point for testing one connection.
 * <p>
 * Decrypts credentials into a {@link ProbeTarget}, picks the timeout by
 * category and dispatches through the registry. Never throws: anything that
 * escapes a probe becomes an UNKNOWN outcome. Message and details are
 * sanitized and the duration is stamped on every path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionTestService {

    private final ConnectionProbeRegistry probeRegistry;
    private final CredentialCipher credentialCipher;
    private final ConnectionMonitorProperties properties;
    private final MetricsConfig metricsConfig;

    public ProbeOutcome test(ExternalConnection connection) {
        var type = connection.getType();
        var startNanos = System.nanoTime();

        ProbeOutcome outcome;
        try {
            var probe = probeRegistry.getProbe(type);
            if (probe.isEmpty()) {
                log.warn("No probe registered for connection {} of type {}", connection.getId(), type);
                outcome = ProbeOutcome.unsupported(type);
            } else {
                outcome = probe.get().test(toTarget(connection), timeoutFor(connection));
                if (outcome == null) {
                    outcome = ProbeOutcome.failure(ProbeErrorKind.UNKNOWN, type.name() + "_ERROR",
                            "Connection test failed: probe returned no result");
                }
            }
        } catch (Exception e) {
            log.error("Unexpected error testing connection {}: {}", connection.getId(),
                    ErrorSanitizer.sanitize(e.getMessage()), e);
            outcome = ProbeOutcome.failure(ProbeErrorKind.UNKNOWN, type.name() + "_ERROR",
                    "Connection test failed: " + e.getMessage(), e.getClass().getSimpleName());
        }

        outcome.setMessage(ErrorSanitizer.sanitize(outcome.getMessage()));
        outcome.setErrorDetails(ErrorSanitizer.sanitize(outcome.getErrorDetails()));
        outcome.withDuration(Duration.ofNanos(System.nanoTime() - startNanos).toMillis());

        if (outcome.isSuccess()) {
            log.info("Connection {} ({}) test succeeded in {}ms", connection.getId(), type, outcome.getDurationMs());
        } else {
            log.warn("Connection {} ({}) test failed in {}ms: [{}] {}", connection.getId(), type,
                    outcome.getDurationMs(), outcome.getErrorCode(), outcome.getMessage());
            metricsConfig.recordProbeFailure(type, outcome.getErrorKind());
        }
        metricsConfig.recordProbe(type, outcome.isSuccess(), outcome.getDurationMs());

        return outcome;
    }

    Duration timeoutFor(ExternalConnection connection) {
        if (connection.getType().isDatabase()) {
            return Duration.ofSeconds(properties.getDatabaseProbeTimeoutSeconds());
        }
        return Duration.ofSeconds(properties.getApiProbeTimeoutSeconds());
    }

    private ProbeTarget toTarget(ExternalConnection connection) {
        return ProbeTarget.builder()
                .connectionId(connection.getId())
                .name(connection.getName())
                .type(connection.getType())
                .server(connection.getServer())
                .port(connection.getPort())
                .databaseName(connection.getDatabaseName())
                .apiBaseUrl(connection.getApiBaseUrl())
                .additionalSettings(connection.getAdditionalSettings())
                .username(connection.getUsername())
                .password(credentialCipher.decryptOrPlaintext(connection.getPasswordEncrypted()))
                .connectionString(credentialCipher.decryptOrPlaintext(connection.getConnectionStringEncrypted()))
                .apiKey(credentialCipher.decryptOrPlaintext(connection.getApiKeyEncrypted()))
                .gitHubToken(credentialCipher.decryptOrPlaintext(connection.getGitHubTokenEncrypted()))
                .gitHubOrganization(connection.getGitHubOrganization())
                .gitHubRepository(connection.getGitHubRepository())
                .build();
    }
}
