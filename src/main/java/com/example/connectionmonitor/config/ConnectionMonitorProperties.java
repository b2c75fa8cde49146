package com.example.connectionmonitor.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the connection monitor.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "connection-monitor")
public class ConnectionMonitorProperties {

    /**
     * Polling interval in milliseconds for checking due schedules
     */
    @Min(1000)
    private long pollIntervalMs = 60000;

    /**
     * Delay before the first polling cycle after startup
     */
    @Min(0)
    private long initialDelayMs = 10000;

    /**
     * Timeout for a single database probe
     */
    @Min(1)
    private int databaseProbeTimeoutSeconds = 10;

    /**
     * Timeout for a single HTTP API probe
     */
    @Min(1)
    private int apiProbeTimeoutSeconds = 30;

    /**
     * Secret used to derive the credential encryption key.
     * Padded or truncated to 32 characters.
     */
    @NotBlank
    private String encryptionSecret;

    /**
     * Number of connections probed concurrently within one schedule run.
     * 1 means strictly sequential.
     */
    @Min(1)
    private int probeParallelism = 1;

    @Min(1)
    private int runLogRetentionDays = 30;

    /**
     * How often run logs past retention are purged
     */
    @Min(1000)
    private long runLogCleanupIntervalMs = 3600000;

    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    @NotBlank
    private String githubApiBaseUrl = "https://api.github.com";

    @NotBlank
    private String userAgent = "connection-monitor";
}
