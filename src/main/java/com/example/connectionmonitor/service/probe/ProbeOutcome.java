package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized result of one connectivity probe.
 * <p>
 * Probes never throw: every native failure ends up here with an
 * {@link ProbeErrorKind} and a technology-prefixed error code.
 */
@Data
@Builder
public class ProbeOutcome {

    /**
     * Whether the round-trip completed
     */
    private boolean success;

    /**
     * User-safe summary, e.g. "PostgreSQL connection successful" or
     * "Database connection failed: Login failed. Please check your username and password."
     */
    private String message;

    /**
     * Wall-clock time from just before dispatch to completion
     */
    private long durationMs;

    /**
     * Normalized failure classification, null on success
     */
    private ProbeErrorKind errorKind;

    /**
     * Technology-prefixed diagnostic code (PG_28P01, MYSQL_1045, HTTP_404, ...)
     */
    private String errorCode;

    /**
     * Sanitized native error text for diagnostics
     */
    private String errorDetails;

    /**
     * Technology-specific facts gathered on the way (server version, rate limits, ...)
     */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static ProbeOutcome success(String message) {
        return ProbeOutcome.builder().success(true).message(message).build();
    }

    public static ProbeOutcome success(String message, Map<String, Object> metadata) {
        return ProbeOutcome.builder()
                .success(true)
                .message(message)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }

    public static ProbeOutcome failure(ProbeErrorKind kind, String errorCode, String message) {
        return ProbeOutcome.builder()
                .success(false)
                .errorKind(kind)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    public static ProbeOutcome failure(ProbeErrorKind kind, String errorCode, String message, String errorDetails) {
        return ProbeOutcome.builder()
                .success(false)
                .errorKind(kind)
                .errorCode(errorCode)
                .message(message)
                .errorDetails(errorDetails)
                .build();
    }

    /**
     * Deterministic outcome for a type no probe is registered for
     */
    public static ProbeOutcome unsupported(ConnectionType type) {
        return failure(ProbeErrorKind.INVALID_CONFIG, "UNSUPPORTED_TYPE",
                "Connection type " + type.getDisplayName() + " is not supported for connection testing");
    }

    /**
     * Missing or malformed connection fields
     */
    public static ProbeOutcome invalidConfig(String detail) {
        return failure(ProbeErrorKind.INVALID_CONFIG, "INVALID_CONFIG",
                "Invalid connection configuration: " + detail);
    }

    public ProbeOutcome withMetadata(String key, Object value) {
        if (this.metadata == null) {
            this.metadata = new LinkedHashMap<>();
        }
        this.metadata.put(key, value);
        return this;
    }

    public ProbeOutcome withDuration(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }
}
