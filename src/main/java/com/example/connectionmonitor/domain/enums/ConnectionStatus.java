package com.example.connectionmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of the most recent probe against a connection.
 */
@Getter
@RequiredArgsConstructor
public enum ConnectionStatus {

    UNTESTED("untested", "Untested"),
    CONNECTED("connected", "Connected"),
    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    public static ConnectionStatus fromProbe(boolean success) {
        return success ? CONNECTED : FAILED;
    }
}
