package com.example.connectionmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of one schedule run, summarized across all probed connections.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Every active connection was reachable.
     */
    SUCCESS("success", "Success"),

    /**
     * Some connections succeeded and some failed.
     */
    PARTIAL("partial", "Partial"),

    /**
     * Every probed connection failed.
     */
    FAILED("failed", "Failed"),

    /**
     * The application had no active connections; nothing was probed.
     */
    SKIPPED("skipped", "Skipped"),

    /**
     * The run itself could not complete (e.g. connections could not be loaded).
     */
    ERROR("error", "Error");

    private final String code;
    private final String displayName;

    /**
     * Find RunStatus by its code value
     */
    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    /**
     * Aggregate probe counts into a status. Depends only on the counts,
     * never on the order in which outcomes arrived.
     */
    public static RunStatus fromCounts(int successCount, int failureCount) {
        if (successCount == 0 && failureCount == 0) {
            return SKIPPED;
        }
        if (failureCount == 0) {
            return SUCCESS;
        }
        if (successCount == 0) {
            return FAILED;
        }
        return PARTIAL;
    }

    /**
     * Whether this status should page someone
     */
    public boolean isAlertable() {
        return this == FAILED || this == ERROR;
    }
}
