package com.example.connectionmonitor.service.runner;

import com.example.connectionmonitor.domain.enums.RunStatus;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregated result of one schedule run.
 */
@Data
@Builder
public class RunSummary {

    private RunStatus status;

    /**
     * Human-readable summary, e.g. "Tested 3 connections: 2 successful, 1 failed"
     */
    private String message;

    private long durationMs;

    private int totalConnections;

    private int successCount;

    private int failureCount;

    public static RunSummary skipped(long durationMs) {
        return RunSummary.builder()
                .status(RunStatus.SKIPPED)
                .message("No active database connections found")
                .durationMs(durationMs)
                .build();
    }

    public static RunSummary error(String errorMessage, long durationMs) {
        return RunSummary.builder()
                .status(RunStatus.ERROR)
                .message("Test execution failed: " + errorMessage)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Build a summary from probe counts; the status depends only on the counts.
     */
    public static RunSummary fromCounts(int successCount, int failureCount, long durationMs) {
        var total = successCount + failureCount;
        return RunSummary.builder()
                .status(RunStatus.fromCounts(successCount, failureCount))
                .message(String.format("Tested %d connections: %d successful, %d failed", total, successCount, failureCount))
                .durationMs(durationMs)
                .totalConnections(total)
                .successCount(successCount)
                .failureCount(failureCount)
                .build();
    }
}
