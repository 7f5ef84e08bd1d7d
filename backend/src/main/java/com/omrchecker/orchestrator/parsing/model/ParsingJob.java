package com.omrchecker.orchestrator.parsing.model;

import java.time.Instant;

public record ParsingJob(
    String id,
    String operatorId,
    JobStatus status,
    int totalSheets,
    int processedSheets,
    CallbackStatus callbackStatus,
    ScanConfig scanConfig,
    Instant createdAt,
    Instant completedAt
) {
    public static ParsingJob pending(String id, String operatorId, int totalSheets, ScanConfig scanConfig, Instant createdAt) {
        return new ParsingJob(
            id,
            operatorId,
            JobStatus.PENDING,
            totalSheets,
            0,
            CallbackStatus.NOT_SENT,
            scanConfig,
            createdAt,
            null
        );
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
