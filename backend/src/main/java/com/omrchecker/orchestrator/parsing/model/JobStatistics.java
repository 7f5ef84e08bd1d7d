package com.omrchecker.orchestrator.parsing.model;

import java.time.Instant;

public record JobStatistics(
    String jobId,
    JobStatus status,
    int totalSheets,
    int processedSheets,
    int successfulSheets,
    int failedSheets,
    int pendingSheets,
    CallbackStatus callbackStatus,
    Instant createdAt,
    Instant completedAt
) {}
