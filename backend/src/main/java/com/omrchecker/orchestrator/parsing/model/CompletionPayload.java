package com.omrchecker.orchestrator.parsing.model;

import java.time.Instant;
import java.util.List;

public record CompletionPayload(
    String jobId,
    JobStatus status,
    int totalSheets,
    int processedSheets,
    int successfulSheets,
    int failedSheets,
    Instant createdAt,
    Instant completedAt,
    List<SheetResultView> sheets
) {}
