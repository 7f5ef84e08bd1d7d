package com.omrchecker.orchestrator.parsing.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.omrchecker.orchestrator.parsing.model.CallbackStatus;
import com.omrchecker.orchestrator.parsing.model.JobStatistics;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.SheetResultView;

import java.time.Instant;
import java.util.List;

public record JobDetailResponse(
    String jobId,
    JobStatus status,
    int totalSheets,
    int processedSheets,
    int successfulSheets,
    int failedSheets,
    int pendingSheets,
    CallbackStatus callbackStatus,
    Instant createdAt,
    Instant completedAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) List<SheetResultView> sheets
) {
    public static JobDetailResponse from(JobStatistics stats, List<SheetResultView> sheets) {
        return new JobDetailResponse(
            stats.jobId(),
            stats.status(),
            stats.totalSheets(),
            stats.processedSheets(),
            stats.successfulSheets(),
            stats.failedSheets(),
            stats.pendingSheets(),
            stats.callbackStatus(),
            stats.createdAt(),
            stats.completedAt(),
            sheets
        );
    }
}
