package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.parsing.model.CallbackStatus;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;

import java.time.Instant;

public record JobSummaryView(
    String jobId,
    JobStatus status,
    int totalSheets,
    int processedSheets,
    CallbackStatus callbackStatus,
    Instant createdAt,
    Instant completedAt
) {
    public static JobSummaryView from(ParsingJob job) {
        return new JobSummaryView(
            job.id(),
            job.status(),
            job.totalSheets(),
            job.processedSheets(),
            job.callbackStatus(),
            job.createdAt(),
            job.completedAt()
        );
    }
}
