package com.omrchecker.orchestrator.parsing.model;

import java.time.Instant;

public record OmrSheet(
    String id,
    String jobId,
    String itemId,
    int position,
    String imageLocator,
    SheetStatus status,
    SheetOutcome outcome,
    Instant createdAt,
    Instant resolvedAt
) {
    public static OmrSheet pending(String id, String jobId, String itemId, int position, String imageLocator, Instant createdAt) {
        return new OmrSheet(id, jobId, itemId, position, imageLocator, SheetStatus.PENDING, null, createdAt, null);
    }

    public SheetOutcome.Success success() {
        return outcome instanceof SheetOutcome.Success success ? success : null;
    }

    public String errorMessage() {
        return outcome instanceof SheetOutcome.Failure failure ? failure.reason() : null;
    }
}
