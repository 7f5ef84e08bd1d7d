package com.omrchecker.orchestrator.parsing.model;

import java.util.Locale;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job status is missing");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (JobStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
