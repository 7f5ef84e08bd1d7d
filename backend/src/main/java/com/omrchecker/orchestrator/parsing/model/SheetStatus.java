package com.omrchecker.orchestrator.parsing.model;

public enum SheetStatus {
    PENDING,
    PARSED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static SheetStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sheet status is missing");
        }
        for (SheetStatus status : values()) {
            if (status.name().equals(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sheet status: " + value);
    }
}
