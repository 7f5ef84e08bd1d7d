package com.omrchecker.orchestrator.parsing.model;

public enum CallbackStatus {
    NOT_SENT,
    SENT,
    FAILED;

    public static CallbackStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Callback status is missing");
        }
        for (CallbackStatus status : values()) {
            if (status.name().equals(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown callback status: " + value);
    }
}
