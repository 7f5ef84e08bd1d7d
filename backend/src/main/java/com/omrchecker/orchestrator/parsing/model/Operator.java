package com.omrchecker.orchestrator.parsing.model;

import java.time.Instant;

public record Operator(String id, String token, String callbackUrl, Instant createdAt) {

    public Operator withCallbackUrl(String newCallbackUrl) {
        return new Operator(id, token, newCallbackUrl, createdAt);
    }
}
