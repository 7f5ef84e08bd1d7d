package com.omrchecker.orchestrator.parsing.api;

public record CallbackRetryResponse(int delivered, int maxAttempts) {}
