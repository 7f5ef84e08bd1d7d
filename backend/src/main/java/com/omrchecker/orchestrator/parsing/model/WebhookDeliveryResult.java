package com.omrchecker.orchestrator.parsing.model;

public record WebhookDeliveryResult(
    String jobId,
    boolean delivered,
    int statusCode,
    String errorCode,
    String errorMessage
) {
    public static WebhookDeliveryResult delivered(String jobId, int statusCode) {
        return new WebhookDeliveryResult(jobId, true, statusCode, null, null);
    }

    public static WebhookDeliveryResult failed(String jobId, int statusCode, String errorCode, String errorMessage) {
        return new WebhookDeliveryResult(jobId, false, statusCode, errorCode, errorMessage);
    }
}
