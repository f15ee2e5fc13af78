package com.example.csvimport.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookOutcome(
        Status status,
        String bucket,
        String key,
        String reason,
        ImportReport report) {

    public enum Status {
        IMPORTED,
        IGNORED,
        REJECTED,
        FAILED
    }

    public static WebhookOutcome imported(WebhookEvent event, ImportReport report) {
        return new WebhookOutcome(Status.IMPORTED, event.bucket(), event.key(), null, report);
    }

    public static WebhookOutcome ignored(WebhookEvent event, String reason) {
        return new WebhookOutcome(Status.IGNORED, event.bucket(), event.key(), reason, null);
    }

    public static WebhookOutcome rejected(WebhookEvent event, String reason) {
        return new WebhookOutcome(Status.REJECTED, event.bucket(), event.key(), reason, null);
    }

    public static WebhookOutcome failed(WebhookEvent event, String reason) {
        return new WebhookOutcome(Status.FAILED, event.bucket(), event.key(), reason, null);
    }
}
