package com.example.csvimport.ingestion.model;

import java.util.List;

public record WebhookResponse(
        int ignoredRecords,
        long inserted,
        long errors,
        List<WebhookOutcome> items) {

    public static WebhookResponse from(int ignoredRecords, List<WebhookOutcome> items) {
        long inserted = 0;
        long errors = 0;
        for (WebhookOutcome item : items) {
            if (item.report() != null) {
                inserted += item.report().inserted();
                errors += item.report().errors();
            }
        }
        return new WebhookResponse(ignoredRecords, inserted, errors, List.copyOf(items));
    }

    public boolean retryable() {
        return items.stream().anyMatch(item -> item.status() == WebhookOutcome.Status.FAILED);
    }
}
