package com.example.csvimport.ingestion.model;

import java.util.Locale;

/**
 * One object notification decoded from an object-storage webhook. {@code etag} may be null when the
 * sender omits it.
 */
public record WebhookEvent(String eventType, String bucket, String key, String etag) {

    private static final String MINIO_CREATED_PREFIX = "s3:ObjectCreated:";
    private static final String AWS_CREATED_PREFIX = "ObjectCreated:";

    public boolean isObjectCreated() {
        return eventType != null
                && (eventType.startsWith(MINIO_CREATED_PREFIX) || eventType.startsWith(AWS_CREATED_PREFIX));
    }

    public boolean isCsvObject() {
        return key != null && key.toLowerCase(Locale.ROOT).endsWith(".csv");
    }
}
