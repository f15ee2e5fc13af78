package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ObjectStorageNotification;
import com.example.csvimport.ingestion.model.ObjectStorageNotification.EventRecord;
import com.example.csvimport.ingestion.model.WebhookEvent;
import com.example.csvimport.ingestion.support.ObjectKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes S3/MinIO event-notification bodies. Anything that does not fit the schema decodes to no
 * events instead of being scraped field by field.
 */
@Slf4j
@Component
public class NotificationDecoder {

    private final ObjectMapper objectMapper;

    public NotificationDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Decoded decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            log.debug("Empty notification payload");
            return Decoded.EMPTY;
        }

        ObjectStorageNotification notification;
        try {
            notification = objectMapper.readValue(payload, ObjectStorageNotification.class);
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unparseable notification payload: {}", ex.getOriginalMessage());
            return Decoded.EMPTY;
        } catch (IOException ex) {
            log.warn("Ignoring unreadable notification payload: {}", ex.getMessage());
            return Decoded.EMPTY;
        }

        if (notification == null || notification.records() == null) {
            log.debug("Notification carries no Records");
            return Decoded.EMPTY;
        }

        List<WebhookEvent> events = new ArrayList<>();
        int ignored = 0;
        for (EventRecord eventRecord : notification.records()) {
            WebhookEvent event = toEvent(eventRecord);
            if (event == null) {
                ignored++;
            } else {
                events.add(event);
            }
        }
        if (ignored > 0) {
            log.warn("Ignored {} notification record(s) missing eventName, bucket or key", ignored);
        }
        return new Decoded(List.copyOf(events), ignored);
    }

    private static WebhookEvent toEvent(EventRecord eventRecord) {
        if (eventRecord == null || isBlank(eventRecord.eventName()) || eventRecord.s3() == null
                || eventRecord.s3().bucket() == null || eventRecord.s3().object() == null) {
            return null;
        }
        String bucket = eventRecord.s3().bucket().name();
        String rawKey = eventRecord.s3().object().key();
        if (isBlank(bucket) || isBlank(rawKey)) {
            return null;
        }
        String key;
        try {
            key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring record with undecodable object key '{}'", rawKey);
            return null;
        }
        return new WebhookEvent(eventRecord.eventName(), bucket, key, ObjectKeys.normalizeEtag(eventRecord.s3().object().etag()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Decoded(List<WebhookEvent> events, int ignoredRecords) {
        static final Decoded EMPTY = new Decoded(List.of(), 0);
    }
}
