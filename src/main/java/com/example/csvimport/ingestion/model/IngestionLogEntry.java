package com.example.csvimport.ingestion.model;

import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Last successfully ingested version of a storage object. One entry per {@code bucket/key}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "ingestion_log")
public class IngestionLogEntry {

    private static final String DELIMITER = "/";

    @Id
    private String id;
    private String bucket;
    private String key;
    private String etag;
    private Instant processedAt;
    private IngestionSource source;
    private long inserted;
    private long duplicateEmail;
    private long invalid;

    public static String toId(String bucket, String key) {
        return bucket + DELIMITER + key;
    }

    public static IngestionLogEntry done(String bucket, String key, String etag, IngestionSource source,
            ImportReport report, Instant processedAt) {
        IngestionLogEntry entry = new IngestionLogEntry();
        entry.setId(toId(bucket, key));
        entry.setBucket(bucket);
        entry.setKey(key);
        entry.setEtag(etag);
        entry.setSource(source);
        entry.setProcessedAt(processedAt);
        entry.setInserted(report.inserted());
        entry.setDuplicateEmail(report.duplicateEmail());
        entry.setInvalid(report.invalid());
        return entry;
    }

    public boolean isDone(String candidateEtag) {
        return etag != null && etag.equals(candidateEtag);
    }
}
