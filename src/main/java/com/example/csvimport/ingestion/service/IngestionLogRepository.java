package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.IngestionLogEntry;
import com.example.csvimport.ingestion.model.IngestionSource;
import com.example.csvimport.ingestion.support.StoreUnavailableException;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

/**
 * Persisted {@code bucket/key -> etag} log of completed ingestions. Callers hold the per-key lock
 * around read-then-write sequences.
 */
@Slf4j
@Repository
public class IngestionLogRepository {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public IngestionLogRepository(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public Optional<IngestionLogEntry> find(String bucket, String key) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(IngestionLogEntry.toId(bucket, key), IngestionLogEntry.class));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Ingestion log unavailable: " + ex.getMessage(), ex);
        }
    }

    public IngestionLogEntry markDone(String bucket, String key, String etag, IngestionSource source,
            ImportReport report) {
        IngestionLogEntry entry = IngestionLogEntry.done(bucket, key, etag, source, report, clock.instant());
        try {
            IngestionLogEntry saved = mongoTemplate.save(entry);
            log.debug("Marked {}/{} done at etag={} source={}", bucket, key, etag, source);
            return saved;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Ingestion log unavailable: " + ex.getMessage(), ex);
        }
    }
}
