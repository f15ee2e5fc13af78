package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.IngestionLogEntry;
import com.example.csvimport.ingestion.model.IngestionSource;
import com.example.csvimport.ingestion.model.StorageObjectRef;
import com.example.csvimport.ingestion.model.WebhookEvent;
import com.example.csvimport.ingestion.model.WebhookOutcome;
import com.example.csvimport.ingestion.model.WebhookResponse;
import com.example.csvimport.ingestion.support.ImportFailureException;
import com.example.csvimport.ingestion.support.KeyedLockRegistry;
import com.example.csvimport.ingestion.support.ObjectKeys;
import com.example.csvimport.ingestion.support.UnreadableContentException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Ingests objects announced by object-storage notifications.
 *
 * <p>Each {@code bucket/key} moves from unseen to processing to done(etag). The whole
 * check-fetch-import-mark sequence runs under the key's lock, so concurrent deliveries of one object
 * never import it twice. A delivery whose etag is already logged as done is ignored. Transient
 * failures leave the log untouched, so the sender's redelivery retries.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIngestionHandler {

    private static final String MDC_BUCKET = "storage.bucket";
    private static final String MDC_KEY = "storage.key";

    private final NotificationDecoder decoder;
    private final StorageMirror storageMirror;
    private final IngestionLogRepository ingestionLog;
    private final CustomerImportService importService;
    private final KeyedLockRegistry locks;

    public WebhookResponse handleNotification(byte[] payload) {
        NotificationDecoder.Decoded decoded = decoder.decode(payload);
        List<WebhookOutcome> outcomes = new ArrayList<>(decoded.events().size());
        for (WebhookEvent event : decoded.events()) {
            outcomes.add(handle(event));
        }
        WebhookResponse response = WebhookResponse.from(decoded.ignoredRecords(), outcomes);
        log.info("Handled notification events={} ignoredRecords={} inserted={} errors={} retryable={}",
                outcomes.size(), decoded.ignoredRecords(), response.inserted(), response.errors(),
                response.retryable());
        return response;
    }

    public WebhookOutcome handle(WebhookEvent event) {
        if (!event.isObjectCreated()) {
            log.debug("Ignoring event type {} for {}/{}", event.eventType(), event.bucket(), event.key());
            return WebhookOutcome.ignored(event, "event type not actionable: " + event.eventType());
        }
        if (!event.isCsvObject()) {
            return WebhookOutcome.ignored(event, "not a .csv");
        }

        MDC.put(MDC_BUCKET, event.bucket());
        MDC.put(MDC_KEY, event.key());
        try {
            return locks.withLock(ObjectKeys.lockKey(event.bucket(), event.key()), () -> process(event));
        } finally {
            MDC.remove(MDC_BUCKET);
            MDC.remove(MDC_KEY);
        }
    }

    private WebhookOutcome process(WebhookEvent event) {
        try {
            String etag = event.etag();
            if (etag == null) {
                Optional<StorageObjectRef> stat = storageMirror.stat(event.bucket(), event.key());
                if (stat.isEmpty()) {
                    log.info("Object {}/{} no longer exists", event.bucket(), event.key());
                    return WebhookOutcome.ignored(event, "object no longer exists");
                }
                etag = stat.get().etag();
            }

            Optional<IngestionLogEntry> previous = ingestionLog.find(event.bucket(), event.key());
            if (previous.isPresent() && previous.get().isDone(etag)) {
                log.info("Duplicate notification for {}/{} etag={} (already ingested at {})",
                        event.bucket(), event.key(), etag, previous.get().getProcessedAt());
                return WebhookOutcome.ignored(event, "already ingested");
            }

            byte[] content = storageMirror.fetch(event.bucket(), event.key());
            ImportReport report = importService.importCsv(content, ObjectKeys.lockKey(event.bucket(), event.key()));
            ingestionLog.markDone(event.bucket(), event.key(), etag, IngestionSource.WEBHOOK, report);
            log.info("Imported {} rows, errors {} from {}/{}", report.inserted(), report.errors(),
                    event.bucket(), event.key());
            return WebhookOutcome.imported(event, report);
        } catch (UnreadableContentException ex) {
            log.warn("Rejected {}/{}: {}", event.bucket(), event.key(), ex.getMessage());
            return WebhookOutcome.rejected(event, ex.getMessage());
        } catch (ImportFailureException ex) {
            log.warn("Ingestion of {}/{} failed, left retryable: {}", event.bucket(), event.key(), ex.getMessage());
            return WebhookOutcome.failed(event, ex.getMessage());
        }
    }
}
