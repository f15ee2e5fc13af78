package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.IngestionLogEntry;
import com.example.csvimport.ingestion.model.IngestionSource;
import com.example.csvimport.ingestion.model.StorageObjectRef;
import com.example.csvimport.ingestion.model.WebhookEvent;
import com.example.csvimport.ingestion.model.WebhookOutcome;
import com.example.csvimport.ingestion.model.WebhookResponse;
import com.example.csvimport.ingestion.support.EncodingException;
import com.example.csvimport.ingestion.support.KeyedLockRegistry;
import com.example.csvimport.ingestion.support.StorageUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * {@link WebhookIngestionHandler} unit tests.
 *
 * <p>The ingestion log is an in-memory map behind a mocked repository so replay and concurrency
 * behaviour can be observed end to end.</p>
 */
@DisplayName("webhook ingestion handler")
class WebhookIngestionHandlerTest {

    private static final String BUCKET = "uploads";
    private static final String KEY = "drop/people.csv";
    private static final byte[] CONTENT = "name,email,age\nAlice,alice@example.com,30\n".getBytes(StandardCharsets.UTF_8);
    private static final WebhookEvent PUT = new WebhookEvent("s3:ObjectCreated:Put", BUCKET, KEY, "etag-1");

    private final Map<String, IngestionLogEntry> logEntries = new ConcurrentHashMap<>();
    private final AtomicInteger imports = new AtomicInteger();

    private StorageMirror storageMirror;
    private IngestionLogRepository ingestionLog;
    private CustomerImportService importService;
    private KeyedLockRegistry locks;
    private WebhookIngestionHandler handler;

    @BeforeEach
    void setUp() {
        storageMirror = mock(StorageMirror.class);
        ingestionLog = mock(IngestionLogRepository.class);
        importService = mock(CustomerImportService.class);
        locks = new KeyedLockRegistry();
        handler = new WebhookIngestionHandler(new NotificationDecoder(new ObjectMapper()), storageMirror,
                ingestionLog, importService, locks);

        when(ingestionLog.find(anyString(), anyString())).thenAnswer(invocation ->
                Optional.ofNullable(logEntries.get(IngestionLogEntry.toId(invocation.getArgument(0),
                        invocation.getArgument(1)))));
        when(ingestionLog.markDone(anyString(), anyString(), anyString(), any(), any())).thenAnswer(invocation -> {
            IngestionLogEntry entry = IngestionLogEntry.done(invocation.getArgument(0), invocation.getArgument(1),
                    invocation.getArgument(2), invocation.getArgument(3), invocation.getArgument(4), Instant.now());
            logEntries.put(entry.getId(), entry);
            return entry;
        });
        when(storageMirror.fetch(BUCKET, KEY)).thenReturn(CONTENT);
        when(importService.importCsv(any(), anyString())).thenAnswer(invocation -> {
            imports.incrementAndGet();
            return report(1);
        });
    }

    @Test
    @DisplayName("ignores non-create events without side effects")
    void handle_removedEvent_isIgnored() {
        WebhookOutcome outcome = handler.handle(new WebhookEvent("s3:ObjectRemoved:Delete", BUCKET, KEY, "etag-1"));

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        verifyNoInteractions(storageMirror, ingestionLog, importService);
    }

    @Test
    @DisplayName("ignores objects that are not .csv files")
    void handle_nonCsvObject_isIgnored() {
        WebhookOutcome outcome = handler.handle(new WebhookEvent("s3:ObjectCreated:Put", BUCKET, "photo.png", "e"));

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        assertThat(outcome.reason()).isEqualTo("not a .csv");
        verifyNoInteractions(storageMirror, importService);
    }

    @Test
    @DisplayName("imports a new object and records it as done at its etag")
    void handle_newObject_importsAndMarksDone() {
        WebhookOutcome outcome = handler.handle(PUT);

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IMPORTED);
        assertThat(outcome.report().inserted()).isEqualTo(1);
        verify(importService).importCsv(CONTENT, BUCKET + "/" + KEY);
        verify(ingestionLog).markDone(eq(BUCKET), eq(KEY), eq("etag-1"), eq(IngestionSource.WEBHOOK), any());
    }

    @Test
    @DisplayName("a replayed event with the same etag runs the import only once")
    void handle_replayedEvent_isIgnoredSecondTime() {
        WebhookOutcome first = handler.handle(PUT);
        WebhookOutcome second = handler.handle(PUT);

        assertThat(first.status()).isEqualTo(WebhookOutcome.Status.IMPORTED);
        assertThat(second.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        assertThat(second.reason()).isEqualTo("already ingested");
        assertThat(imports).hasValue(1);
        verify(storageMirror, times(1)).fetch(BUCKET, KEY);
    }

    @Test
    @DisplayName("a new etag for the same key is ingested again")
    void handle_newEtagSameKey_importsAgain() {
        handler.handle(PUT);
        WebhookOutcome outcome = handler.handle(new WebhookEvent("s3:ObjectCreated:Put", BUCKET, KEY, "etag-2"));

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IMPORTED);
        assertThat(imports).hasValue(2);
        assertThat(logEntries.get(BUCKET + "/" + KEY).getEtag()).isEqualTo("etag-2");
    }

    @Test
    @DisplayName("resolves a missing etag through stat before checking the log")
    void handle_missingEtag_usesStat() {
        when(storageMirror.stat(BUCKET, KEY)).thenReturn(Optional.of(new StorageObjectRef(BUCKET, KEY, 40, "etag-9")));

        WebhookOutcome outcome = handler.handle(new WebhookEvent("s3:ObjectCreated:Put", BUCKET, KEY, null));

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IMPORTED);
        assertThat(logEntries.get(BUCKET + "/" + KEY).getEtag()).isEqualTo("etag-9");
    }

    @Test
    @DisplayName("ignores an etag-less event for an object that no longer exists")
    void handle_missingEtagAndObjectGone_isIgnored() {
        when(storageMirror.stat(BUCKET, KEY)).thenReturn(Optional.empty());

        WebhookOutcome outcome = handler.handle(new WebhookEvent("s3:ObjectCreated:Put", BUCKET, KEY, null));

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.IGNORED);
        verify(storageMirror, never()).fetch(anyString(), anyString());
    }

    @Test
    @DisplayName("a storage outage fails retryably and a redelivery after recovery imports")
    void handle_storageOutage_leavesKeyRetryable() {
        doThrow(new StorageUnavailableException("connection refused", null))
                .doReturn(CONTENT)
                .when(storageMirror).fetch(BUCKET, KEY);

        WebhookOutcome failed = handler.handle(PUT);
        WebhookOutcome retried = handler.handle(PUT);

        assertThat(failed.status()).isEqualTo(WebhookOutcome.Status.FAILED);
        assertThat(retried.status()).isEqualTo(WebhookOutcome.Status.IMPORTED);
        assertThat(imports).hasValue(1);
    }

    @Test
    @DisplayName("rejects objects that are not UTF-8 without marking them done")
    void handle_encodingError_isRejected() {
        doThrow(new EncodingException("not utf-8", null)).when(importService).importCsv(any(), anyString());

        WebhookOutcome outcome = handler.handle(PUT);

        assertThat(outcome.status()).isEqualTo(WebhookOutcome.Status.REJECTED);
        assertThat(logEntries).isEmpty();
    }

    @Test
    @DisplayName("concurrent deliveries of one object import it exactly once")
    void handle_concurrentDeliveries_areSerialized() throws Exception {
        // given
        int deliveries = 8;
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        doAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            imports.incrementAndGet();
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return report(1);
        }).when(importService).importCsv(any(), anyString());
        ExecutorService pool = Executors.newFixedThreadPool(deliveries);
        CountDownLatch start = new CountDownLatch(1);

        // when
        List<Future<WebhookOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < deliveries; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return handler.handle(PUT);
            }));
        }
        start.countDown();
        List<WebhookOutcome> outcomes = new ArrayList<>();
        for (Future<WebhookOutcome> future : futures) {
            outcomes.add(future.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        // then
        assertThat(imports).hasValue(1);
        assertThat(maxInFlight).hasValue(1);
        assertThat(outcomes).filteredOn(o -> o.status() == WebhookOutcome.Status.IMPORTED).hasSize(1);
        assertThat(outcomes).filteredOn(o -> o.status() == WebhookOutcome.Status.IGNORED).hasSize(deliveries - 1);
    }

    @Test
    @DisplayName("a notification body is decoded and each record handled; failures make it retryable")
    void handleNotification_mixedRecords_aggregates() {
        doThrow(new StorageUnavailableException("down", null)).when(storageMirror).fetch(BUCKET, "broken.csv");
        String payload = """
                {"Records":[
                  {"eventName":"s3:ObjectCreated:Put","s3":{"bucket":{"name":"uploads"},"object":{"key":"drop/people.csv","eTag":"etag-1"}}},
                  {"eventName":"s3:ObjectRemoved:Delete","s3":{"bucket":{"name":"uploads"},"object":{"key":"old.csv"}}},
                  {"eventName":"s3:ObjectCreated:Put","s3":{"bucket":{"name":"uploads"},"object":{"key":"broken.csv","eTag":"x"}}},
                  {"eventName":"s3:ObjectCreated:Put"}
                ]}
                """;

        WebhookResponse response = handler.handleNotification(payload.getBytes(StandardCharsets.UTF_8));

        assertThat(response.ignoredRecords()).isEqualTo(1);
        assertThat(response.items()).extracting(WebhookOutcome::status).containsExactly(
                WebhookOutcome.Status.IMPORTED,
                WebhookOutcome.Status.IGNORED,
                WebhookOutcome.Status.FAILED);
        assertThat(response.inserted()).isEqualTo(1);
        assertThat(response.retryable()).isTrue();
    }

    @Test
    @DisplayName("an unparseable body yields an empty, non-retryable response")
    void handleNotification_garbage_isEmpty() {
        WebhookResponse response = handler.handleNotification("<xml/>".getBytes(StandardCharsets.UTF_8));

        assertThat(response.items()).isEmpty();
        assertThat(response.retryable()).isFalse();
        verifyNoInteractions(importService);
    }

    private static ImportReport report(long inserted) {
        return new ImportReport(BUCKET + "/" + KEY, inserted, inserted, 0, 0, List.of(), false, 1);
    }
}
