package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.CustomerDocument;
import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.IngestionSource;
import com.example.csvimport.ingestion.model.StorageObjectRef;
import com.example.csvimport.ingestion.model.UploadResponse;
import com.example.csvimport.ingestion.support.FileProcessingException;
import com.example.csvimport.ingestion.support.ImportFailureException;
import com.example.csvimport.ingestion.support.KeyedLockRegistry;
import com.example.csvimport.ingestion.support.ObjectKeys;
import com.example.csvimport.ingestion.support.StoreUnavailableException;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Entry point for UI uploads and exports. Webhook ingestion goes through
 * {@link #importCsv(byte[], String)} as well, so both paths share validation and persistence.
 */
@Slf4j
@Service
public class CustomerImportService {

    static final String[] EXPORT_HEADERS = { "name", "email", "age" };
    static final byte[] SAMPLE_CSV = ("name,email,age\n"
            + "Alice,alice@example.com,30\n"
            + "Bob,bob@example.org,25\n").getBytes(StandardCharsets.UTF_8);
    static final int MAX_LISTING_LIMIT = 500;

    private static final String CSV_EXTENSION = ".csv";
    private static final String UNKNOWN_FILENAME = "unknown";

    private final CustomerCsvImporter importer;
    private final CustomerRepository customerRepository;
    private final IngestionLogRepository ingestionLog;
    private final StorageMirror storageMirror;
    private final KeyedLockRegistry locks;
    private final Clock clock;
    private final Duration importTimeout;
    private final int exportBatchSize;

    public CustomerImportService(CustomerCsvImporter importer,
            CustomerRepository customerRepository,
            IngestionLogRepository ingestionLog,
            StorageMirror storageMirror,
            KeyedLockRegistry locks,
            Clock clock,
            @Value("${app.ingestion.timeout:60s}") Duration importTimeout,
            @Value("${app.ingestion.export-batch-size:1000}") int exportBatchSize) {
        this.importer = importer;
        this.customerRepository = customerRepository;
        this.ingestionLog = ingestionLog;
        this.storageMirror = storageMirror;
        this.locks = locks;
        this.clock = clock;
        this.importTimeout = importTimeout;
        this.exportBatchSize = Math.max(1, exportBatchSize);
    }

    /**
     * Imports the rows of an uploaded file, then mirrors the original bytes to object storage. A
     * storage failure does not undo or block the import; it is reported in {@code storageError}.
     */
    public UploadResponse upload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new FileProcessingException("No file part");
        }
        String filename = resolveFilename(file.getOriginalFilename());
        if (!filename.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION)) {
            throw new FileProcessingException("Please upload a .csv file");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to read uploaded file %s".formatted(filename), ex);
        }

        ImportReport report = importCsv(content, filename);
        return mirror(filename, content, report);
    }

    public ImportReport importCsv(byte[] content, String source) {
        return importer.importCsv(new ByteArrayInputStream(content), source, clock.instant().plus(importTimeout));
    }

    public void exportCustomers(OutputStream outputStream) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");

        try (OutputStreamWriter writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8)) {
            CsvWriter csvWriter = new CsvWriter(writer, settings);
            csvWriter.writeHeaders(EXPORT_HEADERS);
            customerRepository.forEachInInsertionOrder(exportBatchSize, doc -> csvWriter.writeRow(toExportRow(doc)));
            csvWriter.flush();
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to export customers", ex);
        }
    }

    public List<CustomerDocument> latestCustomers(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LISTING_LIMIT));
        return customerRepository.findLatest(bounded);
    }

    public byte[] sampleCsv() {
        return SAMPLE_CSV.clone();
    }

    private UploadResponse mirror(String filename, byte[] content, ImportReport report) {
        String bucket = storageMirror.defaultBucket();
        String key = ObjectKeys.forUpload(filename, content);
        try {
            // held across store and mark so the notification for this object sees it as done
            StorageObjectRef ref = locks.withLock(ObjectKeys.lockKey(bucket, key), () -> {
                StorageObjectRef stored = storageMirror.store(filename, content);
                markUploadDone(stored, report);
                return stored;
            });
            return UploadResponse.stored(filename, report, ref);
        } catch (ImportFailureException ex) {
            log.warn("Failed to mirror '{}' to object storage, rows were imported anyway: {}", filename,
                    ex.getMessage());
            return UploadResponse.storageFailed(filename, report, ex.getMessage());
        }
    }

    private void markUploadDone(StorageObjectRef stored, ImportReport report) {
        if (stored.etag() == null) {
            return;
        }
        try {
            ingestionLog.markDone(stored.bucket(), stored.key(), stored.etag(), IngestionSource.UPLOAD, report);
        } catch (StoreUnavailableException ex) {
            // the follow-up notification will re-import and find only duplicates
            log.warn("Could not record upload of {}/{} in ingestion log: {}", stored.bucket(), stored.key(),
                    ex.getMessage());
        }
    }

    private static String[] toExportRow(Document doc) {
        Object age = doc.get("age");
        return new String[] {
                doc.getString("name"),
                doc.getString("email"),
                age == null ? null : String.valueOf(age)
        };
    }

    private static String resolveFilename(String originalFilename) {
        if (originalFilename == null) {
            return UNKNOWN_FILENAME;
        }
        String trimmed = originalFilename.trim();
        return trimmed.isEmpty() ? UNKNOWN_FILENAME : trimmed;
    }
}
