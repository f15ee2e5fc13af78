package com.example.csvimport.ingestion.controller;

import com.example.csvimport.ingestion.model.CustomerDocument;
import com.example.csvimport.ingestion.model.UploadResponse;
import com.example.csvimport.ingestion.model.WebhookResponse;
import com.example.csvimport.ingestion.service.CustomerImportService;
import com.example.csvimport.ingestion.service.WebhookIngestionHandler;
import com.example.csvimport.ingestion.support.FileProcessingException;
import com.example.csvimport.ingestion.support.OperationTimeoutException;
import com.example.csvimport.ingestion.support.StoreUnavailableException;
import com.example.csvimport.ingestion.support.UnreadableContentException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@Slf4j
@RestController
@RequiredArgsConstructor
public class CustomerImportController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final CustomerImportService customerImportService;
    private final WebhookIngestionHandler webhookIngestionHandler;

    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> upload(@RequestParam(value = "file", required = false) MultipartFile file) {
        UploadResponse response = customerImportService.upload(file);
        log.info("Upload file={} inserted={} errors={} stored={}", response.filename(),
                response.report().inserted(), response.report().errors(), response.storedObject() != null);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/export")
    public ResponseEntity<StreamingResponseBody> export() {
        StreamingResponseBody body = customerImportService::exportCustomers;
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=customers_export.csv")
            .contentType(TEXT_CSV)
            .body(body);
    }

    @GetMapping("/sample")
    public ResponseEntity<byte[]> sample() {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=sample_customers.csv")
            .contentType(TEXT_CSV)
            .body(customerImportService.sampleCsv());
    }

    @GetMapping("/customers")
    public List<CustomerDocument> latestCustomers(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        return customerImportService.latestCustomers(limit);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @PostMapping("/obs-event")
    public ResponseEntity<WebhookResponse> objectStorageEvent(@RequestBody(required = false) byte[] payload) {
        WebhookResponse response = webhookIngestionHandler.handleNotification(payload);
        HttpStatus status = response.retryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<String> handleFileProcessingException(FileProcessingException exception) {
        log.warn("Upload rejected: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(exception.getMessage());
    }

    @ExceptionHandler(UnreadableContentException.class)
    public ResponseEntity<String> handleUnreadableContent(UnreadableContentException exception) {
        log.warn("Import aborted: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(exception.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<String> handleMaxUploadSize(MaxUploadSizeExceededException exception) {
        log.warn("Upload rejected: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body("File exceeds the upload size limit");
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<String> handleStoreUnavailable(StoreUnavailableException exception) {
        log.error("Record store unavailable", exception);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(exception.getMessage());
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<String> handleTimeout(OperationTimeoutException exception) {
        log.warn("Operation timed out: {}", exception.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(exception.getMessage());
    }
}
