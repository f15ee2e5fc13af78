package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.ImportReport;
import com.example.csvimport.ingestion.model.InsertOutcome;
import com.example.csvimport.ingestion.model.RejectionReason;
import com.example.csvimport.ingestion.model.RowRejection;
import com.example.csvimport.ingestion.support.CamelCsvParserFactory;
import com.example.csvimport.ingestion.support.OperationTimeoutException;
import com.example.csvimport.ingestion.support.UnreadableContentException;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Parses, validates and persists one CSV file row by row, in file order. Row-level problems are
 * counted in the report; only unreadable input, an unavailable store or a missed deadline end the
 * import early.
 */
@Slf4j
@Component
class CustomerCsvImporter {

    private final CamelCsvParserFactory parserFactory;
    private final RowValidator validator;
    private final CustomerRepository repository;
    private final Clock clock;
    private final int maxReportedRejections;

    CustomerCsvImporter(CamelCsvParserFactory parserFactory,
            RowValidator validator,
            CustomerRepository repository,
            Clock clock,
            @Value("${app.ingestion.max-reported-rejections:1000}") int maxReportedRejections) {
        this.parserFactory = parserFactory;
        this.validator = validator;
        this.repository = repository;
        this.clock = clock;
        this.maxReportedRejections = Math.max(0, maxReportedRejections);
    }

    ImportReport importCsv(InputStream content, String source, Instant deadline) {
        Instant start = clock.instant();
        ImportReportAccumulator accumulator = new ImportReportAccumulator(source, maxReportedRejections);

        try (CsvRowReader rows = new CsvRowReader(parserFactory.newParser(), content)) {
            RawRow row;
            while ((row = rows.next()) != null) {
                checkDeadline(deadline, source, row.rowNumber());
                accumulator.incrementTotal();
                importRow(row, accumulator);
            }
        } catch (IOException ex) {
            throw new UnreadableContentException("Failed to read CSV for %s".formatted(source), ex);
        }

        ImportReport report = accumulator.toReport(Duration.between(start, clock.instant()).toMillis());
        log.info("Completed import for source={} rows={} inserted={} duplicates={} invalid={} durationMs={}",
                report.source(), report.totalRows(), report.inserted(), report.duplicateEmail(),
                report.invalid(), report.durationMillis());
        return report;
    }

    private void importRow(RawRow row, ImportReportAccumulator accumulator) {
        if (!row.wellFormed()) {
            log.debug("Row {} has {} fields", row.rowNumber(), row.fieldCount());
            accumulator.reject(row.rowNumber(), RejectionReason.MALFORMED_ROW);
            return;
        }

        ValidationResult result = validator.validate(row.name(), row.email(), row.age());
        if (result instanceof ValidationResult.Rejected rejected) {
            accumulator.reject(row.rowNumber(), rejected.reason());
            return;
        }

        ValidationResult.Accepted accepted = (ValidationResult.Accepted) result;
        if (repository.insert(accepted) == InsertOutcome.DUPLICATE_EMAIL) {
            accumulator.reject(row.rowNumber(), RejectionReason.DUPLICATE_EMAIL);
        } else {
            accumulator.incrementInserted();
        }
    }

    private void checkDeadline(Instant deadline, String source, long rowNumber) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationTimeoutException("Import of %s interrupted before row %d".formatted(source, rowNumber));
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new OperationTimeoutException("Import of %s timed out before row %d".formatted(source, rowNumber));
        }
    }

    private static final class ImportReportAccumulator {
        private final String source;
        private final int maxRejections;
        private final List<RowRejection> rejections = new ArrayList<>();

        private long total;
        private long inserted;
        private long duplicates;
        private long invalid;
        private boolean truncated;

        private ImportReportAccumulator(String source, int maxRejections) {
            this.source = source;
            this.maxRejections = maxRejections;
        }

        void incrementTotal() {
            total++;
        }

        void incrementInserted() {
            inserted++;
        }

        void reject(long rowNumber, RejectionReason reason) {
            if (reason.isDuplicate()) {
                duplicates++;
            } else {
                invalid++;
            }
            if (rejections.size() < maxRejections) {
                rejections.add(RowRejection.of(rowNumber, reason));
            } else {
                truncated = true;
            }
        }

        ImportReport toReport(long durationMillis) {
            return new ImportReport(source, total, inserted, duplicates, invalid, rejections, truncated,
                    durationMillis);
        }
    }
}
