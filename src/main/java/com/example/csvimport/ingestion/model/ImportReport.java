package com.example.csvimport.ingestion.model;

import java.util.List;

/**
 * Outcome of importing one file. Counters cover every data row; {@code rejections} may be cut short
 * for very noisy files, in which case {@code rejectionsTruncated} is set.
 */
public record ImportReport(
        String source,
        long totalRows,
        long inserted,
        long duplicateEmail,
        long invalid,
        List<RowRejection> rejections,
        boolean rejectionsTruncated,
        long durationMillis) {

    public ImportReport {
        rejections = List.copyOf(rejections);
    }

    public long errors() {
        return duplicateEmail + invalid;
    }
}
