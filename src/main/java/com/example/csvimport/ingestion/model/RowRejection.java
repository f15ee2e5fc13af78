package com.example.csvimport.ingestion.model;

public record RowRejection(long row, RejectionReason reason, String message) {

    public static RowRejection of(long row, RejectionReason reason) {
        return new RowRejection(row, reason, reason.message());
    }
}
