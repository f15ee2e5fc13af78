package com.example.csvimport.ingestion.model;

public enum RejectionReason {
    MALFORMED_ROW("row must have exactly 3 fields: name,email,age"),
    NAME_TOO_SHORT("name must be at least 2 characters"),
    INVALID_EMAIL_FORMAT("invalid email"),
    AGE_NOT_INTEGER("age must be an integer"),
    AGE_OUT_OF_RANGE("age must be between 1 and 120"),
    DUPLICATE_EMAIL("duplicate email (already imported)");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public boolean isDuplicate() {
        return this == DUPLICATE_EMAIL;
    }
}
