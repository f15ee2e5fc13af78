package com.example.csvimport.ingestion.service;

/**
 * One data row as read from the file, before validation. Fields are in canonical
 * {@code name,email,age} order; a malformed row carries only its field count.
 */
record RawRow(long rowNumber, String name, String email, String age, int fieldCount) {

    static final int EXPECTED_FIELDS = 3;

    static RawRow malformed(long rowNumber, int fieldCount) {
        return new RawRow(rowNumber, null, null, null, fieldCount);
    }

    boolean wellFormed() {
        return fieldCount == EXPECTED_FIELDS;
    }
}
