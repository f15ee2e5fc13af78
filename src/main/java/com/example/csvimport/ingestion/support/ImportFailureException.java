package com.example.csvimport.ingestion.support;

/**
 * Failure that ends a whole import or storage operation, as opposed to a row-level
 * rejection which is recorded in the report.
 */
public abstract class ImportFailureException extends RuntimeException {

    protected ImportFailureException(String message) {
        super(message);
    }

    protected ImportFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
