package com.example.csvimport.ingestion.support;

/**
 * The record store could not be reached or refused a write for a reason other than a duplicate email.
 */
public class StoreUnavailableException extends ImportFailureException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
