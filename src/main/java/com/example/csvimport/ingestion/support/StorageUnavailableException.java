package com.example.csvimport.ingestion.support;

/**
 * Object storage rejected or failed a request (connectivity, credentials, protocol).
 */
public class StorageUnavailableException extends ImportFailureException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
