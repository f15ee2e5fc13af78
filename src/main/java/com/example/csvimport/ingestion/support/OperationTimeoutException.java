package com.example.csvimport.ingestion.support;

public class OperationTimeoutException extends ImportFailureException {

    public OperationTimeoutException(String message) {
        super(message);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
