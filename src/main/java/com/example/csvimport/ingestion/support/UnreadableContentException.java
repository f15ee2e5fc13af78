package com.example.csvimport.ingestion.support;

/**
 * The input stream cannot be parsed as CSV at all. Retrying with the same bytes cannot succeed.
 */
public class UnreadableContentException extends ImportFailureException {

    public UnreadableContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
