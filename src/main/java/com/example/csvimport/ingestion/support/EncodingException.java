package com.example.csvimport.ingestion.support;

public class EncodingException extends UnreadableContentException {

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
