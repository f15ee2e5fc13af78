package com.example.csvimport.ingestion.model;

public enum IngestionSource {
    UPLOAD,
    WEBHOOK
}
