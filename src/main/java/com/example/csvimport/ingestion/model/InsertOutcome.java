package com.example.csvimport.ingestion.model;

public enum InsertOutcome {
    INSERTED,
    DUPLICATE_EMAIL
}
