package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.RejectionReason;

public sealed interface ValidationResult permits ValidationResult.Accepted, ValidationResult.Rejected {

    record Accepted(String name, String email, int age) implements ValidationResult {
    }

    record Rejected(RejectionReason reason) implements ValidationResult {
    }
}
