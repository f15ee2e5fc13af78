package com.example.csvimport.ingestion.model;

public record StorageObjectRef(String bucket, String key, long size, String etag) {
}
