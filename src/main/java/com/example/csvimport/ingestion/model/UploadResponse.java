package com.example.csvimport.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadResponse(
        String filename,
        @JsonUnwrapped ImportReport report,
        StorageObjectRef storedObject,
        String storageError) {

    public static UploadResponse stored(String filename, ImportReport report, StorageObjectRef storedObject) {
        return new UploadResponse(filename, report, storedObject, null);
    }

    public static UploadResponse storageFailed(String filename, ImportReport report, String storageError) {
        return new UploadResponse(filename, report, null, storageError);
    }
}
