package com.example.csvimport.ingestion.service;

import com.example.csvimport.ingestion.model.StorageObjectRef;
import java.util.Optional;

/**
 * Object-storage copy of uploaded files.
 *
 * <p>Implementations report connectivity, credential and protocol failures as
 * {@link com.example.csvimport.ingestion.support.StorageUnavailableException} and socket timeouts as
 * {@link com.example.csvimport.ingestion.support.OperationTimeoutException}.</p>
 */
public interface StorageMirror {

    String defaultBucket();

    /**
     * Uploads {@code content} to the default bucket under {@code ObjectKeys.forUpload(filename, content)},
     * creating the bucket first when it does not exist.
     */
    StorageObjectRef store(String filename, byte[] content);

    byte[] fetch(String bucket, String key);

    Optional<StorageObjectRef> stat(String bucket, String key);

    default boolean exists(String bucket, String key) {
        return stat(bucket, key).isPresent();
    }
}
