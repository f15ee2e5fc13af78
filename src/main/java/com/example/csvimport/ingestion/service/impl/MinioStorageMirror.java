package com.example.csvimport.ingestion.service.impl;

import com.example.csvimport.ingestion.model.StorageObjectRef;
import com.example.csvimport.ingestion.service.StorageMirror;
import com.example.csvimport.ingestion.support.ObjectKeys;
import com.example.csvimport.ingestion.support.OperationTimeoutException;
import com.example.csvimport.ingestion.support.StorageUnavailableException;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import java.io.ByteArrayInputStream;
import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class MinioStorageMirror implements StorageMirror {

    private static final String CSV_CONTENT_TYPE = "text/csv";
    private static final Set<String> MISSING_OBJECT_CODES = Set.of("NoSuchKey", "NoSuchObject", "NoSuchBucket");
    private static final String BUCKET_ALREADY_OWNED = "BucketAlreadyOwnedByYou";

    private final MinioClient minioClient;
    private final String bucketName;

    public MinioStorageMirror(MinioClient minioClient, @Value("${app.minio.bucket:uploads}") String bucketName) {
        this.minioClient = minioClient;
        this.bucketName = bucketName;
    }

    @Override
    public String defaultBucket() {
        return bucketName;
    }

    @Override
    public StorageObjectRef store(String filename, byte[] content) {
        String key = ObjectKeys.forUpload(filename, content);
        try {
            ensureBucket(bucketName);
            log.debug("Uploading '{}' ({} bytes) to bucket '{}'", key, content.length, bucketName);
            ObjectWriteResponse response = minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucketName)
                            .object(key)
                            .stream(new ByteArrayInputStream(content), content.length, -1)
                            .contentType(CSV_CONTENT_TYPE)
                            .build());
            log.info("Uploaded file to object storage: {}/{}", bucketName, key);
            return new StorageObjectRef(bucketName, key, content.length, ObjectKeys.normalizeEtag(response.etag()));
        } catch (Exception e) {
            throw translate("upload " + bucketName + "/" + key, e);
        }
    }

    @Override
    public byte[] fetch(String bucket, String key) {
        log.info("Downloading '{}' from bucket '{}'", key, bucket);
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .build())) {
            return response.readAllBytes();
        } catch (Exception e) {
            throw translate("download " + bucket + "/" + key, e);
        }
    }

    @Override
    public Optional<StorageObjectRef> stat(String bucket, String key) {
        try {
            StatObjectResponse stat = minioClient.statObject(
                    StatObjectArgs.builder()
                            .bucket(bucket)
                            .object(key)
                            .build());
            return Optional.of(new StorageObjectRef(bucket, key, stat.size(), ObjectKeys.normalizeEtag(stat.etag())));
        } catch (ErrorResponseException e) {
            if (MISSING_OBJECT_CODES.contains(e.errorResponse().code())) {
                return Optional.empty();
            }
            throw translate("stat " + bucket + "/" + key, e);
        } catch (Exception e) {
            throw translate("stat " + bucket + "/" + key, e);
        }
    }

    private void ensureBucket(String bucket) throws Exception {
        if (minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
            return;
        }
        log.info("Bucket '{}' does not exist. Creating...", bucket);
        try {
            minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
        } catch (ErrorResponseException e) {
            if (!BUCKET_ALREADY_OWNED.equals(e.errorResponse().code())) {
                throw e;
            }
            log.debug("Bucket '{}' was created concurrently", bucket);
        }
    }

    private static RuntimeException translate(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (isTimeout(e)) {
            log.warn("Object storage timed out during {}: {}", operation, e.getMessage());
            return new OperationTimeoutException("Object storage timed out during " + operation, e);
        }
        log.error("Object storage failure during {}", operation, e);
        return new StorageUnavailableException("Object storage failed during " + operation + ": " + e.getMessage(), e);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current instanceof InterruptedIOException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
