package com.example.csvimport.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * S3 event-notification body as sent by MinIO and AWS. Only the fields needed for ingestion are
 * mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectStorageNotification(
        @JsonProperty("Records") List<EventRecord> records) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventRecord(
            @JsonProperty("eventName") String eventName,
            @JsonProperty("s3") S3Entity s3) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record S3Entity(
            @JsonProperty("bucket") BucketEntity bucket,
            @JsonProperty("object") ObjectEntity object) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BucketEntity(
            @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ObjectEntity(
            @JsonProperty("key") String key,
            @JsonProperty("size") Long size,
            @JsonProperty("eTag") String etag,
            @JsonProperty("sequencer") String sequencer) {
    }
}
