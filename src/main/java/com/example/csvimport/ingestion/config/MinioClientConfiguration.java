package com.example.csvimport.ingestion.config;

import io.minio.MinioClient;
import io.minio.messages.Bucket;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MinioClientConfiguration {

    @Bean
    public MinioClient minioClient(@Value("${app.minio.endpoint}") String endpoint,
            @Value("${app.minio.access-key}") String accessKey,
            @Value("${app.minio.secret-key}") String secretKey,
            @Value("${app.minio.connect-timeout:10s}") Duration connectTimeout,
            @Value("${app.minio.read-timeout:30s}") Duration readTimeout) {
        log.info("Creating MinIO client for endpoint={} connectTimeout={} readTimeout={}",
                endpoint, connectTimeout, readTimeout);
        MinioClient client = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
        client.setTimeout(connectTimeout.toMillis(), readTimeout.toMillis(), readTimeout.toMillis());
        return client;
    }

    /**
     * Logs whether object storage is reachable at startup. Unlike a hard dependency check, a failure
     * here only logs: uploads still import rows while storage is down.
     */
    @Bean
    public ApplicationRunner storageConnectionCheck(MinioClient minioClient,
            @Value("${app.minio.endpoint}") String endpoint,
            @Value("${app.minio.verify-on-startup:true}") boolean verifyOnStartup) {
        return args -> {
            if (!verifyOnStartup) {
                return;
            }
            log.debug("Attempting to connect to object storage at {}...", endpoint);
            try {
                List<Bucket> buckets = minioClient.listBuckets();
                log.info("Object storage connection established. Buckets: {}",
                        buckets.stream().map(Bucket::name).toList());
            } catch (Exception e) {
                log.error("Could not connect to object storage at {}: {}", endpoint, e.getMessage());
            }
        };
    }
}
