package com.measurelog.common.service;

import com.measurelog.common.exception.StorageDownloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Read side of the object storage the logs are uploaded to.
 */
@Slf4j
@Service
public class SupabaseStorageService {

    private final WebClient webClient;

    @Value("${supabase.url}")
    private String supabaseUrl;

    @Value("${supabase.service-key}")
    private String serviceKey;

    @Value("${supabase.bucket}")
    private String bucketName;

    @Value("${supabase.download-timeout-ms:30000}")
    private long downloadTimeoutMs;

    public SupabaseStorageService() {
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(50 * 1024 * 1024)) // 50MB
                .build();
    }

    /**
     * Download file content directly (for parsing).
     *
     * @throws StorageDownloadException when the object is missing, empty or the call fails
     */
    public byte[] downloadFile(String objectPath) {
        if (objectPath == null || objectPath.isBlank()) {
            throw new StorageDownloadException("Storage path not found for log");
        }

        byte[] content;
        try {
            content = webClient
                    .get()
                    .uri(supabaseUrl + "/storage/v1/object/" + bucketName + "/" + objectPath)
                    .header("Authorization", "Bearer " + serviceKey)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(Duration.ofMillis(downloadTimeoutMs));
        } catch (WebClientResponseException e) {
            throw new StorageDownloadException(
                    "Download of " + objectPath + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new StorageDownloadException("Download of " + objectPath + " failed: " + e.getMessage(), e);
        }

        if (content == null) {
            throw new StorageDownloadException("No file data received for " + objectPath);
        }
        log.info("Downloaded {} ({} bytes) from bucket {}", objectPath, content.length, bucketName);
        return content;
    }

    public String getBucketName() {
        return bucketName;
    }
}
