package com.measurelog.common.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * One uploaded instrumentation log. Created when the storage upload event arrives,
 * before any of its measurement rows are written. Deleting it cascades to its rows
 * (foreign key {@code measurements.log_id ... on delete cascade}).
 */
@Entity
@Table(name = "logs", indexes = {
        @Index(name = "idx_logs_created_by", columnList = "created_by"),
        @Index(name = "idx_logs_ingestion_status", columnList = "ingestion_status")
})
public class LogFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name; // object name in the bucket: "<owner>/run-42.log"

    @Column(name = "storage_object_id", nullable = false, unique = true, length = 100)
    private String storageObjectId;

    @Column(name = "storage_path", nullable = false, length = 500)
    private String storagePath;

    @Column(name = "created_by", nullable = false, length = 255)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "ingestion_status", nullable = false, length = 20)
    private IngestionStatus ingestionStatus = IngestionStatus.UPLOADED;

    @Column(name = "measurement_count")
    private Integer measurementCount;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public enum IngestionStatus {
        UPLOADED, // registered from the upload event, waiting for the ingestion queue
        PROCESSING, // being downloaded and parsed
        COMPLETED, // all sections written
        FAILED // see failureReason; earlier batches may still be committed
    }

    public LogFile() {
        this.createdAt = LocalDateTime.now();
    }

    public LogFile(String name, String storageObjectId, String storagePath, String createdBy) {
        this();
        this.name = name;
        this.storageObjectId = storageObjectId;
        this.storagePath = storagePath;
        this.createdBy = createdBy;
    }

    public void markAsProcessing() {
        this.ingestionStatus = IngestionStatus.PROCESSING;
        this.failureReason = null;
    }

    public void markAsCompleted(int measurementCount) {
        this.ingestionStatus = IngestionStatus.COMPLETED;
        this.measurementCount = measurementCount;
        this.processedAt = LocalDateTime.now();
    }

    public void markAsFailed(String reason) {
        this.ingestionStatus = IngestionStatus.FAILED;
        this.failureReason = reason;
        this.processedAt = LocalDateTime.now();
    }

    public boolean isIngested() {
        return IngestionStatus.COMPLETED.equals(this.ingestionStatus);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStorageObjectId() {
        return storageObjectId;
    }

    public void setStorageObjectId(String storageObjectId) {
        this.storageObjectId = storageObjectId;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public IngestionStatus getIngestionStatus() {
        return ingestionStatus;
    }

    public void setIngestionStatus(IngestionStatus ingestionStatus) {
        this.ingestionStatus = ingestionStatus;
    }

    public Integer getMeasurementCount() {
        return measurementCount;
    }

    public void setMeasurementCount(Integer measurementCount) {
        this.measurementCount = measurementCount;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getProcessedAt() {
        return processedAt;
    }

    public void setProcessedAt(LocalDateTime processedAt) {
        this.processedAt = processedAt;
    }

    @Override
    public String toString() {
        return "LogFile{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", createdBy='" + createdBy + '\'' +
                ", ingestionStatus=" + ingestionStatus +
                '}';
    }
}
