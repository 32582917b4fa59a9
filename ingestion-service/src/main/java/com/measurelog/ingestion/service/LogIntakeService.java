package com.measurelog.ingestion.service;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.entity.LogFile;
import com.measurelog.common.entity.Measurement;
import com.measurelog.common.message.LogIngestionMessage;
import com.measurelog.common.message.StorageUploadEvent;
import com.measurelog.common.repository.LogFileRepository;
import com.measurelog.common.repository.MeasurementRepository;
import com.measurelog.common.service.SupabaseStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns storage upload notifications into {@code logs} rows and queues them for ingestion.
 */
@Slf4j
@Service
public class LogIntakeService {

    @Autowired
    private LogFileRepository logFileRepository;

    @Autowired
    private MeasurementRepository measurementRepository;

    @Autowired
    private SupabaseStorageService storageService;

    @Autowired
    private RabbitTemplate rabbitTemplate;

    /**
     * Register an uploaded object as a log and queue it.
     *
     * @return the log, or empty when the object is not in the logs bucket
     */
    public Optional<LogFile> registerUpload(StorageUploadEvent event) {
        validateEvent(event);

        if (!storageService.getBucketName().equals(event.bucket())) {
            log.debug("Ignoring upload to bucket {}: {}", event.bucket(), event.name());
            return Optional.empty();
        }

        // Upload events are delivered at-least-once
        Optional<LogFile> existing = logFileRepository.findByStorageObjectId(event.objectId());
        if (existing.isPresent()) {
            log.info("Upload {} already registered as log {}", event.objectId(), existing.get().getId());
            return existing;
        }

        LogFile logFile = new LogFile(fileName(event.name()), event.objectId(), event.name(), event.owner());
        LogFile saved = logFileRepository.save(logFile);
        log.info("Log registered: {} (id {}) for owner {}", saved.getName(), saved.getId(), saved.getCreatedBy());

        queueForIngestion(saved);
        return Optional.of(saved);
    }

    /**
     * Queue a log for the ingestion pipeline.
     */
    public void queueForIngestion(LogFile logFile) {
        rabbitTemplate.convertAndSend(
                RabbitMQConfig.MEASURELOG_EXCHANGE,
                RabbitMQConfig.LOG_INGEST_KEY,
                LogIngestionMessage.from(logFile)
        );

        log.info("Queued log for ingestion: {}", logFile.getId());
    }

    public LogFile getLog(Long logId) {
        return logFileRepository.findById(logId)
                .orElseThrow(() -> new IllegalArgumentException("Log not found: " + logId));
    }

    public List<LogFile> getOwnerLogs(String owner) {
        return logFileRepository.findByCreatedByOrderByCreatedAtDesc(owner);
    }

    public List<Measurement> getMeasurements(Long logId) {
        getLog(logId);
        return measurementRepository.findByLogIdOrderByIdAsc(logId);
    }

    /**
     * Row counts per embedding status, every status present (zero when absent).
     */
    public Map<String, Long> getEmbeddingProgress(Long logId) {
        Map<String, Long> progress = new LinkedHashMap<>();
        for (EmbeddingStatus status : EmbeddingStatus.values()) {
            progress.put(status.getValue(), 0L);
        }
        for (Object[] row : measurementRepository.countByEmbeddingStatus(logId)) {
            progress.put(((EmbeddingStatus) row[0]).getValue(), ((Number) row[1]).longValue());
        }
        return progress;
    }

    private void validateEvent(StorageUploadEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Upload event is required");
        }
        if (event.objectId() == null || event.objectId().isBlank()) {
            throw new IllegalArgumentException("Upload event has no object id");
        }
        if (event.name() == null || event.name().isBlank()) {
            throw new IllegalArgumentException("Upload event has no object name");
        }
        if (event.owner() == null || event.owner().isBlank()) {
            throw new IllegalArgumentException("Upload event has no owner");
        }
    }

    // "<owner>/runs/run-42.log" → "run-42.log"
    static String fileName(String objectName) {
        int slash = objectName.lastIndexOf('/');
        return slash >= 0 ? objectName.substring(slash + 1) : objectName;
    }
}
