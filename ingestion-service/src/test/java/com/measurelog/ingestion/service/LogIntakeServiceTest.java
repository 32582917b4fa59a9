package com.measurelog.ingestion.service;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.entity.LogFile;
import com.measurelog.common.message.LogIngestionMessage;
import com.measurelog.common.message.StorageUploadEvent;
import com.measurelog.common.repository.LogFileRepository;
import com.measurelog.common.repository.MeasurementRepository;
import com.measurelog.common.service.SupabaseStorageService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LogIntakeService: upload registration, dedup and status queries.
 */
@ExtendWith(MockitoExtension.class)
class LogIntakeServiceTest {

    @Mock
    private LogFileRepository logFileRepository;

    @Mock
    private MeasurementRepository measurementRepository;

    @Mock
    private SupabaseStorageService storageService;

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private LogIntakeService intakeService;

    private static final StorageUploadEvent UPLOAD =
            new StorageUploadEvent("logs", "obj-42", "alice", "alice/runs/run-42.log");

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Upload Registration
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should register a new upload and queue it for ingestion")
    void registerUpload_shouldCreateAndQueueLog() {
        when(storageService.getBucketName()).thenReturn("logs");
        when(logFileRepository.findByStorageObjectId("obj-42")).thenReturn(Optional.empty());
        when(logFileRepository.save(any(LogFile.class))).thenAnswer(inv -> {
            LogFile logFile = inv.getArgument(0);
            logFile.setId(42L);
            return logFile;
        });

        LogFile result = intakeService.registerUpload(UPLOAD).orElseThrow();

        assertEquals("run-42.log", result.getName());
        assertEquals("alice/runs/run-42.log", result.getStoragePath());
        assertEquals("alice", result.getCreatedBy());
        assertEquals(LogFile.IngestionStatus.UPLOADED, result.getIngestionStatus());
        verify(rabbitTemplate).convertAndSend(
                RabbitMQConfig.MEASURELOG_EXCHANGE, RabbitMQConfig.LOG_INGEST_KEY, new LogIngestionMessage(42L));
    }

    @Test
    @DisplayName("Should return the existing log for a re-delivered upload event")
    void registerUpload_shouldBeIdempotent() {
        LogFile existing = new LogFile("run-42.log", "obj-42", "alice/runs/run-42.log", "alice");
        existing.setId(42L);
        when(storageService.getBucketName()).thenReturn("logs");
        when(logFileRepository.findByStorageObjectId("obj-42")).thenReturn(Optional.of(existing));

        assertSame(existing, intakeService.registerUpload(UPLOAD).orElseThrow());
        verify(logFileRepository, never()).save(any());
        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    @DisplayName("Should ignore uploads to other buckets")
    void registerUpload_shouldIgnoreOtherBuckets() {
        when(storageService.getBucketName()).thenReturn("logs");

        Optional<LogFile> result = intakeService.registerUpload(
                new StorageUploadEvent("avatars", "obj-1", "alice", "alice/me.png"));

        assertTrue(result.isEmpty());
        verifyNoInteractions(logFileRepository, rabbitTemplate);
    }

    @Test
    @DisplayName("Should reject an upload event without an owner")
    void registerUpload_shouldRejectIncompleteEvent() {
        assertThrows(IllegalArgumentException.class, () -> intakeService.registerUpload(
                new StorageUploadEvent("logs", "obj-1", " ", "x.log")));
    }

    @Test
    @DisplayName("Should take the last path segment as the log name")
    void fileName_shouldUseLastSegment() {
        assertEquals("run.log", LogIntakeService.fileName("a/b/run.log"));
        assertEquals("run.log", LogIntakeService.fileName("run.log"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Status Queries
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should report every embedding status, zero when absent")
    void getEmbeddingProgress_shouldFillMissingStatuses() {
        when(measurementRepository.countByEmbeddingStatus(7L)).thenReturn(List.<Object[]>of(
                new Object[]{EmbeddingStatus.COMPLETED, 3L},
                new Object[]{EmbeddingStatus.FAILED, 1L}));

        Map<String, Long> progress = intakeService.getEmbeddingProgress(7L);

        assertEquals(Map.of("pending", 0L, "processing", 0L, "completed", 3L, "failed", 1L), progress);
    }

    @Test
    @DisplayName("Should reject an unknown log id")
    void getLog_shouldRejectUnknownLog() {
        when(logFileRepository.findById(1L)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> intakeService.getLog(1L));
    }
}
