package com.measurelog.ingestion.service;

import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.entity.LogFile;
import com.measurelog.common.entity.Measurement;
import com.measurelog.common.exception.DatabaseWriteException;
import com.measurelog.common.exception.NoValidMeasurementsException;
import com.measurelog.common.exception.StorageDownloadException;
import com.measurelog.common.repository.LogFileRepository;
import com.measurelog.common.repository.MeasurementRepository;
import com.measurelog.common.service.SupabaseStorageService;
import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.ingestion.parser.MeasurementParser;
import com.measurelog.ingestion.parser.MeasurementSection;
import com.measurelog.ingestion.parser.SectionField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestionCoordinator: batching, partial failure and log status transitions.
 */
@ExtendWith(MockitoExtension.class)
class IngestionCoordinatorTest {

    @Mock
    private LogFileRepository logFileRepository;

    @Mock
    private MeasurementRepository measurementRepository;

    @Mock
    private SupabaseStorageService storageService;

    @Mock
    private MeasurementParser measurementParser;

    @Mock
    private MeasurementBatchWriter batchWriter;

    @Mock
    private EmbeddingTriggerPublisher embeddingTrigger;

    @InjectMocks
    private IngestionCoordinator coordinator;

    @Captor
    private ArgumentCaptor<List<Measurement>> batches;

    private static final Long LOG_ID = 7L;
    private static final byte[] FILE = "measurements ...".getBytes(StandardCharsets.UTF_8);

    private final AtomicLong nextId = new AtomicLong(1);

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(coordinator, "readingsVectorNormalizer", new VectorNormalizer(16));
        ReflectionTestUtils.setField(coordinator, "batchSize", 50);
    }

    private static MeasurementSection section(String sensor, double... readings) {
        List<Double> values = new ArrayList<>();
        for (double reading : readings) {
            values.add(reading);
        }
        return MeasurementSection.builder(Clock.systemUTC())
                .readings(values)
                .field(SectionField.SENSOR_NAME, sensor)
                .field(SectionField.DESCRIPTION, "measurements for " + sensor)
                .field(SectionField.UNITS, "Volts")
                .field(SectionField.TST_ID, "TST-1")
                .build();
    }

    private void givenSections(int count) {
        List<MeasurementSection> sections = IntStream.range(0, count)
                .mapToObj(i -> section("S" + i, 0.5, 0.75))
                .toList();
        when(measurementParser.parse(anyString()))
                .thenReturn(new MeasurementParser.ParseResult(MeasurementParser.SourceFormat.TEXT, sections));
    }

    private List<Long> assignIds(List<Measurement> batch) {
        return batch.stream().map(m -> nextId.getAndIncrement()).toList();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Batching
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should write 120 sections as batches of 50, 50 and 20")
    void ingest_shouldWriteInBatchesOfFifty() {
        givenSections(120);
        when(batchWriter.writeBatch(anyList())).thenAnswer(inv -> assignIds(inv.getArgument(0)));

        int inserted = coordinator.ingest(FILE, LOG_ID);

        assertEquals(120, inserted);
        verify(batchWriter, times(3)).writeBatch(batches.capture());
        assertEquals(List.of(50, 50, 20), batches.getAllValues().stream().map(List::size).toList());
        verify(embeddingTrigger, times(3)).publish(anyList());
    }

    @Test
    @DisplayName("Should keep the first batch and stop when the second batch fails")
    void ingest_shouldStopAfterFailedBatch() {
        givenSections(120);
        when(batchWriter.writeBatch(anyList()))
                .thenAnswer(inv -> assignIds(inv.getArgument(0)))
                .thenThrow(new DataIntegrityViolationException("constraint violated"));

        DatabaseWriteException ex = assertThrows(DatabaseWriteException.class,
                () -> coordinator.ingest(FILE, LOG_ID));

        assertTrue(ex.getMessage().contains("Batch 2/3"));
        assertTrue(ex.getMessage().contains("50 rows were committed"));
        verify(batchWriter, times(2)).writeBatch(anyList());
        verify(embeddingTrigger, times(1)).publish(argThat(ids -> ids.size() == 50));
    }

    @Test
    @DisplayName("Should keep ingesting when the embedding trigger cannot be published")
    void ingest_shouldSurviveTriggerFailure() {
        givenSections(3);
        when(batchWriter.writeBatch(anyList())).thenAnswer(inv -> assignIds(inv.getArgument(0)));
        when(embeddingTrigger.publish(anyList())).thenThrow(new AmqpException("broker down"));

        assertEquals(3, coordinator.ingest(FILE, LOG_ID));
    }

    @Test
    @DisplayName("Should write nothing when the parser finds no measurements")
    void ingest_shouldPropagateNoValidMeasurements() {
        when(measurementParser.parse(anyString()))
                .thenThrow(new NoValidMeasurementsException("No valid measurements found in file (parsed as TEXT)"));

        assertThrows(NoValidMeasurementsException.class, () -> coordinator.ingest(FILE, LOG_ID));
        verifyNoInteractions(batchWriter, embeddingTrigger);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Row Drafts
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should build a pending row with summary text and a 16-wide readings vector")
    void toDraft_shouldMapSection() {
        Measurement draft = coordinator.toDraft(section("Rail_12V", 0.5, 2.0), LOG_ID);

        assertEquals(LOG_ID, draft.getLogId());
        assertEquals("Rail_12V @ TST-1", draft.getName());
        assertEquals(EmbeddingStatus.PENDING, draft.getEmbeddingStatus());
        assertNull(draft.getEmbedding());
        assertEquals(2, draft.getTotalMeasurements());
        assertEquals(16, draft.getReadingsVector().split(",").length);
        assertTrue(draft.getReadingsVector().endsWith(",2.0]"));
        assertEquals("Sensor Rail_12V measuring measurements for Rail_12V with values ranging from 0.5 to 2 Volts. "
                        + "Category: power, Sub-category: OTHER. Source: , Status: unknown",
                draft.getEmbeddingText());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Log Lifecycle
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    private LogFile logFile() {
        LogFile logFile = new LogFile("run-1.log", "obj-1", "owner/run-1.log", "owner");
        logFile.setId(LOG_ID);
        return logFile;
    }

    @Test
    @DisplayName("Should mark the log completed with its row count")
    void ingestLog_shouldCompleteLog() {
        LogFile logFile = logFile();
        when(logFileRepository.findById(LOG_ID)).thenReturn(Optional.of(logFile));
        when(storageService.downloadFile("owner/run-1.log")).thenReturn(FILE);
        givenSections(2);
        when(batchWriter.writeBatch(anyList())).thenAnswer(inv -> assignIds(inv.getArgument(0)));

        assertEquals(2, coordinator.ingestLog(LOG_ID));

        assertEquals(LogFile.IngestionStatus.COMPLETED, logFile.getIngestionStatus());
        assertEquals(2, logFile.getMeasurementCount());
        verify(logFileRepository, times(2)).save(logFile);
    }

    @Test
    @DisplayName("Should mark the log failed and rethrow when the download fails")
    void ingestLog_shouldFailLogOnDownloadError() {
        LogFile logFile = logFile();
        when(logFileRepository.findById(LOG_ID)).thenReturn(Optional.of(logFile));
        when(storageService.downloadFile(anyString()))
                .thenThrow(new StorageDownloadException("Download of owner/run-1.log failed with HTTP 404"));

        assertThrows(StorageDownloadException.class, () -> coordinator.ingestLog(LOG_ID));

        assertEquals(LogFile.IngestionStatus.FAILED, logFile.getIngestionStatus());
        assertTrue(logFile.getFailureReason().contains("HTTP 404"));
        verifyNoInteractions(measurementParser, batchWriter);
    }

    @Test
    @DisplayName("Should mark the log failed and rethrow on an unexpected runtime error")
    void ingestLog_shouldFailLogOnUnexpectedError() {
        LogFile logFile = logFile();
        when(logFileRepository.findById(LOG_ID)).thenReturn(Optional.of(logFile));
        when(storageService.downloadFile(anyString())).thenReturn(FILE);
        when(measurementParser.parse(anyString())).thenThrow(new IllegalStateException("parser not initialised"));

        assertThrows(IllegalStateException.class, () -> coordinator.ingestLog(LOG_ID));

        assertEquals(LogFile.IngestionStatus.FAILED, logFile.getIngestionStatus());
        assertTrue(logFile.getFailureReason().contains("parser not initialised"));
        verify(logFileRepository, times(2)).save(logFile);
    }

    @Test
    @DisplayName("Should skip a log that was already ingested")
    void ingestLog_shouldSkipCompletedLog() {
        LogFile logFile = logFile();
        logFile.markAsCompleted(5);
        when(logFileRepository.findById(LOG_ID)).thenReturn(Optional.of(logFile));

        assertEquals(0, coordinator.ingestLog(LOG_ID));
        verifyNoInteractions(storageService, batchWriter);
    }

    @Test
    @DisplayName("Should reject an unknown log id")
    void ingestLog_shouldRejectUnknownLog() {
        when(logFileRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> coordinator.ingestLog(99L));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Embedding Re-trigger
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should re-queue only rows without an embedding")
    void requeueEmbeddings_shouldPublishUnembeddedIds() {
        when(logFileRepository.existsById(LOG_ID)).thenReturn(true);
        when(measurementRepository.findUnembeddedIds(LOG_ID)).thenReturn(List.of(3L, 4L));
        when(embeddingTrigger.publish(List.of(3L, 4L))).thenReturn(1);

        assertEquals(2, coordinator.requeueEmbeddings(LOG_ID));
    }

    @Test
    @DisplayName("Should publish nothing when every row is embedded")
    void requeueEmbeddings_shouldSkipWhenNothingPending() {
        when(logFileRepository.existsById(LOG_ID)).thenReturn(true);
        when(measurementRepository.findUnembeddedIds(LOG_ID)).thenReturn(List.of());

        assertEquals(0, coordinator.requeueEmbeddings(LOG_ID));
        verifyNoInteractions(embeddingTrigger);
    }
}
