package com.measurelog.ingestion.service;

import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.entity.LogFile;
import com.measurelog.common.entity.Measurement;
import com.measurelog.common.exception.DatabaseWriteException;
import com.measurelog.common.exception.EmptyVectorException;
import com.measurelog.common.exception.MeasureLogException;
import com.measurelog.common.exception.NoValidMeasurementsException;
import com.measurelog.common.repository.LogFileRepository;
import com.measurelog.common.repository.MeasurementRepository;
import com.measurelog.common.service.SupabaseStorageService;
import com.measurelog.common.vector.PgVectors;
import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.ingestion.parser.MeasurementParser;
import com.measurelog.ingestion.parser.MeasurementSection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Log ingestion: download → parse → insert in batches → hand the new rows to embedding.
 *
 * Batches commit independently. If batch k fails, batches 1..k-1 stay committed, nothing
 * after k is attempted and the call raises: at-least-once per file, not all-or-nothing.
 */
@Slf4j
@Service
public class IngestionCoordinator {

    @Autowired
    private LogFileRepository logFileRepository;

    @Autowired
    private MeasurementRepository measurementRepository;

    @Autowired
    private SupabaseStorageService storageService;

    @Autowired
    private MeasurementParser measurementParser;

    @Autowired
    private MeasurementBatchWriter batchWriter;

    @Autowired
    private EmbeddingTriggerPublisher embeddingTrigger;

    @Autowired
    @Qualifier("readingsVectorNormalizer")
    private VectorNormalizer readingsVectorNormalizer;

    @Value("${measurelog.ingestion.batch-size:50}")
    private int batchSize;

    /**
     * Entry point for a queued log: runs the whole pipeline and records the outcome on the
     * log row. A log already ingested is left alone, so re-delivered messages are harmless.
     *
     * @return rows inserted (0 when the log was already ingested)
     */
    public int ingestLog(Long logId) {
        LogFile logFile = logFileRepository.findById(logId)
                .orElseThrow(() -> new IllegalArgumentException("Log not found: " + logId));

        if (logFile.isIngested()) {
            log.info("Log {} already ingested ({} rows), skipping", logId, logFile.getMeasurementCount());
            return 0;
        }

        log.info("\nLOG INGESTION");
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("Log ID: {}", logId);
        log.info("Owner: {}", logFile.getCreatedBy());
        log.info("File: {}", logFile.getStoragePath());

        logFile.markAsProcessing();
        logFileRepository.save(logFile);

        try {
            log.info("\nSTEP 1: Downloading file from storage...");
            byte[] fileBytes = storageService.downloadFile(logFile.getStoragePath());

            int inserted = ingest(fileBytes, logId);

            logFile.markAsCompleted(inserted);
            logFileRepository.save(logFile);

            log.info("\nINGESTION COMPLETE: {} measurements stored for log {}", inserted, logId);
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━\n");
            return inserted;

        } catch (MeasureLogException e) {
            log.error("INGESTION FAILED for log {}: {}", logId, e.getMessage(), e);
            logFile.markAsFailed(e.getMessage());
            logFileRepository.save(logFile);
            throw e;
        } catch (RuntimeException e) {
            log.error("INGESTION FAILED for log {} with an unexpected error", logId, e);
            logFile.markAsFailed("Unexpected error: " + e.getMessage());
            logFileRepository.save(logFile);
            throw e;
        }
    }

    /**
     * Parses the file and writes its sections as rows owned by {@code logId}.
     *
     * @return number of rows inserted
     * @throws NoValidMeasurementsException when nothing valid was parsed; no rows are written
     * @throws DatabaseWriteException       when a batch fails; earlier batches remain committed
     */
    public int ingest(byte[] fileBytes, Long logId) {
        String content = new String(fileBytes, StandardCharsets.UTF_8);
        log.debug("File contents preview: {}", content.substring(0, Math.min(200, content.length())));

        log.info("\nSTEP 2: Parsing measurement sections...");
        MeasurementParser.ParseResult parsed = measurementParser.parse(content);
        log.info("   {} sections parsed as {}", parsed.sections().size(), parsed.format());

        List<Measurement> drafts = toDrafts(parsed.sections(), logId);
        if (drafts.isEmpty()) {
            throw new NoValidMeasurementsException("No valid measurements found in file");
        }

        int batchCount = (drafts.size() + batchSize - 1) / batchSize;
        log.info("\nSTEP 3: Writing {} measurements in {} batch(es) of up to {}", drafts.size(), batchCount, batchSize);

        int inserted = 0;
        for (int i = 0; i < batchCount; i++) {
            List<Measurement> batch = drafts.subList(i * batchSize, Math.min(drafts.size(), (i + 1) * batchSize));
            log.info("   Batch {}/{} ({} rows)", i + 1, batchCount, batch.size());

            List<Long> ids;
            try {
                ids = batchWriter.writeBatch(new ArrayList<>(batch));
            } catch (DatabaseWriteException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DatabaseWriteException("Batch " + (i + 1) + "/" + batchCount
                        + " failed after " + inserted + " rows were committed: " + e.getMessage(), e);
            }
            inserted += ids.size();

            triggerEmbedding(ids);
        }
        return inserted;
    }

    /**
     * Queue every row of the log that still has no embedding. Covers rows whose trigger
     * was lost and rows the worker left pending after a timeout.
     *
     * @return number of rows queued
     */
    public int requeueEmbeddings(Long logId) {
        if (!logFileRepository.existsById(logId)) {
            throw new IllegalArgumentException("Log not found: " + logId);
        }
        List<Long> ids = measurementRepository.findUnembeddedIds(logId);
        if (ids.isEmpty()) {
            log.info("Log {} has no rows waiting for an embedding", logId);
            return 0;
        }
        int messages = embeddingTrigger.publish(ids);
        log.info("Re-queued {} rows of log {} for embedding in {} message(s)", ids.size(), logId, messages);
        return ids.size();
    }

    List<Measurement> toDrafts(List<MeasurementSection> sections, Long logId) {
        List<Measurement> drafts = new ArrayList<>(sections.size());
        for (MeasurementSection section : sections) {
            try {
                drafts.add(toDraft(section, logId));
            } catch (EmptyVectorException e) {
                log.warn("   Section '{}' dropped: {}", section.sensorName(), e.getMessage());
            }
        }
        return drafts;
    }

    Measurement toDraft(MeasurementSection section, Long logId) {
        double[] readings = section.readingsArray();

        Measurement measurement = new Measurement();
        measurement.setLogId(logId);
        measurement.setName(displayName(section));
        measurement.setSensorName(section.sensorName());
        measurement.setDescription(section.description());
        measurement.setUnits(section.units());
        measurement.setMinValue(section.min());
        measurement.setMaxValue(section.max());
        measurement.setAvgValue(section.avg());
        measurement.setTotalMeasurements(section.totalMeasurements());
        measurement.setSensorReadings(readings);
        measurement.setReadingsVector(PgVectors.toLiteral(readingsVectorNormalizer.normalize(readings)));
        measurement.setSource(section.source());
        measurement.setTstId(section.tstId());
        measurement.setUutType(section.uutType());
        measurement.setStatus(section.status());
        measurement.setSerialNumber(section.serialNumber());
        measurement.setCategory(section.category());
        measurement.setSubCategory(section.subCategory());
        measurement.setEmbeddingText(embeddingText(section));
        measurement.setEmbeddingStatus(EmbeddingStatus.PENDING);
        return measurement;
    }

    static String displayName(MeasurementSection section) {
        if (section.tstId() == null || section.tstId().isBlank()) {
            return section.sensorName();
        }
        return section.sensorName() + " @ " + section.tstId();
    }

    /**
     * Natural-language summary the embedding model reads.
     */
    static String embeddingText(MeasurementSection section) {
        return String.format(
                "Sensor %s measuring %s with values ranging from %s to %s %s. "
                        + "Category: %s, Sub-category: %s. Source: %s, Status: %s",
                section.sensorName(), section.description(),
                plain(section.min()), plain(section.max()), section.units(),
                section.category(), section.subCategory(),
                section.source(), section.status());
    }

    private void triggerEmbedding(List<Long> ids) {
        try {
            embeddingTrigger.publish(ids);
        } catch (RuntimeException e) {
            // Rows are committed and stay pending; POST /logs/{id}/embeddings re-queues them
            log.error("   Could not queue {} rows for embedding: {}", ids.size(), e.getMessage(), e);
        }
    }

    // 2.0 → "2", 2.50 → "2.5"
    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
