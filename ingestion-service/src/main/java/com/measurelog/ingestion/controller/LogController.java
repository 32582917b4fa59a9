package com.measurelog.ingestion.controller;

import com.measurelog.common.dto.ApiResponse;
import com.measurelog.common.entity.LogFile;
import com.measurelog.common.entity.Measurement;
import com.measurelog.common.message.StorageUploadEvent;
import com.measurelog.ingestion.service.IngestionCoordinator;
import com.measurelog.ingestion.service.LogIntakeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/logs")
public class LogController {

    @Autowired
    private LogIntakeService intakeService;

    @Autowired
    private IngestionCoordinator coordinator;

    /**
     * Upload notification pushed over HTTP instead of the storage.upload queue.
     */
    @PostMapping("/events")
    public ResponseEntity<ApiResponse<Map<String, Object>>> receiveUploadEvent(
            @RequestBody StorageUploadEvent event) {

        Optional<LogFile> registered = intakeService.registerUpload(event);
        if (registered.isEmpty()) {
            return ResponseEntity.ok(ApiResponse.success(
                    Map.of("bucket", String.valueOf(event.bucket())), "Event ignored: not a log upload"));
        }

        LogFile logFile = registered.get();
        Map<String, Object> data = Map.of(
                "logId", logFile.getId(),
                "name", logFile.getName(),
                "status", logFile.getIngestionStatus().name()
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(data, "Log registered and queued for ingestion"));
    }

    /**
     * Re-run ingestion for a log, e.g. after a failure.
     */
    @PostMapping("/{logId}/ingestion")
    public ResponseEntity<ApiResponse<Map<String, Object>>> requestIngestion(
            @PathVariable(name = "logId") Long logId) {

        LogFile logFile = intakeService.getLog(logId);
        intakeService.queueForIngestion(logFile);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(Map.of("logId", logId), "Log queued for ingestion"));
    }

    @GetMapping("/{logId}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getLog(
            @PathVariable(name = "logId") Long logId) {

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("log", intakeService.getLog(logId));
        data.put("embeddings", intakeService.getEmbeddingProgress(logId));

        return ResponseEntity.ok(ApiResponse.success(data, "Log retrieved successfully"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> getOwnerLogs(
            @RequestParam("owner") String owner) {

        List<LogFile> logs = intakeService.getOwnerLogs(owner);
        Map<String, Object> data = Map.of(
                "logs", logs,
                "totalCount", logs.size()
        );

        return ResponseEntity.ok(ApiResponse.success(data, "Logs retrieved successfully"));
    }

    @GetMapping("/{logId}/measurements")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getMeasurements(
            @PathVariable(name = "logId") Long logId) {

        List<Measurement> measurements = intakeService.getMeasurements(logId);
        Map<String, Object> data = Map.of(
                "measurements", measurements,
                "totalCount", measurements.size()
        );

        return ResponseEntity.ok(ApiResponse.success(data, "Measurements retrieved successfully"));
    }

    /**
     * Re-queue the log's rows that still have no embedding.
     */
    @PostMapping("/{logId}/embeddings")
    public ResponseEntity<ApiResponse<Map<String, Object>>> requeueEmbeddings(
            @PathVariable(name = "logId") Long logId) {

        int queued = coordinator.requeueEmbeddings(logId);
        log.info("Embedding re-trigger for log {}: {} rows", logId, queued);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(Map.of("logId", logId, "queued", queued),
                        queued == 0 ? "No rows waiting for an embedding" : "Rows queued for embedding"));
    }
}
