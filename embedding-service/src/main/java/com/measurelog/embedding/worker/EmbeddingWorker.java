package com.measurelog.embedding.worker;

import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.exception.MeasureLogException;
import com.measurelog.common.exception.ModelCallException;
import com.measurelog.common.message.EmbeddingBatchMessage;
import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.embedding.repository.EmbeddableRowRepository;
import com.measurelog.embedding.repository.EmbeddableRowRepository.EmbeddableRow;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingOptions;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills the embedding column of the rows an embedding message names.
 *
 * Per row: pending → processing → completed | failed. A row whose embedding is already set is
 * never fetched, so re-delivering the same ids is harmless. One row's failure never stops
 * the others. Once the message's time budget is spent no further model calls are made and
 * the remaining rows stay pending for the next invocation. A message without a budget gets
 * {@code measurelog.embedding.worker.default-timeout-ms}.
 */
@Slf4j
@Service
public class EmbeddingWorker {

    @Autowired
    private EmbeddableRowRepository rowRepository;

    @Autowired
    private EmbeddingStrategy embeddingStrategy;

    @Autowired
    @Qualifier("embeddingVectorNormalizer")
    private VectorNormalizer embeddingVectorNormalizer;

    @Value("${measurelog.embedding.worker.default-timeout-ms:300000}")
    private long defaultTimeoutMillis;

    @Value("${measurelog.embedding.worker.mark-failed-attempts:2}")
    private int markFailedAttempts;

    private Clock clock = Clock.systemUTC();

    /**
     * @return one outcome per fetched row, in id order; ids already embedded are absent
     * @throws IllegalArgumentException when the table or a column name is not a plain identifier
     */
    public List<RowOutcome> embedBatch(EmbeddingBatchMessage request) {
        long budget = budgetMillis(request);
        long deadline = clock.millis() + budget;

        List<EmbeddableRow> rows = rowRepository.findUnembedded(
                request.table(), request.contentColumn(), request.embeddingColumn(), request.ids());

        log.info("Embedding {} of {} requested rows in {} ({} → {}), budget {} ms",
                rows.size(), request.ids().size(), request.table(),
                request.contentColumn(), request.embeddingColumn(), budget);

        List<RowOutcome> outcomes = new ArrayList<>(rows.size());
        for (EmbeddableRow row : rows) {
            if (clock.millis() >= deadline) {
                outcomes.add(RowOutcome.skipped(row.id()));
                continue;
            }
            outcomes.add(embedRow(request, row));
        }
        return outcomes;
    }

    private RowOutcome embedRow(EmbeddingBatchMessage request, EmbeddableRow row) {
        if (row.content() == null || row.content().isBlank()) {
            return fail(request.table(), row.id(), "No content to embed");
        }

        try {
            rowRepository.markStatus(request.table(), row.id(), EmbeddingStatus.PROCESSING);

            EmbeddingResult result = embeddingStrategy.generateEmbedding(
                    row.content(), EmbeddingOptions.meanPoolNormalized());
            if (!result.isSuccessful()) {
                throw new ModelCallException(result.getErrorMessage());
            }

            float[] vector = toStoredWidth(result.getEmbedding());
            rowRepository.writeEmbedding(request.table(), request.embeddingColumn(), row.id(), vector);

            log.debug("   Row {} embedded ({} dims)", row.id(), vector.length);
            return RowOutcome.completed(row.id());

        } catch (MeasureLogException e) {
            return fail(request.table(), row.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("   Row {} hit an unexpected error", row.id(), e);
            return fail(request.table(), row.id(), "Unexpected error: " + e.getMessage());
        }
    }

    private long budgetMillis(EmbeddingBatchMessage request) {
        Long requested = request.timeoutMillis();
        return requested == null || requested <= 0 ? defaultTimeoutMillis : requested;
    }

    // Padding or truncation breaks unit length, so re-normalize when the width changed
    private float[] toStoredWidth(float[] embedding) {
        float[] sized = embeddingVectorNormalizer.normalize(embedding);
        return sized == embedding ? sized : VectorNormalizer.toUnitLength(sized);
    }

    // Rows must not stay in processing
    private RowOutcome fail(String table, Long id, String reason) {
        log.warn("   Row {} failed: {}", id, reason);
        int attempts = Math.max(1, markFailedAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                rowRepository.markStatus(table, id, EmbeddingStatus.FAILED);
                break;
            } catch (MeasureLogException e) {
                if (attempt == attempts) {
                    log.error("   Row {} could not be marked failed after {} attempt(s): {}",
                            id, attempts, e.getMessage(), e);
                } else {
                    log.warn("   Row {} failed mark attempt {} did not stick: {}", id, attempt, e.getMessage());
                }
            }
        }
        return RowOutcome.failed(id, reason);
    }
}
