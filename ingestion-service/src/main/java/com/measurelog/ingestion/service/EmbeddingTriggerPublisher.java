package com.measurelog.ingestion.service;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.message.EmbeddingBatchMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hands freshly committed measurement ids to the embedding service, one message per
 * {@code measurelog.embedding.trigger.batch-size} ids.
 */
@Slf4j
@Service
public class EmbeddingTriggerPublisher {

    @Autowired
    private RabbitTemplate rabbitTemplate;

    @Value("${measurelog.embedding.trigger.batch-size:50}")
    private int batchSize;

    @Value("${measurelog.embedding.trigger.timeout-ms:300000}")
    private long timeoutMillis;

    @Value("${measurelog.embedding.trigger.table:measurements}")
    private String table;

    @Value("${measurelog.embedding.trigger.content-column:embedding_text}")
    private String contentColumn;

    @Value("${measurelog.embedding.trigger.embedding-column:embedding}")
    private String embeddingColumn;

    /**
     * @return number of embedding messages sent
     */
    public int publish(List<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }

        int batchCount = (ids.size() + batchSize - 1) / batchSize;
        for (int i = 0; i < batchCount; i++) {
            List<Long> slice = List.copyOf(ids.subList(i * batchSize, Math.min(ids.size(), (i + 1) * batchSize)));
            rabbitTemplate.convertAndSend(
                    RabbitMQConfig.MEASURELOG_EXCHANGE,
                    RabbitMQConfig.MEASUREMENT_EMBED_KEY,
                    new EmbeddingBatchMessage(slice, table, contentColumn, embeddingColumn, timeoutMillis));
        }

        log.info("   Queued {} rows for embedding in {} message(s)", ids.size(), batchCount);
        return batchCount;
    }
}
