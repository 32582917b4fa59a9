package com.measurelog.embedding.listener;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.message.EmbeddingBatchMessage;
import com.measurelog.embedding.worker.EmbeddingWorker;
import com.measurelog.embedding.worker.RowOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
public class EmbeddingBatchListener {

    @Autowired
    private EmbeddingWorker worker;

    @RabbitListener(queues = RabbitMQConfig.MEASUREMENT_EMBEDDING_QUEUE)
    public void onEmbeddingBatch(EmbeddingBatchMessage message) {
        log.info("\nEMBEDDING BATCH");
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("Rows requested: {}", message.ids().size());

        List<RowOutcome> outcomes;
        try {
            outcomes = worker.embedBatch(message);
        } catch (IllegalArgumentException e) {
            log.error("Rejecting embedding message: {}", e.getMessage());
            throw new AmqpRejectAndDontRequeueException(e.getMessage(), e);
        }

        Map<RowOutcome.Result, Long> summary = outcomes.stream()
                .collect(Collectors.groupingBy(RowOutcome::result, Collectors.counting()));
        log.info("EMBEDDING BATCH DONE: completed={}, failed={}, skipped={}",
                summary.getOrDefault(RowOutcome.Result.COMPLETED, 0L),
                summary.getOrDefault(RowOutcome.Result.FAILED, 0L),
                summary.getOrDefault(RowOutcome.Result.SKIPPED, 0L));
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━\n");
    }
}
