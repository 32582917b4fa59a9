package com.measurelog.ingestion.listener;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.exception.MeasureLogException;
import com.measurelog.common.message.LogIngestionMessage;
import com.measurelog.ingestion.service.IngestionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs ingestion for queued logs. Failures are recorded on the log row by the coordinator,
 * then the message goes to the dead-letter queue instead of being redelivered.
 */
@Slf4j
@Component
public class LogIngestionListener {

    @Autowired
    private IngestionCoordinator coordinator;

    @RabbitListener(queues = RabbitMQConfig.LOG_INGESTION_QUEUE)
    public void onLogQueued(LogIngestionMessage message) {
        try {
            coordinator.ingestLog(message.logId());
        } catch (MeasureLogException | IllegalArgumentException e) {
            throw new AmqpRejectAndDontRequeueException("Ingestion of log " + message.logId() + " failed", e);
        }
    }
}
