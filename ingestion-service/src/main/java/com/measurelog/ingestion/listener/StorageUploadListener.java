package com.measurelog.ingestion.listener;

import com.measurelog.common.config.RabbitMQConfig;
import com.measurelog.common.message.StorageUploadEvent;
import com.measurelog.ingestion.service.LogIntakeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StorageUploadListener {

    @Autowired
    private LogIntakeService intakeService;

    @RabbitListener(queues = RabbitMQConfig.STORAGE_UPLOAD_QUEUE)
    public void onUpload(StorageUploadEvent event) {
        log.info("Storage upload received: {}/{}", event.bucket(), event.name());
        try {
            intakeService.registerUpload(event);
        } catch (IllegalArgumentException e) {
            log.error("Rejecting malformed upload event {}: {}", event, e.getMessage());
            throw new AmqpRejectAndDontRequeueException(e.getMessage(), e);
        }
    }
}
