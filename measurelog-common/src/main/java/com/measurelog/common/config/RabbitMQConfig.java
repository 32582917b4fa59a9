package com.measurelog.common.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology for the three pipeline hops:
 * storage upload → log ingestion → measurement embedding.
 */
@Configuration
@EnableRabbit
public class RabbitMQConfig {

    // Queue names
    public static final String STORAGE_UPLOAD_QUEUE = "storage.upload";
    public static final String LOG_INGESTION_QUEUE = "log.ingestion";
    public static final String MEASUREMENT_EMBEDDING_QUEUE = "measurement.embedding";

    // Exchange names
    public static final String MEASURELOG_EXCHANGE = "measurelog.exchange";
    public static final String DEAD_LETTER_EXCHANGE = "measurelog.dlx";

    // Routing keys
    public static final String STORAGE_UPLOAD_KEY = "storage.upload";
    public static final String LOG_INGEST_KEY = "log.ingest";
    public static final String MEASUREMENT_EMBED_KEY = "measurement.embed";

    @Bean
    public DirectExchange measureLogExchange() {
        return new DirectExchange(MEASURELOG_EXCHANGE, true, false);
    }

    @Bean
    public FanoutExchange deadLetterExchange() {
        return new FanoutExchange(DEAD_LETTER_EXCHANGE, true, false);
    }

    @Bean
    public Queue deadLetterQueue() {
        return QueueBuilder.durable("measurelog.dead-letter").build();
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange());
    }

    @Bean
    public Queue storageUploadQueue() {
        return durableWithDeadLetter(STORAGE_UPLOAD_QUEUE);
    }

    @Bean
    public Queue logIngestionQueue() {
        return durableWithDeadLetter(LOG_INGESTION_QUEUE);
    }

    @Bean
    public Queue measurementEmbeddingQueue() {
        return durableWithDeadLetter(MEASUREMENT_EMBEDDING_QUEUE);
    }

    @Bean
    public Binding storageUploadBinding() {
        return BindingBuilder.bind(storageUploadQueue()).to(measureLogExchange()).with(STORAGE_UPLOAD_KEY);
    }

    @Bean
    public Binding logIngestionBinding() {
        return BindingBuilder.bind(logIngestionQueue()).to(measureLogExchange()).with(LOG_INGEST_KEY);
    }

    @Bean
    public Binding measurementEmbeddingBinding() {
        return BindingBuilder.bind(measurementEmbeddingQueue()).to(measureLogExchange()).with(MEASUREMENT_EMBED_KEY);
    }

    /**
     * JSON message converter
     */
    @Bean
    public Jackson2JsonMessageConverter messageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    /**
     * RabbitTemplate with JSON converter
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter());
        return template;
    }

    private static Queue durableWithDeadLetter(String name) {
        return QueueBuilder.durable(name)
                .withArgument("x-dead-letter-exchange", DEAD_LETTER_EXCHANGE)
                .build();
    }
}
