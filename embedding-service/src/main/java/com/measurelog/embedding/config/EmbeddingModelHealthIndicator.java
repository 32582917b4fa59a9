package com.measurelog.embedding.config;

import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingOptions;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator HealthIndicator for the embedding model: embeds a fixed sample text.
 * Included in GET /actuator/health.
 */
@Slf4j
@Component
public class EmbeddingModelHealthIndicator implements HealthIndicator {

    private static final String PROBE_TEXT = "health check";

    @Autowired
    private EmbeddingStrategy embeddingStrategy;

    @Override
    public Health health() {
        EmbeddingResult result = embeddingStrategy.generateEmbedding(PROBE_TEXT, EmbeddingOptions.meanPoolNormalized());
        if (result.isSuccessful()) {
            return Health.up()
                    .withDetail("provider", embeddingStrategy.getProviderName())
                    .withDetail("dimensions", result.getDimensions())
                    .build();
        }
        log.error("Embedding model health check failed: {}", result.getErrorMessage());
        return Health.down()
                .withDetail("provider", embeddingStrategy.getProviderName())
                .withDetail("error", result.getErrorMessage())
                .build();
    }
}
