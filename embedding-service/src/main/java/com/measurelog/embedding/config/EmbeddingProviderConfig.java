package com.measurelog.embedding.config;

import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Reads {@code llm.embedding.provider} and builds the matching {@link EmbeddingStrategy}
 * through {@link EmbeddingProviderFactory}. Switching provider = change one config value,
 * restart, re-embed.
 */
@Slf4j
@Configuration
public class EmbeddingProviderConfig {

    @Value("${llm.embedding.provider:gte}")
    private String embeddingProvider;

    // ═══════════════════════════════════════════════════════
    // GTE Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${gte.embeddings.api-key:}")
    private String gteApiKey;

    @Value("${gte.embeddings.base-url:http://localhost:8080/v1}")
    private String gteBaseUrl;

    @Value("${gte.embeddings.model:gte-small}")
    private String gteModel;

    @Value("${gte.embeddings.request-timeout-ms:30000}")
    private long gteRequestTimeoutMs;

    // Width of the stored embedding column
    @Value("${measurelog.embedding.dimensions:384}")
    private int embeddingDimensions;

    @Bean
    public EmbeddingStrategy embeddingStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING EMBEDDING PROVIDER");
        log.info("   Selected provider: {}", embeddingProvider);

        String apiKey;
        String baseUrl;
        String model;
        Duration requestTimeout;

        switch (embeddingProvider.toLowerCase()) {
            case "gte" -> {
                apiKey = gteApiKey;
                baseUrl = gteBaseUrl;
                model = gteModel;
                requestTimeout = Duration.ofMillis(gteRequestTimeoutMs);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown embedding provider: " + embeddingProvider);
        }

        EmbeddingStrategy strategy = EmbeddingProviderFactory.createEmbeddingGenerator(
                embeddingProvider, apiKey, baseUrl, model, requestTimeout);

        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("   Dimensions: {} (stored as {})", strategy.getDimensions(), embeddingDimensions);
        if (strategy.getDimensions() != embeddingDimensions) {
            log.warn("   Provider dimension differs from the embedding column; vectors will be padded/truncated");
        }
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");

        return strategy;
    }

    /**
     * Coerces model output to the stored embedding width.
     */
    @Bean
    public VectorNormalizer embeddingVectorNormalizer() {
        return new VectorNormalizer(embeddingDimensions);
    }
}
