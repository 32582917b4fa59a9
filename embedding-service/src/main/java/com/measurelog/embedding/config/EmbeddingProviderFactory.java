package com.measurelog.embedding.config;

import com.measurelog.embedding.service.GteEmbeddingService;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Factory for embedding provider instances: provider name + config in, strategy out.
 */
@Slf4j
public class EmbeddingProviderFactory {

    /**
     * Create an EmbeddingStrategy based on provider name
     *
     * @param provider       Provider name: "gte"
     * @param apiKey         API key for the provider (may be empty for a local model server)
     * @param baseUrl        Base URL for the provider's API
     * @param model          Model name to use
     * @param requestTimeout Upper bound for a single model call
     * @return Configured EmbeddingStrategy implementation
     * @throws IllegalArgumentException if provider is not supported
     */
    public static EmbeddingStrategy createEmbeddingGenerator(
            String provider, String apiKey, String baseUrl, String model, Duration requestTimeout) {

        return switch (provider.toLowerCase()) {
            case "gte" -> {
                log.info("Factory: Creating GTE embedding strategy");
                log.info("   Model: {}", model);
                yield new GteEmbeddingService(apiKey, baseUrl, model, requestTimeout);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported embedding provider: '" + provider + "'. " +
                            "Supported providers: gte. " +
                            "Set 'llm.embedding.provider' in application.yml.");
        };
    }
}
