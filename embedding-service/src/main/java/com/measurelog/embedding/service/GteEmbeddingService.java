package com.measurelog.embedding.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * GTE sentence-embedding model served over HTTP (gte-small: 384 dimensions).
 *
 * No @Service annotation; instantiated by {@code EmbeddingProviderFactory}.
 * Request: {@code {"model", "input", "mean_pool", "normalize"}}. Both the plain
 * {@code {"embedding": [...]}} response and the OpenAI-style
 * {@code {"data": [{"embedding": [...]}]}} response are accepted.
 */
@Slf4j
public class GteEmbeddingService implements EmbeddingStrategy {

    private static final int GTE_SMALL_DIMENSIONS = 384;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;

    public GteEmbeddingService(String apiKey, String baseUrl, String model, Duration requestTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(5 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "GTE Embeddings (" + model + ")";
    }

    @Override
    public int getDimensions() {
        return GTE_SMALL_DIMENSIONS;
    }

    @Override
    public EmbeddingResult generateEmbedding(String text, EmbeddingOptions options) {
        if (text == null || text.isBlank()) {
            return EmbeddingResult.failed("No text to embed");
        }

        try {
            log.debug("[{}] Embedding: {}", getProviderName(),
                    text.length() > 100 ? text.substring(0, 100) + "..." : text);

            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "input", text,
                    "mean_pool", options.meanPool(),
                    "normalize", options.normalize());

            WebClient.RequestBodySpec request = webClient
                    .post()
                    .uri(baseUrl + "/embeddings")
                    .header("Content-Type", "application/json");
            if (apiKey != null && !apiKey.isBlank()) {
                request = request.header("Authorization", "Bearer " + apiKey);
            }

            String response = request
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(requestTimeout);

            return parseEmbeddingResponse(response);

        } catch (WebClientResponseException e) {
            log.error("[{}] Model call failed with HTTP {}: {}", getProviderName(),
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            return EmbeddingResult.failed("Model call failed with HTTP " + e.getStatusCode().value());
        } catch (RuntimeException e) {
            log.error("[{}] Failed to generate embedding: {}", getProviderName(), e.getMessage(), e);
            return EmbeddingResult.failed("Embedding generation failed: " + e.getMessage());
        }
    }

    EmbeddingResult parseEmbeddingResponse(String response) {
        if (response == null || response.isBlank()) {
            return EmbeddingResult.failed("Empty response from embedding model");
        }
        try {
            JsonNode root = objectMapper.readTree(response);

            JsonNode values = root.path("embedding");
            if (values.isMissingNode() && root.path("data").isArray() && !root.path("data").isEmpty()) {
                values = root.path("data").get(0).path("embedding");
            }
            if (!values.isArray() || values.isEmpty()) {
                return EmbeddingResult.failed("No embedding values found");
            }

            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = (float) values.get(i).asDouble();
            }

            log.debug("[{}] Embedding generated: {} dimensions", getProviderName(), vector.length);
            return EmbeddingResult.success(vector);

        } catch (Exception e) {
            log.error("Failed to parse embedding response: {}", e.getMessage(), e);
            return EmbeddingResult.failed("Parse error: " + e.getMessage());
        }
    }
}
