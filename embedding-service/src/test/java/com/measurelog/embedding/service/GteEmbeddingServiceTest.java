package com.measurelog.embedding.service;

import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingOptions;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GteEmbeddingServiceTest {

    private final GteEmbeddingService service =
            new GteEmbeddingService("", "http://localhost:1/v1", "gte-small", Duration.ofSeconds(1));

    @Test
    @DisplayName("Should read a plain embedding response")
    void parseEmbeddingResponse_shouldReadPlainShape() {
        EmbeddingResult result = service.parseEmbeddingResponse("{\"embedding\": [0.5, -0.25]}");

        assertTrue(result.isSuccessful());
        assertArrayEquals(new float[]{0.5f, -0.25f}, result.getEmbedding());
    }

    @Test
    @DisplayName("Should read an OpenAI-style data array response")
    void parseEmbeddingResponse_shouldReadDataShape() {
        EmbeddingResult result = service.parseEmbeddingResponse("{\"data\": [{\"embedding\": [1, 0]}]}");

        assertTrue(result.isSuccessful());
        assertEquals(2, result.getDimensions());
    }

    @Test
    @DisplayName("Should fail on responses without values")
    void parseEmbeddingResponse_shouldFailWithoutValues() {
        assertFalse(service.parseEmbeddingResponse("{\"embedding\": []}").isSuccessful());
        assertFalse(service.parseEmbeddingResponse("{}").isSuccessful());
        assertFalse(service.parseEmbeddingResponse("not json").isSuccessful());
        assertFalse(service.parseEmbeddingResponse("").isSuccessful());
    }

    @Test
    @DisplayName("Should fail blank text without calling the model")
    void generateEmbedding_shouldFailBlankText() {
        EmbeddingResult result = service.generateEmbedding("  ", EmbeddingOptions.meanPoolNormalized());

        assertFalse(result.isSuccessful());
        assertEquals("No text to embed", result.getErrorMessage());
    }
}
