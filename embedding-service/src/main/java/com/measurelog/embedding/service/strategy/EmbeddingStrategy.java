package com.measurelog.embedding.service.strategy;

/**
 * Strategy interface for embedding generation.
 *
 * The configured provider is chosen by {@code llm.embedding.provider}. Changing provider
 * usually changes the raw dimension; stored vectors are always coerced to
 * {@code measurelog.embedding.dimensions}, but old and new vectors are not comparable, so
 * a provider switch means re-embedding every row.
 */
public interface EmbeddingStrategy {

    /**
     * Convert text to an embedding vector using the configured provider.
     * Never throws; failures come back as {@link EmbeddingResult#failed(String)}.
     */
    EmbeddingResult generateEmbedding(String text, EmbeddingOptions options);

    String getProviderName();

    /**
     * Raw dimension of the provider's vectors, before any coercion.
     */
    int getDimensions();

    /**
     * Pooling and normalization flags passed through to the model.
     */
    record EmbeddingOptions(boolean meanPool, boolean normalize) {

        public static EmbeddingOptions meanPoolNormalized() {
            return new EmbeddingOptions(true, true);
        }
    }

    /**
     * Result of embedding generation, success or failure.
     */
    class EmbeddingResult {
        private final float[] embedding;
        private final String errorMessage;
        private final boolean successful;

        private EmbeddingResult(float[] embedding, String errorMessage, boolean successful) {
            this.embedding = embedding;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static EmbeddingResult success(float[] embedding) {
            return new EmbeddingResult(embedding, null, true);
        }

        public static EmbeddingResult failed(String errorMessage) {
            return new EmbeddingResult(null, errorMessage, false);
        }

        public float[] getEmbedding() {
            return embedding;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public int getDimensions() {
            return embedding != null ? embedding.length : 0;
        }
    }
}
