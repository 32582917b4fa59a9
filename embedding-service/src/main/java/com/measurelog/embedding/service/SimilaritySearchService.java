package com.measurelog.embedding.service;

import com.measurelog.common.exception.ModelCallException;
import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.embedding.dto.MeasurementMatch;
import com.measurelog.embedding.repository.MeasurementMatchRepository;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingOptions;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only ranking of stored measurements against a query vector.
 *
 * Inner product stands in for cosine similarity because both stored and query vectors are
 * unit length. Only rows with similarity strictly above the threshold come back, most
 * similar first, with no limit; callers paginate.
 */
@Slf4j
@Service
public class SimilaritySearchService {

    @Autowired
    private MeasurementMatchRepository matchRepository;

    @Autowired
    private EmbeddingStrategy embeddingStrategy;

    @Autowired
    @Qualifier("embeddingVectorNormalizer")
    private VectorNormalizer embeddingVectorNormalizer;

    /**
     * @throws IllegalArgumentException when the query is not as wide as the stored embeddings
     */
    public List<MeasurementMatch> search(float[] queryEmbedding, double threshold) {
        int dimensions = embeddingVectorNormalizer.getTargetDimensions();
        if (queryEmbedding == null || queryEmbedding.length != dimensions) {
            throw new IllegalArgumentException("Query embedding must have " + dimensions + " dimensions, got "
                    + (queryEmbedding == null ? 0 : queryEmbedding.length));
        }

        // The index scan is approximate; filter and order exactly here
        List<MeasurementMatch> matches = matchRepository.findMatches(queryEmbedding, threshold).stream()
                .filter(match -> match.similarity() > threshold)
                .sorted(Comparator.comparingDouble(MeasurementMatch::similarity).reversed())
                .toList();

        log.info("Similarity search (threshold {}): {} matches", threshold, matches.size());
        return matches;
    }

    /**
     * Embeds {@code query} with the same model and options as the stored rows, then searches.
     *
     * @throws ModelCallException when the query cannot be embedded
     */
    public List<MeasurementMatch> searchText(String query, double threshold) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        log.info("Text search: {}", query);

        EmbeddingResult result = embeddingStrategy.generateEmbedding(query, EmbeddingOptions.meanPoolNormalized());
        if (!result.isSuccessful()) {
            throw new ModelCallException("Could not embed search query: " + result.getErrorMessage());
        }

        float[] raw = result.getEmbedding();
        float[] sized = embeddingVectorNormalizer.normalize(raw);
        return search(sized == raw ? sized : VectorNormalizer.toUnitLength(sized), threshold);
    }
}
