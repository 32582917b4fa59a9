package com.measurelog.embedding.service;

import com.measurelog.common.exception.ModelCallException;
import com.measurelog.common.vector.VectorNormalizer;
import com.measurelog.embedding.dto.MeasurementMatch;
import com.measurelog.embedding.repository.MeasurementMatchRepository;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy;
import com.measurelog.embedding.service.strategy.EmbeddingStrategy.EmbeddingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SimilaritySearchService: strict threshold, ordering and query validation.
 */
@ExtendWith(MockitoExtension.class)
class SimilaritySearchServiceTest {

    @Mock
    private MeasurementMatchRepository matchRepository;

    @Mock
    private EmbeddingStrategy embeddingStrategy;

    @InjectMocks
    private SimilaritySearchService searchService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(searchService, "embeddingVectorNormalizer", new VectorNormalizer(384));
    }

    private static MeasurementMatch match(long id, double similarity) {
        return new MeasurementMatch(id, 1L, "S" + id + " @ T", "S" + id, "d", "Watts",
                0, 1, 0.5, "PSU", "T", "unknown", "unknown", "unknown", "power", "OTHER", similarity);
    }

    private static float[] query() {
        float[] query = new float[384];
        query[0] = 1f;
        return query;
    }

    @Test
    @DisplayName("Should exclude a row whose similarity equals the threshold exactly")
    void search_shouldApplyStrictThreshold() {
        when(matchRepository.findMatches(any(), eq(0.5))).thenReturn(List.of(match(1, 0.9), match(2, 0.5)));

        List<MeasurementMatch> results = searchService.search(query(), 0.5);

        assertEquals(List.of(1L), results.stream().map(MeasurementMatch::id).toList());
    }

    @Test
    @DisplayName("Should return results in strictly decreasing similarity")
    void search_shouldOrderMostSimilarFirst() {
        when(matchRepository.findMatches(any(), eq(0.1)))
                .thenReturn(List.of(match(1, 0.6), match(2, 0.95), match(3, 0.7)));

        List<MeasurementMatch> results = searchService.search(query(), 0.1);

        assertEquals(List.of(2L, 3L, 1L), results.stream().map(MeasurementMatch::id).toList());
    }

    @Test
    @DisplayName("Should reject a query vector of the wrong width")
    void search_shouldRejectWrongDimension() {
        assertThrows(IllegalArgumentException.class, () -> searchService.search(new float[16], 0.5));
        verifyNoInteractions(matchRepository);
    }

    @Test
    @DisplayName("Should embed query text before searching")
    void searchText_shouldEmbedQuery() {
        float[] embedded = query();
        when(embeddingStrategy.generateEmbedding(eq("12V rail"), any())).thenReturn(EmbeddingResult.success(embedded));
        when(matchRepository.findMatches(embedded, 0.3)).thenReturn(List.of(match(4, 0.8)));

        List<MeasurementMatch> results = searchService.searchText("12V rail", 0.3);

        assertEquals(1, results.size());
    }

    @Test
    @DisplayName("Should surface a model failure for query text")
    void searchText_shouldFailWhenModelFails() {
        when(embeddingStrategy.generateEmbedding(anyString(), any())).thenReturn(EmbeddingResult.failed("timeout"));

        assertThrows(ModelCallException.class, () -> searchService.searchText("12V rail", 0.3));
    }
}
