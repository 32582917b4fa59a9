package com.measurelog.embedding.controller;

import com.measurelog.common.dto.ApiResponse;
import com.measurelog.embedding.dto.MeasurementMatch;
import com.measurelog.embedding.service.SimilaritySearchService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/search")
public class SearchController {

    @Autowired
    private SimilaritySearchService searchService;

    public record VectorSearchRequest(@NotNull float[] embedding, @NotNull Double threshold) {
    }

    /**
     * Search with a caller-supplied query embedding.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<List<MeasurementMatch>>> searchByVector(
            @Valid @RequestBody VectorSearchRequest request) {

        List<MeasurementMatch> matches = searchService.search(request.embedding(), request.threshold());
        return ResponseEntity.ok(ApiResponse.success(matches, "Search completed successfully"));
    }

    /**
     * Semantic search: the query text is embedded first.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<MeasurementMatch>>> searchByText(
            @RequestParam("query") String query,
            @RequestParam("threshold") double threshold) {

        log.info("Search request: {} (threshold {})", query, threshold);
        List<MeasurementMatch> matches = searchService.searchText(query, threshold);
        return ResponseEntity.ok(ApiResponse.success(matches, "Search completed successfully"));
    }
}
