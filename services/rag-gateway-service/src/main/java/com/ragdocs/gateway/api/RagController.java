package com.ragdocs.gateway.api;

import com.ragdocs.gateway.api.dto.HealthResponse;
import com.ragdocs.gateway.api.dto.LlmQueryResponse;
import com.ragdocs.gateway.api.dto.QueryRequest;
import com.ragdocs.gateway.api.dto.SearchResponse;
import com.ragdocs.gateway.service.BackendHealthService;
import com.ragdocs.gateway.service.RagQueryService;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RagController {
    static final int DEFAULT_TOP_K = 5;
    static final int MIN_TOP_K = 1;
    static final int MAX_TOP_K = 20;
    static final int MIN_QUERY_LENGTH = 3;
    static final int MAX_QUERY_LENGTH = 1000;

    private final RagQueryService queryService;
    private final BackendHealthService healthService;

    public RagController(RagQueryService queryService, BackendHealthService healthService) {
        this.queryService = queryService;
        this.healthService = healthService;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthService.health();
    }

    @GetMapping("/health/detailed")
    public ResponseEntity<HealthResponse> detailedHealth() {
        HealthResponse response = healthService.detailedHealth();
        HttpStatus status = BackendHealthService.isHealthy(response) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/api/v1/query")
    public SearchResponse search(@RequestBody(required = false) QueryRequest request) {
        String query = validQuery(request);
        return queryService.processSearch(query, request.getUserId(), validTopK(request));
    }

    @PostMapping("/api/v1/query-llm")
    public LlmQueryResponse queryWithLlm(@RequestBody(required = false) QueryRequest request) {
        String query = validQuery(request);
        return queryService.processLlmQuery(query, request.getUserId(), validTopK(request));
    }

    @DeleteMapping("/api/v1/cache/documents/{documentId}")
    public Map<String, Object> invalidateDocument(@PathVariable("documentId") String documentId) {
        int removed = queryService.invalidateDocument(documentId);
        return Map.of("document_id", documentId, "invalidated", removed > 0, "removed_entries", removed);
    }

    private String validQuery(QueryRequest request) {
        if (request == null) {
            throw new InvalidQueryException("request body is required");
        }
        String query = request.getQuery();
        if (query == null || query.trim().isEmpty()) {
            throw new InvalidQueryException("Query is required and must be a non-empty string");
        }
        String trimmed = query.trim();
        if (trimmed.length() < MIN_QUERY_LENGTH) {
            throw new InvalidQueryException("Query must be at least " + MIN_QUERY_LENGTH + " characters long");
        }
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new InvalidQueryException("Query must be less than " + MAX_QUERY_LENGTH + " characters");
        }
        return trimmed;
    }

    private int validTopK(QueryRequest request) {
        Integer topK = request.getTopK();
        if (topK == null) {
            return DEFAULT_TOP_K;
        }
        if (topK < MIN_TOP_K || topK > MAX_TOP_K) {
            throw new InvalidQueryException("top_k must be between " + MIN_TOP_K + " and " + MAX_TOP_K);
        }
        return topK;
    }
}
