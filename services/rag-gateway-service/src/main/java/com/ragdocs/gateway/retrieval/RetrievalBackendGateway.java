package com.ragdocs.gateway.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragdocs.gateway.retrieval.dto.BackendGenerateResponse;
import com.ragdocs.gateway.retrieval.dto.BackendQueryRequest;
import com.ragdocs.gateway.retrieval.dto.BackendSearchResponse;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the external retrieval backend that owns vector search and answer generation.
 */
@Component
public class RetrievalBackendGateway {
    private static final Logger log = LoggerFactory.getLogger(RetrievalBackendGateway.class);

    private final RestTemplate restTemplate;
    private final RestTemplate healthRestTemplate;
    private final RetrievalBackendProperties properties;
    private final ObjectMapper objectMapper;

    public RetrievalBackendGateway(
        @Qualifier("retrievalRestTemplate") RestTemplate restTemplate,
        @Qualifier("retrievalHealthRestTemplate") RestTemplate healthRestTemplate,
        RetrievalBackendProperties properties,
        ObjectMapper objectMapper
    ) {
        this.restTemplate = restTemplate;
        this.healthRestTemplate = healthRestTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public BackendSearchResponse search(String query, String userId, int topK) {
        log.info("retrieval_search query=\"{}\" top_k={}", abbreviate(query), topK);
        BackendSearchResponse body = post("/api/v1/search", new BackendQueryRequest(query, userId, topK), BackendSearchResponse.class);
        if (body.getResults() == null) {
            body.setResults(List.of());
        }
        log.info("retrieval_search_completed results={}", body.getResults().size());
        return body;
    }

    public BackendGenerateResponse generate(String query, String userId, int topK) {
        log.info("retrieval_generate query=\"{}\" top_k={}", abbreviate(query), topK);
        BackendGenerateResponse body = post("/api/v1/query", new BackendQueryRequest(query, userId, topK), BackendGenerateResponse.class);
        if (body.getSources() == null) {
            body.setSources(List.of());
        }
        log.info("retrieval_generate_completed sources={}", body.getSources().size());
        return body;
    }

    public boolean health() {
        try {
            ResponseEntity<String> response = healthRestTemplate.getForEntity(buildUrl("/health"), String.class);
            return response.getStatusCode().value() == 200;
        } catch (RestClientException e) {
            log.warn("retrieval_health_failed reason={}", e.getMessage());
            return false;
        }
    }

    private <T> T post(String path, BackendQueryRequest request, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<BackendQueryRequest> entity = new HttpEntity<>(request, headers);

        try {
            ResponseEntity<T> response = restTemplate.exchange(buildUrl(path), HttpMethod.POST, entity, responseType);
            T body = response.getBody();
            if (body == null) {
                throw new RetrievalBackendException(response.getStatusCode().value(), "empty response body", null);
            }
            return body;
        } catch (ResourceAccessException e) {
            String reason = e.getCause() instanceof SocketTimeoutException
                ? "Retrieval service timed out"
                : "Retrieval service is unavailable";
            log.warn("retrieval_call_failed path={} reason=\"{}\"", path, e.getMessage());
            throw new RetrievalUnavailableException(reason, e);
        } catch (HttpStatusCodeException e) {
            String detail = extractDetail(e.getResponseBodyAsString());
            log.warn("retrieval_call_failed path={} status={} detail=\"{}\"", path, e.getStatusCode().value(), detail);
            throw new RetrievalBackendException(e.getStatusCode().value(), detail, e);
        }
    }

    private String extractDetail(String body) {
        if (body == null || body.isBlank()) {
            return "Unknown error";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            String detail = node.path("detail").asText(null);
            return detail == null || detail.isBlank() ? "Unknown error" : detail;
        } catch (JsonProcessingException e) {
            return "Unknown error";
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    static String abbreviate(String query) {
        if (query == null) {
            return "";
        }
        return query.length() <= 50 ? query : query.substring(0, 50) + "...";
    }
}
