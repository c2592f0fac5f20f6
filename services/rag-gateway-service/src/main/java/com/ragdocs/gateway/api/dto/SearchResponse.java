package com.ragdocs.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragdocs.gateway.service.quality.QualityVerdict;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SearchResponse {
    private String query;
    private List<CuratedResult> results;

    @JsonProperty("total_results")
    private int totalResults;

    @JsonProperty("retrieval_gated")
    private boolean retrievalGated;

    @JsonProperty("gating_reason")
    private String gatingReason;

    @JsonProperty("similarity_score_range")
    private String similarityScoreRange;

    @JsonProperty("processing_time_ms")
    private long processingTimeMs;

    private boolean cached;

    @JsonProperty("retrieval_quality")
    private QualityVerdict retrievalQuality;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("fallback_message")
    private String fallbackMessage;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<String> suggestions;

    /**
     * Copy that shares no mutable state with this response, down to each result.
     */
    public SearchResponse copy() {
        SearchResponse copy = new SearchResponse();
        copyInto(copy);
        return copy;
    }

    protected void copyInto(SearchResponse target) {
        target.query = query;
        target.results = copyResults(results);
        target.totalResults = totalResults;
        target.retrievalGated = retrievalGated;
        target.gatingReason = gatingReason;
        target.similarityScoreRange = similarityScoreRange;
        target.processingTimeMs = processingTimeMs;
        target.cached = cached;
        target.retrievalQuality = retrievalQuality;
        target.fallbackMessage = fallbackMessage;
        target.suggestions = suggestions == null ? null : List.copyOf(suggestions);
    }

    private static List<CuratedResult> copyResults(List<CuratedResult> results) {
        if (results == null) {
            return null;
        }
        List<CuratedResult> copies = new ArrayList<>(results.size());
        for (CuratedResult result : results) {
            copies.add(result == null ? null : result.copy());
        }
        return Collections.unmodifiableList(copies);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<CuratedResult> getResults() {
        return results;
    }

    public void setResults(List<CuratedResult> results) {
        this.results = results;
    }

    public int getTotalResults() {
        return totalResults;
    }

    public void setTotalResults(int totalResults) {
        this.totalResults = totalResults;
    }

    public boolean isRetrievalGated() {
        return retrievalGated;
    }

    public void setRetrievalGated(boolean retrievalGated) {
        this.retrievalGated = retrievalGated;
    }

    public String getGatingReason() {
        return gatingReason;
    }

    public void setGatingReason(String gatingReason) {
        this.gatingReason = gatingReason;
    }

    public String getSimilarityScoreRange() {
        return similarityScoreRange;
    }

    public void setSimilarityScoreRange(String similarityScoreRange) {
        this.similarityScoreRange = similarityScoreRange;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public QualityVerdict getRetrievalQuality() {
        return retrievalQuality;
    }

    public void setRetrievalQuality(QualityVerdict retrievalQuality) {
        this.retrievalQuality = retrievalQuality;
    }

    public String getFallbackMessage() {
        return fallbackMessage;
    }

    public void setFallbackMessage(String fallbackMessage) {
        this.fallbackMessage = fallbackMessage;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<String> suggestions) {
        this.suggestions = suggestions;
    }
}
