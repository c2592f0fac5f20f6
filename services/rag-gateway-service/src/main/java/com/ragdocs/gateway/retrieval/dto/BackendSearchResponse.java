package com.ragdocs.gateway.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendSearchResponse {
    private String query;
    private List<RawResult> results;

    @JsonProperty("query_embedding")
    private List<Double> queryEmbedding;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<RawResult> getResults() {
        return results;
    }

    public void setResults(List<RawResult> results) {
        this.results = results;
    }

    public List<Double> getQueryEmbedding() {
        return queryEmbedding;
    }

    public void setQueryEmbedding(List<Double> queryEmbedding) {
        this.queryEmbedding = queryEmbedding;
    }
}
