package com.ragdocs.gateway.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendGenerateResponse {
    private String query;
    private String answer;
    private List<RawResult> sources;

    @JsonProperty("query_embedding")
    private List<Double> queryEmbedding;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public List<RawResult> getSources() {
        return sources;
    }

    public void setSources(List<RawResult> sources) {
        this.sources = sources;
    }

    public List<Double> getQueryEmbedding() {
        return queryEmbedding;
    }

    public void setQueryEmbedding(List<Double> queryEmbedding) {
        this.queryEmbedding = queryEmbedding;
    }
}
