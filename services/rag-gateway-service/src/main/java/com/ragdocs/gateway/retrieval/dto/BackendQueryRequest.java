package com.ragdocs.gateway.retrieval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class BackendQueryRequest {
    private String query;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("top_k")
    private int topK;

    public BackendQueryRequest() {
    }

    public BackendQueryRequest(String query, String userId, int topK) {
        this.query = query;
        this.userId = userId;
        this.topK = topK;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }
}
