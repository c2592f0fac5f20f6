package com.ragdocs.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragdocs.gateway.cache.RagCacheService;
import java.time.Instant;
import java.util.Map;

public class HealthResponse {
    private String status;
    private Instant timestamp;
    private Map<String, String> services;

    @JsonProperty("cache_info")
    private RagCacheService.CacheInfo cacheInfo;

    public HealthResponse() {
    }

    public HealthResponse(String status, Instant timestamp, Map<String, String> services, RagCacheService.CacheInfo cacheInfo) {
        this.status = status;
        this.timestamp = timestamp;
        this.services = services;
        this.cacheInfo = cacheInfo;
    }

    public String getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getServices() {
        return services;
    }

    public RagCacheService.CacheInfo getCacheInfo() {
        return cacheInfo;
    }
}
