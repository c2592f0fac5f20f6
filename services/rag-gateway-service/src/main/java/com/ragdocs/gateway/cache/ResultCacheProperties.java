package com.ragdocs.gateway.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.cache")
public class ResultCacheProperties {
    private boolean enabled = true;
    private int maxEntries = 1000;
    private long defaultTtlSeconds = 600;
    private long complexQueryTtlSeconds = 300;
    private int complexQueryWordThreshold = 10;
    private long healthTtlSeconds = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public void setDefaultTtlSeconds(long defaultTtlSeconds) {
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public long getComplexQueryTtlSeconds() {
        return complexQueryTtlSeconds;
    }

    public void setComplexQueryTtlSeconds(long complexQueryTtlSeconds) {
        this.complexQueryTtlSeconds = complexQueryTtlSeconds;
    }

    public int getComplexQueryWordThreshold() {
        return complexQueryWordThreshold;
    }

    public void setComplexQueryWordThreshold(int complexQueryWordThreshold) {
        this.complexQueryWordThreshold = complexQueryWordThreshold;
    }

    public long getHealthTtlSeconds() {
        return healthTtlSeconds;
    }

    public void setHealthTtlSeconds(long healthTtlSeconds) {
        this.healthTtlSeconds = healthTtlSeconds;
    }
}
