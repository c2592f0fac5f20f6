package com.ragdocs.gateway.cache;

import java.time.Instant;

public class CacheEntry {
    private final String key;
    private final Object value;
    private final Instant createdAt;
    private final Instant expiresAt;

    public CacheEntry(String key, Object value, Instant createdAt, Instant expiresAt) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getKey() {
        return key;
    }

    public Object getValue() {
        return value;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
