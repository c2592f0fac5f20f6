package com.ragdocs.gateway.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * SHA-256 fingerprints and the cache key layout built on top of them.
 */
public final class CacheKeyUtil {
    public static final String QUERY_PREFIX = "query:";
    public static final String LLM_PREFIX = "llm:";
    public static final String HEALTH_PREFIX = "health:";

    private CacheKeyUtil() {
    }

    public static String sha256(String value) {
        if (value == null) {
            return null;
        }
        return sha256(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256(byte[] value) {
        if (value == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value);
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String normalizeQuery(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    public static String queryKey(String query) {
        return QUERY_PREFIX + sha256(normalizeQuery(query));
    }

    public static String searchKey(String query, int topK) {
        return queryKey(query) + ":" + topK;
    }

    public static String llmKey(String query, int topK) {
        return LLM_PREFIX + sha256(normalizeQuery(query)) + ":" + topK;
    }

    public static String healthKey(String service) {
        return HEALTH_PREFIX + service;
    }
}
