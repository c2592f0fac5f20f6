package com.ragdocs.gateway.service;

import com.ragdocs.gateway.cache.ResultCacheProperties;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Long queries are tied to a narrow lexical context and get the shorter TTL.
 */
@Component
public class CacheTtlPolicy {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ResultCacheProperties properties;

    public CacheTtlPolicy(ResultCacheProperties properties) {
        this.properties = properties;
    }

    public long ttlSeconds(String query) {
        return wordCount(query) > properties.getComplexQueryWordThreshold()
            ? properties.getComplexQueryTtlSeconds()
            : properties.getDefaultTtlSeconds();
    }

    static int wordCount(String query) {
        if (query == null || query.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(query.trim()).length;
    }
}
