package com.ragdocs.gateway.service.usage;

import java.util.Locale;

public record QueryUsageEvent(
    String query,
    String userId,
    QueryKind kind,
    boolean cacheHit,
    long responseTimeMs,
    int resultsCount,
    double maxSimilarityScore,
    boolean gated
) {
    public enum QueryKind {
        SEARCH,
        LLM;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
