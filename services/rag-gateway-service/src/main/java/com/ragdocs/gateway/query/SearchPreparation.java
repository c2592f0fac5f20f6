package com.ragdocs.gateway.query;

import java.util.List;

public record SearchPreparation(
    String originalQuery,
    String searchQuery,
    int effectiveTopK,
    List<String> expansionTerms,
    QueryComplexity complexity
) {}
