package com.ragdocs.gateway.query;

import java.util.List;
import java.util.Set;

/**
 * A query after expansion. {@code terms} keeps first-seen order; {@code expansions} keeps every related
 * term in trigger order, duplicates included.
 */
public class ProcessedQuery {
    private final String original;
    private final String expanded;
    private final Set<String> terms;
    private final List<String> expansions;
    private final QueryComplexity complexity;

    public ProcessedQuery(
        String original,
        String expanded,
        Set<String> terms,
        List<String> expansions,
        QueryComplexity complexity
    ) {
        this.original = original;
        this.expanded = expanded;
        this.terms = terms;
        this.expansions = expansions;
        this.complexity = complexity;
    }

    public String getOriginal() {
        return original;
    }

    public String getExpanded() {
        return expanded;
    }

    public Set<String> getTerms() {
        return terms;
    }

    public List<String> getExpansions() {
        return expansions;
    }

    public QueryComplexity getComplexity() {
        return complexity;
    }
}
