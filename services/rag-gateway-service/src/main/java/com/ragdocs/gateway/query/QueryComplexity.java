package com.ragdocs.gateway.query;

import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryComplexity {
    @JsonProperty("term_count")
    private final int termCount;

    @JsonProperty("average_term_length")
    private final double averageTermLength;

    @JsonProperty("has_technical_terms")
    private final boolean hasTechnicalTerms;

    @JsonProperty("is_complex")
    private final boolean complex;

    public QueryComplexity(int termCount, double averageTermLength, boolean hasTechnicalTerms, boolean complex) {
        this.termCount = termCount;
        this.averageTermLength = averageTermLength;
        this.hasTechnicalTerms = hasTechnicalTerms;
        this.complex = complex;
    }

    public int getTermCount() {
        return termCount;
    }

    public double getAverageTermLength() {
        return averageTermLength;
    }

    public boolean hasTechnicalTerms() {
        return hasTechnicalTerms;
    }

    public boolean isComplex() {
        return complex;
    }
}
