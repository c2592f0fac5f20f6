package com.ragdocs.gateway.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class QueryRewriterTest {

    private final QueryRewriter rewriter = new QueryRewriter();

    @Test
    void expandsTriggersAndDropsStopWords() {
        ProcessedQuery processed = rewriter.rewrite("how do I fix an error in the config");

        assertThat(processed.getOriginal()).isEqualTo("how do I fix an error in the config");
        assertThat(processed.getTerms()).startsWith("fix", "error", "config");
        assertThat(processed.getTerms()).doesNotContain("how", "do", "i", "an", "in", "the");
        assertThat(processed.getTerms()).contains(
            "issue", "problem", "troubleshoot", "configuration", "settings", "preferences", "options"
        );
        assertThat(processed.getExpansions()).containsExactly(
            "issue", "problem", "troubleshoot", "fix", "configuration", "settings", "preferences", "options"
        );
        // "fix" appears once even though it is also an expansion term
        assertThat(processed.getExpanded())
            .isEqualTo("fix error config issue problem troubleshoot configuration settings preferences options");
    }

    @Test
    void complexityReflectsTermsAndTechnicalWords() {
        ProcessedQuery processed = rewriter.rewrite("install api");

        QueryComplexity complexity = processed.getComplexity();
        assertThat(complexity.getTermCount()).isEqualTo(processed.getTerms().size());
        assertThat(complexity.hasTechnicalTerms()).isTrue();
        assertThat(complexity.isComplex()).isTrue();
    }

    @Test
    void emptyQueryHasZeroAverageLength() {
        ProcessedQuery processed = rewriter.rewrite("the and of");

        assertThat(processed.getTerms()).isEmpty();
        assertThat(processed.getExpanded()).isEmpty();
        assertThat(processed.getComplexity().getTermCount()).isZero();
        assertThat(processed.getComplexity().getAverageTermLength()).isZero();
        assertThat(processed.getComplexity().isComplex()).isFalse();
    }

    @Test
    void shortPlainQueryIsSimple() {
        QueryComplexity complexity = rewriter.analyzeComplexity(Set.of("hello", "world"));

        assertThat(complexity.getTermCount()).isEqualTo(2);
        assertThat(complexity.getAverageTermLength()).isEqualTo(5.0);
        assertThat(complexity.hasTechnicalTerms()).isFalse();
        assertThat(complexity.isComplex()).isFalse();
    }

    @Test
    void longTermMakesQueryComplex() {
        assertThat(rewriter.analyzeComplexity(Set.of("internationalization")).isComplex()).isTrue();
    }

    @Test
    void recognizesTechnicalTerms() {
        assertThat(rewriter.isTechnicalTerm("getUser")).isTrue();
        assertThat(rewriter.isTechnicalTerm("MAX_SIZE")).isTrue();
        assertThat(rewriter.isTechnicalTerm("v12")).isTrue();
        assertThat(rewriter.isTechnicalTerm("app.py")).isTrue();
        assertThat(rewriter.isTechnicalTerm("json")).isTrue();
        assertThat(rewriter.isTechnicalTerm("garden")).isFalse();
    }

    @Test
    void prepareSearchAddsBufferCappedAtTwenty() {
        SearchPreparation preparation = rewriter.prepareSearch("install api", 5);

        assertThat(preparation.originalQuery()).isEqualTo("install api");
        assertThat(preparation.searchQuery()).startsWith("install api setup configuration getting started");
        assertThat(preparation.effectiveTopK()).isEqualTo(7);
        assertThat(preparation.expansionTerms()).contains("setup", "endpoint");

        assertThat(rewriter.prepareSearch("install api", 19).effectiveTopK()).isEqualTo(20);
        assertThat(rewriter.prepareSearch("install api", 20).effectiveTopK()).isEqualTo(20);
    }
}
