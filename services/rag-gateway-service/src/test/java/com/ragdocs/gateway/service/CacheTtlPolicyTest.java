package com.ragdocs.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ragdocs.gateway.cache.ResultCacheProperties;
import org.junit.jupiter.api.Test;

class CacheTtlPolicyTest {

    private final CacheTtlPolicy policy = new CacheTtlPolicy(new ResultCacheProperties());

    @Test
    void longQueriesGetShortTtl() {
        assertThat(policy.ttlSeconds("one two three four five six seven eight nine ten eleven")).isEqualTo(300);
    }

    @Test
    void shortQueriesGetDefaultTtl() {
        assertThat(policy.ttlSeconds("one two three four five")).isEqualTo(600);
        assertThat(policy.ttlSeconds("one two three four five six seven eight nine ten")).isEqualTo(600);
    }

    @Test
    void countsWhitespaceSeparatedWords() {
        assertThat(CacheTtlPolicy.wordCount("  install   the api ")).isEqualTo(3);
        assertThat(CacheTtlPolicy.wordCount("")).isZero();
        assertThat(CacheTtlPolicy.wordCount(null)).isZero();
    }
}
