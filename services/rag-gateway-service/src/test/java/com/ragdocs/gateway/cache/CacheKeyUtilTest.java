package com.ragdocs.gateway.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class CacheKeyUtilTest {

    @Test
    void sha256IsDeterministicLowercaseHex() {
        String first = CacheKeyUtil.sha256("hello");

        assertThat(first).isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
        assertThat(CacheKeyUtil.sha256("hello")).isEqualTo(first);
        assertThat(CacheKeyUtil.sha256("hello".getBytes(StandardCharsets.UTF_8))).isEqualTo(first);
        assertThat(CacheKeyUtil.sha256("hello!")).isNotEqualTo(first);
    }

    @Test
    void queryKeysIgnoreCaseAndSurroundingWhitespace() {
        assertThat(CacheKeyUtil.queryKey("  Install API ")).isEqualTo(CacheKeyUtil.queryKey("install api"));
        assertThat(CacheKeyUtil.queryKey("install api")).startsWith("query:").hasSize("query:".length() + 64);
    }

    @Test
    void requestKeysIncludeTopKAndKind() {
        String search = CacheKeyUtil.searchKey("install api", 5);

        assertThat(search).isEqualTo(CacheKeyUtil.queryKey("install api") + ":5");
        assertThat(CacheKeyUtil.searchKey("Install API", 5)).isEqualTo(search);
        assertThat(CacheKeyUtil.searchKey("install api", 6)).isNotEqualTo(search);
        assertThat(CacheKeyUtil.llmKey("install api", 5))
            .isEqualTo("llm:" + CacheKeyUtil.sha256("install api") + ":5")
            .isNotEqualTo(search);
    }

    @Test
    void healthKeyKeepsServiceName() {
        assertThat(CacheKeyUtil.healthKey("retrieval_service")).isEqualTo("health:retrieval_service");
    }
}
