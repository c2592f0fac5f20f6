package com.ragdocs.gateway.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Typed access to {@link ResultCache} for the gateway. Every operation fails open: a cache failure is
 * logged and reported as a miss, never thrown to the caller.
 */
@Service
public class RagCacheService {
    private static final Logger log = LoggerFactory.getLogger(RagCacheService.class);
    private static final String PROVIDER = "memory";

    private final ResultCache cache;
    private final ResultCacheProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RagCacheService(ResultCache cache, ResultCacheProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.cache = cache;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public <T> Optional<T> getCachedResult(String key, Class<T> type) {
        if (!isEnabled() || key == null) {
            return Optional.empty();
        }
        try {
            Optional<T> value = cache.get(key, type);
            log.debug("cache_{} key={}", value.isPresent() ? "hit" : "miss", key);
            return value;
        } catch (RuntimeException ex) {
            recordFailure("get", key, ex);
            return Optional.empty();
        }
    }

    public boolean cacheResult(String key, Object value, long ttlSeconds) {
        if (!isEnabled() || key == null || value == null) {
            return false;
        }
        long ttl = ttlSeconds > 0 ? ttlSeconds : properties.getDefaultTtlSeconds();
        try {
            cache.set(key, value, ttl);
            log.debug("cache_put key={} ttl_s={}", key, ttl);
            return true;
        } catch (RuntimeException ex) {
            recordFailure("set", key, ex);
            return false;
        }
    }

    /**
     * Drops every cached value the filter matches. Used to evict responses built from a document that changed.
     */
    public int invalidateMatching(String reason, Predicate<Object> valueFilter) {
        try {
            int removed = cache.removeIf(valueFilter);
            log.info("cache_invalidated reason={} removed={}", reason, removed);
            return removed;
        } catch (RuntimeException ex) {
            recordFailure("invalidate", reason, ex);
            return 0;
        }
    }

    public boolean cacheHealthStatus(String service, boolean healthy) {
        return cacheResult(
            CacheKeyUtil.healthKey(service),
            new HealthStatus(healthy, clock.instant()),
            properties.getHealthTtlSeconds()
        );
    }

    public Optional<HealthStatus> getCachedHealthStatus(String service) {
        return getCachedResult(CacheKeyUtil.healthKey(service), HealthStatus.class);
    }

    public CacheInfo getStats() {
        try {
            ResultCache.CacheStats stats = cache.stats();
            return new CacheInfo(isEnabled(), PROVIDER, stats.count(), stats.maxEntries());
        } catch (RuntimeException ex) {
            recordFailure("stats", null, ex);
            return new CacheInfo(isEnabled(), PROVIDER, 0, properties.getMaxEntries());
        }
    }

    private void recordFailure(String operation, String key, RuntimeException ex) {
        log.warn("cache_failure op={} key={}; continuing uncached", operation, key, ex);
        try {
            meterRegistry.counter("rag_cache_failure_total", "op", operation).increment();
        } catch (RuntimeException metricsEx) {
            log.debug("cache failure metric not recorded", metricsEx);
        }
    }

    public record HealthStatus(boolean status, @JsonProperty("checked_at") Instant checkedAt) {}

    public record CacheInfo(boolean enabled, String provider, int size, @JsonProperty("max_entries") int maxEntries) {}
}
