package com.ragdocs.gateway.service;

import com.ragdocs.gateway.api.dto.HealthResponse;
import com.ragdocs.gateway.cache.RagCacheService;
import com.ragdocs.gateway.retrieval.RetrievalBackendGateway;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BackendHealthService {
    private static final Logger log = LoggerFactory.getLogger(BackendHealthService.class);
    static final String RETRIEVAL_SERVICE = "retrieval_service";
    private static final String HEALTHY = "healthy";
    private static final String UNHEALTHY = "unhealthy";

    private final RetrievalBackendGateway retrievalGateway;
    private final RagCacheService cacheService;
    private final Clock clock;

    public BackendHealthService(RetrievalBackendGateway retrievalGateway, RagCacheService cacheService, Clock clock) {
        this.retrievalGateway = retrievalGateway;
        this.cacheService = cacheService;
        this.clock = clock;
    }

    public HealthResponse health() {
        return build(retrievalGateway.health());
    }

    /**
     * Same report as {@link #health()}, with the backend check memoized for the configured health TTL.
     */
    public HealthResponse detailedHealth() {
        boolean healthy;
        Optional<RagCacheService.HealthStatus> cached = cacheService.getCachedHealthStatus(RETRIEVAL_SERVICE);
        if (cached.isPresent()) {
            healthy = cached.get().status();
            log.debug("health_cached service={} healthy={}", RETRIEVAL_SERVICE, healthy);
        } else {
            healthy = retrievalGateway.health();
            cacheService.cacheHealthStatus(RETRIEVAL_SERVICE, healthy);
        }
        return build(healthy);
    }

    public static boolean isHealthy(HealthResponse response) {
        return response != null && HEALTHY.equals(response.getServices().get(RETRIEVAL_SERVICE));
    }

    private HealthResponse build(boolean retrievalHealthy) {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("api_gateway", HEALTHY);
        services.put(RETRIEVAL_SERVICE, retrievalHealthy ? HEALTHY : UNHEALTHY);
        services.put("cache", "memory");
        return new HealthResponse(HEALTHY, clock.instant(), services, cacheService.getStats());
    }
}
