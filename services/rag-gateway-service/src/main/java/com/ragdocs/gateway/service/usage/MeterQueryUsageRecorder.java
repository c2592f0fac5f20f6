package com.ragdocs.gateway.service.usage;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MeterQueryUsageRecorder implements QueryUsageRecorder {
    private static final Logger log = LoggerFactory.getLogger(MeterQueryUsageRecorder.class);

    private final MeterRegistry meterRegistry;

    public MeterQueryUsageRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(QueryUsageEvent event) {
        String kind = event.kind().tag();
        meterRegistry.counter("rag_query_total", "kind", kind, "cache", event.cacheHit() ? "hit" : "miss").increment();
        if (event.gated()) {
            meterRegistry.counter("rag_query_gated_total", "kind", kind).increment();
        }
        meterRegistry.timer("rag_query_latency", "kind", kind).record(event.responseTimeMs(), TimeUnit.MILLISECONDS);
        log.info(
            "query_recorded kind={} cache_hit={} results={} max_score={} gated={} took_ms={} user_id={}",
            kind,
            event.cacheHit(),
            event.resultsCount(),
            event.maxSimilarityScore(),
            event.gated(),
            event.responseTimeMs(),
            event.userId()
        );
    }
}
