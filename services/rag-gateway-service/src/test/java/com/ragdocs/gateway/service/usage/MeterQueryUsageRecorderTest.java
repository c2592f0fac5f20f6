package com.ragdocs.gateway.service.usage;

import static org.assertj.core.api.Assertions.assertThat;

import com.ragdocs.gateway.service.usage.QueryUsageEvent.QueryKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MeterQueryUsageRecorderTest {

    @Test
    void recordsCountersAndLatency() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MeterQueryUsageRecorder recorder = new MeterQueryUsageRecorder(registry);

        recorder.record(new QueryUsageEvent("install api", "u1", QueryKind.SEARCH, false, 120L, 3, 0.85, false));
        recorder.record(new QueryUsageEvent("install api", "u1", QueryKind.SEARCH, true, 0L, 3, 0.85, false));
        recorder.record(new QueryUsageEvent("quantum flux", null, QueryKind.LLM, false, 80L, 0, 0.0, true));

        assertThat(registry.counter("rag_query_total", "kind", "search", "cache", "miss").count()).isEqualTo(1.0);
        assertThat(registry.counter("rag_query_total", "kind", "search", "cache", "hit").count()).isEqualTo(1.0);
        assertThat(registry.counter("rag_query_gated_total", "kind", "llm").count()).isEqualTo(1.0);
        assertThat(registry.find("rag_query_gated_total").tag("kind", "search").counter()).isNull();
        assertThat(registry.timer("rag_query_latency", "kind", "search").count()).isEqualTo(2);
        assertThat(registry.timer("rag_query_latency", "kind", "search").totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }
}
