package com.ragdocs.gateway.service.usage;

/**
 * Receives one event per answered query. Query history storage lives outside the gateway; implementations
 * forward the event there or into metrics.
 */
public interface QueryUsageRecorder {
    void record(QueryUsageEvent event);
}
