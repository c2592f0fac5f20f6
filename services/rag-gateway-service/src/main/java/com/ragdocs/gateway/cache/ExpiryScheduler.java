package com.ragdocs.gateway.cache;

import java.time.Duration;

/**
 * Source of one-shot delayed tasks used to expire cache entries.
 */
public interface ExpiryScheduler {

    ScheduledExpiry schedule(Runnable task, Duration delay);

    interface ScheduledExpiry {
        void cancel();
    }
}
