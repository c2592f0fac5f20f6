package com.ragdocs.gateway.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-process key/value store where every entry carries its own expiration timer.
 *
 * <p>The entry map and the timer map only change together while holding {@code lock}, so a key never has
 * more than one pending timer. A timer that fires after its entry was overwritten or deleted does nothing.
 */
public class ResultCache {
    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final Map<String, ExpiryScheduler.ScheduledExpiry> timers = new HashMap<>();
    private final ExpiryScheduler scheduler;
    private final Clock clock;
    private final int maxEntries;

    public ResultCache(ExpiryScheduler scheduler, Clock clock, int maxEntries) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    public void set(String key, Object value, long ttlSeconds) {
        if (key == null || value == null || ttlSeconds <= 0) {
            return;
        }
        synchronized (lock) {
            cancelTimer(key);
            entries.remove(key);

            Instant now = clock.instant();
            CacheEntry entry = new CacheEntry(key, value, now, now.plusSeconds(ttlSeconds));
            entries.put(key, entry);
            timers.put(key, scheduler.schedule(() -> expire(entry), Duration.ofSeconds(ttlSeconds)));
            evictIfNeeded();
        }
    }

    public Optional<Object> get(String key) {
        return getEntry(key).map(CacheEntry::getValue);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public Optional<CacheEntry> getEntry(String key) {
        if (key == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                cancelTimer(key);
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry);
        }
    }

    public boolean delete(String key) {
        if (key == null) {
            return false;
        }
        synchronized (lock) {
            cancelTimer(key);
            return entries.remove(key) != null;
        }
    }

    /**
     * Removes every live entry whose value matches, cancelling its timer.
     *
     * @return number of entries removed
     */
    public int removeIf(Predicate<Object> valueFilter) {
        synchronized (lock) {
            int removed = 0;
            Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, CacheEntry> entry = iterator.next();
                if (valueFilter.test(entry.getValue().getValue())) {
                    iterator.remove();
                    cancelTimer(entry.getKey());
                    removed++;
                }
            }
            return removed;
        }
    }

    public CacheStats stats() {
        synchronized (lock) {
            return new CacheStats(entries.size(), maxEntries);
        }
    }

    int pendingTimers() {
        synchronized (lock) {
            return timers.size();
        }
    }

    private void expire(CacheEntry scheduled) {
        synchronized (lock) {
            String key = scheduled.getKey();
            if (entries.get(key) != scheduled) {
                return;
            }
            entries.remove(key);
            timers.remove(key);
        }
    }

    private void cancelTimer(String key) {
        ExpiryScheduler.ScheduledExpiry timer = timers.remove(key);
        if (timer != null) {
            timer.cancel();
        }
    }

    // oldest insertion first
    private void evictIfNeeded() {
        Iterator<Map.Entry<String, CacheEntry>> iterator = entries.entrySet().iterator();
        while (entries.size() > maxEntries && iterator.hasNext()) {
            String key = iterator.next().getKey();
            iterator.remove();
            cancelTimer(key);
        }
    }

    public record CacheStats(int count, int maxEntries) {}
}
