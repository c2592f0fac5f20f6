package com.ragdocs.gateway.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

    private MutableClock clock;
    private ManualExpiryScheduler scheduler;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        scheduler = new ManualExpiryScheduler(clock);
        cache = new ResultCache(scheduler, clock, 100);
    }

    @Test
    void entryExpiresWhenTimerFires() {
        cache.set("k", "v", 1);
        assertThat(cache.get("k")).contains("v");

        scheduler.advance(Duration.ofMillis(1500));

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.stats().count()).isZero();
        assertThat(cache.pendingTimers()).isZero();
    }

    @Test
    void expiredEntryIsHiddenEvenBeforeTimerRuns() {
        cache.set("k", "v", 1);

        clock.advance(Duration.ofSeconds(1));

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.pendingTimers()).isZero();
    }

    @Test
    void overwriteSurvivesOriginalTimer() {
        cache.set("k", "v1", 1);
        ManualExpiryScheduler.Task first = scheduler.tasks().get(0);

        scheduler.advance(Duration.ofMillis(500));
        cache.set("k", "v2", 1);
        assertThat(first.isCancelled()).isTrue();

        scheduler.advance(Duration.ofMillis(600));
        assertThat(cache.get("k")).contains("v2");

        scheduler.advance(Duration.ofMillis(500));
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void staleTimerDoesNotRemoveNewerEntry() {
        cache.set("k", "v1", 10);
        ManualExpiryScheduler.Task first = scheduler.tasks().get(0);
        cache.set("k", "v2", 10);

        first.fireNow();

        assertThat(cache.get("k")).contains("v2");
        assertThat(cache.pendingTimers()).isEqualTo(1);
    }

    @Test
    void deleteCancelsTimer() {
        cache.set("k", "v", 5);

        assertThat(cache.delete("k")).isTrue();
        assertThat(cache.delete("k")).isFalse();
        assertThat(scheduler.tasks().get(0).isCancelled()).isTrue();
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void invalidArgumentsAreIgnored() {
        cache.set(null, "v", 5);
        cache.set("k", null, 5);
        cache.set("k", "v", 0);

        assertThat(cache.stats().count()).isZero();
        assertThat(scheduler.tasks()).isEmpty();
    }

    @Test
    void typedGetFiltersByType() {
        cache.set("k", 42, 5);

        assertThat(cache.get("k", Integer.class)).contains(42);
        assertThat(cache.get("k", String.class)).isEmpty();
    }

    @Test
    void capacityEvictsOldestInsertion() {
        ResultCache small = new ResultCache(scheduler, clock, 2);
        small.set("a", 1, 60);
        small.set("b", 2, 60);
        small.set("c", 3, 60);

        assertThat(small.get("a")).isEmpty();
        assertThat(small.get("b")).contains(2);
        assertThat(small.get("c")).contains(3);
        assertThat(small.stats()).isEqualTo(new ResultCache.CacheStats(2, 2));
        assertThat(small.pendingTimers()).isEqualTo(2);
        assertThat(scheduler.tasks().get(0).isCancelled()).isTrue();
    }

    @Test
    void removeIfDropsMatchingEntriesAndTheirTimers() {
        cache.set("a", 1, 60);
        cache.set("b", 2, 60);
        cache.set("c", 3, 60);

        int removed = cache.removeIf(value -> ((Integer) value) % 2 == 1);

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains(2);
        assertThat(cache.get("c")).isEmpty();
        assertThat(cache.pendingTimers()).isEqualTo(1);
        assertThat(scheduler.tasks()).filteredOn(ManualExpiryScheduler.Task::isCancelled).hasSize(2);
    }

    @Test
    void concurrentWritersKeepOneTimerPerKey() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int seed = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    String key = "key-" + ((seed + i) % 10);
                    cache.set(key, seed * 1000 + i, 60);
                    cache.get(key);
                    if (i % 50 == 0) {
                        cache.delete(key);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(cache.stats().count()).isLessThanOrEqualTo(10);
        assertThat(cache.pendingTimers()).isEqualTo(cache.stats().count());
    }
}
