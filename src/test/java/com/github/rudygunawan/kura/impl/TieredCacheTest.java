package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.api.SizeEstimator;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.model.CacheItem;
import com.github.rudygunawan.kura.model.CacheOptions;
import com.github.rudygunawan.kura.model.CachePriority;
import com.github.rudygunawan.kura.model.TierStats;
import com.github.rudygunawan.kura.policy.RemovalCause;
import com.github.rudygunawan.kura.time.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tier placement, eviction cascade, promotion, demotion and expiry.
 */
class TieredCacheTest {

    private static final CacheOptions HOT = CacheOptions.builder().priority(CachePriority.HOT).build();
    private static final CacheOptions COLD = CacheOptions.builder().priority(CachePriority.COLD).build();

    private FakeTicker ticker;
    private List<String> removals;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        removals = Collections.synchronizedList(new ArrayList<>());
    }

    private TieredCache<String> newCache(int l1, int l2, int l3) {
        RemovalListener<String> listener = (key, value, cause) -> removals.add(key + ":" + cause);
        return new TieredCache<>(l1, l2, l3, 2, TimeUnit.SECONDS.toNanos(30),
                ticker, SizeEstimator.heuristic(), listener);
    }

    // ========== Placement ==========

    @Test
    void testExplicitPriorityPicksTier() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("h", "v", HOT);
        cache.set("w", "v", CacheOptions.builder().priority(CachePriority.WARM).build());
        cache.set("c", "v", COLD);

        assertEquals(CachePriority.HOT, cache.tierOf("h"));
        assertEquals(CachePriority.WARM, cache.tierOf("w"));
        assertEquals(CachePriority.COLD, cache.tierOf("c"));
    }

    @Test
    void testUntrackedKeyDefaultsToCold() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("fresh", "v", CacheOptions.defaults());

        assertEquals(CachePriority.COLD, cache.tierOf("fresh"));
    }

    @Test
    void testPriorityInferredFromRecentWrites() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("k", "v1", CacheOptions.defaults());
        cache.set("k", "v2", CacheOptions.defaults());
        assertEquals(CachePriority.COLD, cache.tierOf("k"), "one prior access is cold");

        cache.set("k", "v3", CacheOptions.defaults());
        assertEquals(CachePriority.WARM, cache.tierOf("k"), "two prior accesses are warm");

        cache.set("k", "v4", CacheOptions.defaults());
        cache.set("k", "v5", CacheOptions.defaults());
        cache.set("k", "v6", CacheOptions.defaults());
        assertEquals(CachePriority.HOT, cache.tierOf("k"), "five prior accesses are hot");
        assertEquals("v6", cache.get("k"));
    }

    @Test
    void testAccessesOutsideInferenceWindowAreIgnored() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("k", "v", CacheOptions.defaults());
        cache.set("k", "v", CacheOptions.defaults());
        ticker.advance(31, TimeUnit.SECONDS);
        cache.set("k", "v", CacheOptions.defaults());

        assertEquals(CachePriority.COLD, cache.tierOf("k"));
    }

    @Test
    void testSetReplacesAcrossTiers() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("k", "old", COLD);
        cache.set("k", "new", HOT);

        assertEquals(CachePriority.HOT, cache.tierOf("k"));
        assertEquals(1, cache.getStats().totalSize());
        assertTrue(cache.keysIn(CachePriority.COLD).isEmpty());
        assertEquals(List.of("k:REPLACED"), removals);
        assertEquals("new", cache.get("k"));
    }

    // ========== Eviction ==========

    @Test
    void testCascadeDiscardsOnlyFromColdTier() {
        TieredCache<String> cache = newCache(1, 2, 2);

        for (String key : List.of("a", "b", "c", "d", "e", "f")) {
            cache.set(key, "value-" + key, HOT);
        }

        assertEquals(List.of("f"), cache.keysIn(CachePriority.HOT));
        assertEquals(List.of("d", "e"), cache.keysIn(CachePriority.WARM));
        assertEquals(List.of("b", "c"), cache.keysIn(CachePriority.COLD));
        assertNull(cache.tierOf("a"));

        TierStats stats = cache.getStats();
        assertEquals(1, stats.evictionCount());
        assertEquals(5, stats.totalSize());
        assertEquals(List.of("a:SIZE"), removals);
    }

    @Test
    void testFullTiersSinkWithoutLoss() {
        TieredCache<String> cache = newCache(2, 2, 2);

        for (String key : List.of("a", "b", "c", "d", "e", "f")) {
            cache.set(key, "value-" + key, HOT);
        }

        assertEquals(List.of("e", "f"), cache.keysIn(CachePriority.HOT));
        assertEquals(List.of("c", "d"), cache.keysIn(CachePriority.WARM));
        assertEquals(List.of("a", "b"), cache.keysIn(CachePriority.COLD));
        assertEquals(0, cache.getStats().evictionCount());
        assertTrue(removals.isEmpty());
    }

    @Test
    void testTierSizesNeverExceedCapacity() {
        TieredCache<String> cache = newCache(3, 4, 5);

        for (int i = 0; i < 50; i++) {
            CachePriority priority = CachePriority.values()[i % 3];
            cache.set("key" + i, "v", CacheOptions.builder().priority(priority).build());
            ticker.advance(7, TimeUnit.MILLISECONDS);
            TierStats stats = cache.getStats();
            assertTrue(stats.l1Size() <= 3);
            assertTrue(stats.l2Size() <= 4);
            assertTrue(stats.l3Size() <= 5);
        }
        assertEquals(12, cache.getStats().totalSize());
    }

    @Test
    void testEqualScoresEvictOldestInTier() {
        TieredCache<String> cache = newCache(15, 30, 2);

        cache.set("first", "v", COLD);
        cache.set("second", "v", COLD);
        ticker.advance(100, TimeUnit.MILLISECONDS);
        cache.set("newcomer", "v", COLD);

        assertNull(cache.tierOf("first"));
        assertEquals(List.of("second", "newcomer"), cache.keysIn(CachePriority.COLD));
    }

    @Test
    void testLongerIdleItemEvictedFirst() {
        TieredCache<String> cache = newCache(15, 30, 2);

        cache.set("stale", "v", COLD);
        ticker.advance(100, TimeUnit.MILLISECONDS);
        cache.set("recent", "v", COLD);
        ticker.advance(1, TimeUnit.SECONDS);
        cache.set("newcomer", "v", COLD);

        assertNull(cache.tierOf("stale"));
        assertEquals(CachePriority.COLD, cache.tierOf("recent"));
    }

    @Test
    void testScoreOrdersByFrequencyThenRecency() {
        long now = TimeUnit.SECONDS.toNanos(10);
        CacheItem<String> frequent = new CacheItem<>("f", "v", 1, CachePriority.HOT, 0, 0, null);
        CacheItem<String> rare = new CacheItem<>("r", "v", 1, CachePriority.HOT, 0, 0, null);
        for (int i = 0; i < 5; i++) {
            frequent.recordAccess(now);
        }
        assertTrue(TieredCache.score(rare, now) < TieredCache.score(frequent, now));

        CacheItem<String> idle = new CacheItem<>("i", "v", 1, CachePriority.HOT, 0, 0, null);
        CacheItem<String> recent = new CacheItem<>("n", "v", 1, CachePriority.HOT, 0, 0, null);
        idle.recordAccess(TimeUnit.SECONDS.toNanos(1));
        recent.recordAccess(TimeUnit.SECONDS.toNanos(9));
        assertTrue(TieredCache.score(idle, now) < TieredCache.score(recent, now));
    }

    // ========== Promotion and demotion ==========

    @Test
    void testRepeatedReadsPromoteOneTierAtATime() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("k", "v", COLD);
        assertEquals("v", cache.get("k"));
        assertEquals(CachePriority.WARM, cache.tierOf("k"));

        assertEquals("v", cache.get("k"));
        assertEquals(CachePriority.HOT, cache.tierOf("k"));

        assertEquals("v", cache.get("k"));
        assertEquals(CachePriority.HOT, cache.tierOf("k"));
    }

    @Test
    void testSlowReadsDoNotPromote() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("k", "v", COLD);
        ticker.advance(11, TimeUnit.SECONDS);
        assertEquals("v", cache.get("k"));
        ticker.advance(11, TimeUnit.SECONDS);
        assertEquals("v", cache.get("k"));

        assertEquals(CachePriority.COLD, cache.tierOf("k"));
    }

    @Test
    void testOptimizeDemotesIdleItems() {
        TieredCache<String> cache = newCache(15, 30, 60);

        cache.set("idle", "v", HOT);
        cache.set("busy", "v", HOT);

        ticker.advance(31, TimeUnit.SECONDS);
        cache.get("busy");
        cache.optimize();
        assertEquals(CachePriority.WARM, cache.tierOf("idle"));
        assertEquals(CachePriority.HOT, cache.tierOf("busy"));

        ticker.advance(30, TimeUnit.SECONDS);
        cache.optimize();
        assertEquals(CachePriority.COLD, cache.tierOf("idle"), "idle past twice the threshold");
        assertEquals(CachePriority.HOT, cache.tierOf("busy"), "idle exactly the threshold stays");
    }

    @Test
    void testDemotionIntoFullTierCascades() {
        TieredCache<String> cache = newCache(1, 1, 1);

        cache.set("cold", "v", COLD);
        cache.set("warm", "v", CacheOptions.builder().priority(CachePriority.WARM).build());
        cache.set("hot", "v", HOT);

        ticker.advance(31, TimeUnit.SECONDS);
        cache.optimize();

        assertEquals(CachePriority.WARM, cache.tierOf("hot"));
        assertEquals(CachePriority.COLD, cache.tierOf("warm"));
        assertNull(cache.tierOf("cold"));
        assertEquals(1, cache.getStats().evictionCount());
    }

    // ========== Expiry ==========

    @Test
    void testExpiredItemReadsAsMiss() {
        TieredCache<String> cache = newCache(15, 30, 60);
        cache.set("k", "v", CacheOptions.builder().priority(CachePriority.HOT).ttl(1, TimeUnit.SECONDS).build());

        ticker.advance(1, TimeUnit.SECONDS);
        assertEquals("v", cache.get("k"), "expiry needs more than the ttl to elapse");

        ticker.advance(1, TimeUnit.MILLISECONDS);
        assertNull(cache.get("k"));
        assertNull(cache.tierOf("k"));

        TierStats stats = cache.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertTrue(removals.contains("k:EXPIRED"));
    }

    @Test
    void testOptimizeRemovesExpiredItems() {
        TieredCache<String> cache = newCache(15, 30, 60);
        cache.set("short", "v", CacheOptions.builder().priority(CachePriority.HOT).ttl(5, TimeUnit.SECONDS).build());
        cache.set("forever", "v", HOT);

        ticker.advance(6, TimeUnit.SECONDS);
        cache.optimize();

        assertNull(cache.tierOf("short"));
        assertEquals(CachePriority.HOT, cache.tierOf("forever"));
    }

    @Test
    void testWritesSweepExpiredItemsOnceCacheIsLarge() {
        TieredCache<String> cache = newCache(200, 200, 200);
        CacheOptions shortLived = CacheOptions.builder().ttl(1, TimeUnit.SECONDS).build();
        for (int i = 0; i <= TieredCache.SWEEP_CEILING; i++) {
            cache.set("k" + i, "v", shortLived);
        }
        assertEquals(TieredCache.SWEEP_CEILING + 1, cache.getStats().totalSize());

        ticker.advance(2, TimeUnit.SECONDS);
        cache.set("trigger", "v", CacheOptions.defaults());

        assertEquals(1, cache.getStats().totalSize());
    }

    // ========== Statistics and removal ==========

    @Test
    void testHitRate() {
        TieredCache<String> cache = newCache(15, 30, 60);
        assertEquals(0.0, cache.getStats().hitRate());

        cache.set("k", "v", HOT);
        cache.get("k");
        cache.get("k");
        cache.get("k");
        cache.get("missing");

        TierStats stats = cache.getStats();
        assertEquals(3, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.75, stats.hitRate(), 0.0001);
    }

    @Test
    void testDeleteAndInvalidateTag() {
        TieredCache<String> cache = newCache(15, 30, 60);
        cache.set("u1", "v", CacheOptions.builder().tags("users").build());
        cache.set("u2", "v", CacheOptions.builder().priority(CachePriority.HOT).tags("users", "admins").build());
        cache.set("p1", "v", CacheOptions.builder().tags("posts").build());

        assertTrue(cache.delete("p1"));
        assertFalse(cache.delete("p1"));
        assertEquals(2, cache.invalidateTag("users"));
        assertEquals(0, cache.invalidateTag("users"));

        assertEquals(0, cache.getStats().totalSize());
        assertEquals(0, cache.trackedKeyCount(), "removed keys lose their history");
    }

    @Test
    void testClearResetsCountersButEvictAllKeepsThem() {
        TieredCache<String> cache = newCache(15, 30, 60);
        cache.set("a", "v", HOT);
        cache.get("a");
        cache.get("missing");

        assertEquals(1, cache.evictAll());
        TierStats afterEvict = cache.getStats();
        assertEquals(0, afterEvict.totalSize());
        assertEquals(1, afterEvict.hitCount());
        assertTrue(removals.contains("a:CLEANUP"));

        cache.set("b", "v", HOT);
        cache.clear();
        assertEquals(new TierStats(0, 0, 0, 0, 0, 0), cache.getStats());
        assertEquals(0, cache.trackedKeyCount());
    }

    @Test
    void testDiscardColdHalfDropsOldestColdItems() {
        TieredCache<String> cache = newCache(15, 30, 60);
        for (String key : List.of("c1", "c2", "c3", "c4", "c5")) {
            cache.set(key, "v", COLD);
        }
        cache.set("h", "v", HOT);

        assertEquals(2, cache.discardColdHalf());
        assertEquals(List.of("c3", "c4", "c5"), cache.keysIn(CachePriority.COLD));
        assertEquals(CachePriority.HOT, cache.tierOf("h"));
    }

    @Test
    void testMemoryUsageFollowsTiers() {
        TieredCache<String> cache = newCache(15, 30, 60);
        cache.set("a", "v", CacheOptions.builder().priority(CachePriority.HOT).size(100).build());
        cache.set("b", "v", CacheOptions.builder().priority(CachePriority.COLD).size(40).build());
        cache.set("c", "abc", COLD);

        assertEquals(100, cache.getMemoryUsage().l1());
        assertEquals(0, cache.getMemoryUsage().l2());
        assertEquals(46, cache.getMemoryUsage().l3());
        assertEquals(146, cache.getMemoryUsage().total());
    }

    @Test
    void testFailingListenerDoesNotBreakCache() {
        TieredCache<String> cache = new TieredCache<>(1, 1, 1, 2, TimeUnit.SECONDS.toNanos(30),
                ticker, SizeEstimator.heuristic(), (key, value, cause) -> {
                    throw new IllegalStateException("boom");
                });

        cache.set("a", "v", COLD);
        cache.set("b", "v", COLD);

        assertNull(cache.tierOf("a"));
        assertEquals(CachePriority.COLD, cache.tierOf("b"));
    }

    @Test
    void testListenerRunsAfterLockIsReleased() throws InterruptedException {
        List<CachePriority> seenFromOtherThread = Collections.synchronizedList(new ArrayList<>());
        List<TieredCache<String>> holder = new ArrayList<>();
        TieredCache<String> cache = new TieredCache<>(1, 1, 1, 2, TimeUnit.SECONDS.toNanos(30),
                ticker, SizeEstimator.heuristic(), (key, value, cause) -> {
                    Thread reader = new Thread(() -> seenFromOtherThread.add(holder.get(0).tierOf("b")));
                    reader.start();
                    try {
                        reader.join(TimeUnit.SECONDS.toMillis(2));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
        holder.add(cache);

        cache.set("a", "v", COLD);
        cache.set("b", "v", COLD);

        assertEquals(List.of(CachePriority.COLD), seenFromOtherThread,
                "another thread should read the cache while the listener runs");
    }

    @Test
    void testInvalidConfigurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> newCache(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> newCache(1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> newCache(1, 1, -1));
        assertThrows(NullPointerException.class, () -> newCache(1, 1, 1).set(null, "v", HOT));
        assertThrows(NullPointerException.class, () -> newCache(1, 1, 1).set("k", null, HOT));
    }

    @Test
    void testRemovalCauseEviction() {
        assertTrue(RemovalCause.SIZE.wasEvicted());
        assertFalse(RemovalCause.EXPLICIT.wasEvicted());
    }
}
