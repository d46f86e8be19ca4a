package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.api.SizeEstimator;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.model.CacheItem;
import com.github.rudygunawan.kura.model.CacheOptions;
import com.github.rudygunawan.kura.model.CachePriority;
import com.github.rudygunawan.kura.model.MemoryUsage;
import com.github.rudygunawan.kura.model.TierStats;
import com.github.rudygunawan.kura.policy.AccessPatternTracker;
import com.github.rudygunawan.kura.policy.RemovalCause;
import com.github.rudygunawan.kura.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Three capacity-bounded tiers: L1 (hot), L2 (warm) and L3 (cold).
 *
 * <p><b>Lookups</b> probe L1, then L2, then L3. A hit served from L2 or L3 promotes the item one
 * tier up once it has been accessed {@code promotionThreshold} times in the last ten seconds.
 *
 * <p><b>Eviction</b> happens when inserting into a full tier. Every resident item of that tier is
 * scored as {@code accessCount / max(1, ageMillis) * 1_000_000 - idleMillis} and the lowest score
 * loses; ties go to the item that entered the tier first. A victim from L1 sinks into L2, a victim
 * from L2 sinks into L3 (each possibly cascading), and only a victim from L3 is discarded.
 *
 * <p><b>Maintenance</b> ({@link #optimize()}) removes expired items and demotes items idle for
 * longer than {@code demotionThreshold} from L1, and twice that from L2.
 *
 * <p>A key lives in at most one tier. All state (tiers, access windows, counters) is guarded by
 * one lock, so a tier move is never observable half-done. The removal listener is never called
 * with that lock held.
 *
 * @param <V> the type of cached values
 */
public class TieredCache<V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Memory");

    // Writes sweep expired items first once this many items are resident
    static final int SWEEP_CEILING = 100;
    static final long PROMOTION_WINDOW_NANOS = TimeUnit.SECONDS.toNanos(10);
    static final long INFERENCE_WINDOW_NANOS = TimeUnit.SECONDS.toNanos(30);
    static final int HOT_ACCESSES = 5;
    static final int WARM_ACCESSES = 2;
    private static final double SCORE_SCALE = 1_000_000d;

    private final Map<CachePriority, LinkedHashMap<String, CacheItem<V>>> tiers =
            new EnumMap<>(CachePriority.class);
    private final Map<CachePriority, Integer> capacities = new EnumMap<>(CachePriority.class);
    private final AccessPatternTracker tracker = new AccessPatternTracker();
    private final ReentrantLock lock = new ReentrantLock();
    // Removal notifications raised under the lock, delivered after it is released
    private final List<PendingRemoval<V>> pendingRemovals = new ArrayList<>();

    private final int promotionThreshold;
    private final long demotionThresholdNanos;
    private final Ticker ticker;
    private final SizeEstimator<? super V> sizeEstimator;
    private final RemovalListener<? super V> removalListener;

    private long hitCount;
    private long missCount;
    private long evictionCount;

    /**
     * Creates a tiered cache.
     *
     * @param l1Capacity maximum items in L1
     * @param l2Capacity maximum items in L2
     * @param l3Capacity maximum items in L3
     * @param promotionThreshold accesses within ten seconds that promote an item
     * @param demotionThresholdNanos idle time after which an L1 item is demoted
     * @param ticker the time source
     * @param sizeEstimator estimates item sizes when the writer gives none
     * @param removalListener notified when items leave the tiers, may be null
     * @throws IllegalArgumentException if a capacity or threshold is not positive
     */
    public TieredCache(int l1Capacity, int l2Capacity, int l3Capacity,
                       int promotionThreshold, long demotionThresholdNanos,
                       Ticker ticker, SizeEstimator<? super V> sizeEstimator,
                       RemovalListener<? super V> removalListener) {
        requirePositive(l1Capacity, "l1Capacity");
        requirePositive(l2Capacity, "l2Capacity");
        requirePositive(l3Capacity, "l3Capacity");
        requirePositive(promotionThreshold, "promotionThreshold");
        requirePositive(demotionThresholdNanos, "demotionThreshold");

        capacities.put(CachePriority.HOT, l1Capacity);
        capacities.put(CachePriority.WARM, l2Capacity);
        capacities.put(CachePriority.COLD, l3Capacity);
        for (CachePriority tier : CachePriority.values()) {
            tiers.put(tier, new LinkedHashMap<>());
        }
        this.promotionThreshold = promotionThreshold;
        this.demotionThresholdNanos = demotionThresholdNanos;
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "sizeEstimator cannot be null");
        this.removalListener = removalListener;
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Returns the value for {@code key}, or {@code null} if no tier holds a live item for it.
     */
    public V get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            long now = ticker.read();
            CacheItem<V> item = find(key);
            if (item == null) {
                missCount++;
                return null;
            }
            if (item.isExpired(now)) {
                removeItem(item, RemovalCause.EXPIRED);
                missCount++;
                return null;
            }

            hitCount++;
            item.recordAccess(now);
            tracker.recordAccess(key, now);

            CachePriority tier = item.getPriority();
            if (tier != CachePriority.HOT
                    && tracker.recentAccessCount(key, PROMOTION_WINDOW_NANOS, now) >= promotionThreshold) {
                tiers.get(tier).remove(key);
                insert(item, tier.hotter(), now);
                if (LOGGER.isLoggable(Level.FINER)) {
                    LOGGER.finer("Promoted key=" + key + " from " + tier + " to " + item.getPriority());
                }
            }
            return item.getValue();
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Stores {@code value} under {@code key}, replacing any item already held for it.
     *
     * <p>The tier is the explicit priority if one is given, otherwise it is inferred from the key's
     * accesses in the last thirty seconds: five or more is hot, two or more is warm, else cold.
     */
    public void set(String key, V value, CacheOptions options) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        lock.lock();
        try {
            long now = ticker.read();
            if (residentCount() > SWEEP_CEILING) {
                removeExpired(now);
            }

            CacheItem<V> previous = find(key);
            if (previous != null) {
                tiers.get(previous.getPriority()).remove(key);
                fireRemovalEvent(previous, RemovalCause.REPLACED);
            }

            CachePriority priority = options.getPriority() != null
                    ? options.getPriority()
                    : inferPriority(key, now);
            long size = options.hasSize() ? options.getSize() : sizeEstimator.estimate(value);
            CacheItem<V> item = new CacheItem<>(key, value, size, priority, now,
                    options.getTtlNanos(), options.getTags());

            insert(item, priority, now);
            tracker.recordAccess(key, now);
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Removes {@code key} from whichever tier holds it and forgets its access history.
     *
     * @return true if an item was removed
     */
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            CacheItem<V> item = find(key);
            if (item == null) {
                return false;
            }
            removeItem(item, RemovalCause.EXPLICIT);
            return true;
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Removes every item tagged with {@code tag}.
     *
     * @return the number of items removed
     */
    public int invalidateTag(String tag) {
        Objects.requireNonNull(tag, "tag cannot be null");
        lock.lock();
        try {
            int removed = 0;
            for (CacheItem<V> item : snapshot()) {
                if (item.getTags().contains(tag)) {
                    removeItem(item, RemovalCause.EXPLICIT);
                    removed++;
                }
            }
            return removed;
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Drops every tier and the access history, and resets hit, miss and eviction counters.
     */
    public void clear() {
        lock.lock();
        try {
            dropAll(RemovalCause.EXPLICIT);
            hitCount = 0;
            missCount = 0;
            evictionCount = 0;
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Drops every tier and the access history under memory pressure. Counters are kept.
     *
     * @return the number of items dropped
     */
    public int evictAll() {
        lock.lock();
        try {
            return dropAll(RemovalCause.CLEANUP);
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Discards the older half (rounded down) of L3 under memory pressure.
     *
     * @return the number of items discarded
     */
    public int discardColdHalf() {
        lock.lock();
        try {
            LinkedHashMap<String, CacheItem<V>> cold = tiers.get(CachePriority.COLD);
            List<CacheItem<V>> victims = new ArrayList<>(cold.values())
                    .subList(0, cold.size() / 2);
            for (CacheItem<V> item : victims) {
                removeItem(item, RemovalCause.CLEANUP);
            }
            return victims.size();
        } finally {
            unlockAndNotify();
        }
    }

    /**
     * Removes expired items, then demotes items idle past the demotion threshold: L1 to L2 after
     * {@code demotionThreshold}, L2 to L3 after twice that.
     */
    public void optimize() {
        lock.lock();
        try {
            long now = ticker.read();
            removeExpired(now);
            demoteIdle(CachePriority.HOT, demotionThresholdNanos, now);
            demoteIdle(CachePriority.WARM, demotionThresholdNanos * 2, now);
        } finally {
            unlockAndNotify();
        }
    }

    public TierStats getStats() {
        lock.lock();
        try {
            return new TierStats(hitCount, missCount, evictionCount,
                    tiers.get(CachePriority.HOT).size(),
                    tiers.get(CachePriority.WARM).size(),
                    tiers.get(CachePriority.COLD).size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the summed item sizes of each tier.
     */
    public MemoryUsage getMemoryUsage() {
        lock.lock();
        try {
            return new MemoryUsage(
                    bytesIn(CachePriority.HOT),
                    bytesIn(CachePriority.WARM),
                    bytesIn(CachePriority.COLD));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the tier currently holding {@code key}, or {@code null}. Does not count as an access.
     */
    public CachePriority tierOf(String key) {
        lock.lock();
        try {
            CacheItem<V> item = find(key);
            return item == null ? null : item.getPriority();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of the keys held by {@code tier}, in the order they entered it.
     */
    public List<String> keysIn(CachePriority tier) {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(tiers.get(tier).keySet()));
        } finally {
            lock.unlock();
        }
    }

    public int capacityOf(CachePriority tier) {
        return capacities.get(tier);
    }

    /**
     * Returns the number of keys with an access history. Only for tests of history cleanup.
     */
    int trackedKeyCount() {
        lock.lock();
        try {
            return tracker.trackedKeyCount();
        } finally {
            lock.unlock();
        }
    }

    // ==================== internals, lock held ====================

    private CacheItem<V> find(String key) {
        for (CachePriority tier : CachePriority.values()) {
            CacheItem<V> item = tiers.get(tier).get(key);
            if (item != null) {
                return item;
            }
        }
        return null;
    }

    private int residentCount() {
        int count = 0;
        for (Map<String, CacheItem<V>> tier : tiers.values()) {
            count += tier.size();
        }
        return count;
    }

    private long bytesIn(CachePriority tier) {
        long bytes = 0;
        for (CacheItem<V> item : tiers.get(tier).values()) {
            bytes += item.getSize();
        }
        return bytes;
    }

    private List<CacheItem<V>> snapshot() {
        List<CacheItem<V>> items = new ArrayList<>(residentCount());
        for (Map<String, CacheItem<V>> tier : tiers.values()) {
            items.addAll(tier.values());
        }
        return items;
    }

    private CachePriority inferPriority(String key, long now) {
        if (!tracker.isTracked(key)) {
            return CachePriority.COLD;
        }
        int recent = tracker.recentAccessCount(key, INFERENCE_WINDOW_NANOS, now);
        if (recent >= HOT_ACCESSES) {
            return CachePriority.HOT;
        }
        if (recent >= WARM_ACCESSES) {
            return CachePriority.WARM;
        }
        return CachePriority.COLD;
    }

    /**
     * Places {@code item} into {@code tier}, making room first if the tier is full.
     */
    private void insert(CacheItem<V> item, CachePriority tier, long now) {
        LinkedHashMap<String, CacheItem<V>> target = tiers.get(tier);
        if (target.size() >= capacities.get(tier)) {
            evictFrom(tier, now);
        }
        item.setPriority(tier);
        target.put(item.getKey(), item);
    }

    private void evictFrom(CachePriority tier, long now) {
        LinkedHashMap<String, CacheItem<V>> source = tiers.get(tier);
        CacheItem<V> victim = findEvictionCandidate(source, now);
        if (victim == null) {
            return;
        }
        source.remove(victim.getKey());

        CachePriority colder = tier.colder();
        if (colder != null) {
            if (LOGGER.isLoggable(Level.FINER)) {
                LOGGER.finer("Demoted key=" + victim.getKey() + " from full " + tier + " to " + colder);
            }
            insert(victim, colder, now);
        } else {
            tracker.forget(victim.getKey());
            evictionCount++;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry due to size limit: key=" + victim.getKey()
                        + ", accessCount=" + victim.getAccessCount());
            }
            fireRemovalEvent(victim, RemovalCause.SIZE);
        }
    }

    /**
     * Returns the lowest-scoring item: least frequently used first, least recently used second.
     * The first item reached wins a tie.
     */
    private CacheItem<V> findEvictionCandidate(Map<String, CacheItem<V>> tier, long now) {
        CacheItem<V> candidate = null;
        double minScore = Double.POSITIVE_INFINITY;
        for (CacheItem<V> item : tier.values()) {
            double score = score(item, now);
            if (score < minScore) {
                minScore = score;
                candidate = item;
            }
        }
        return candidate;
    }

    static double score(CacheItem<?> item, long now) {
        double frequency = (double) item.getAccessCount() / Math.max(1, item.ageMillis(now));
        return frequency * SCORE_SCALE - item.idleMillis(now);
    }

    private void removeExpired(long now) {
        for (CacheItem<V> item : snapshot()) {
            if (item.isExpired(now)) {
                removeItem(item, RemovalCause.EXPIRED);
            }
        }
    }

    private void demoteIdle(CachePriority tier, long idleNanos, long now) {
        List<CacheItem<V>> idle = new ArrayList<>();
        for (CacheItem<V> item : tiers.get(tier).values()) {
            if (now - item.getLastAccessTime() > idleNanos) {
                idle.add(item);
            }
        }
        CachePriority colder = tier.colder();
        for (CacheItem<V> item : idle) {
            tiers.get(tier).remove(item.getKey());
            insert(item, colder, now);
        }
        if (!idle.isEmpty() && LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Demoted " + idle.size() + " idle item(s) from " + tier + " to " + colder);
        }
    }

    private void removeItem(CacheItem<V> item, RemovalCause cause) {
        tiers.get(item.getPriority()).remove(item.getKey());
        tracker.forget(item.getKey());
        fireRemovalEvent(item, cause);
    }

    private int dropAll(RemovalCause cause) {
        List<CacheItem<V>> items = snapshot();
        for (Map<String, CacheItem<V>> tier : tiers.values()) {
            tier.clear();
        }
        tracker.clear();
        for (CacheItem<V> item : items) {
            fireRemovalEvent(item, cause);
        }
        return items.size();
    }

    /**
     * Queues a removal notification. It is delivered by {@link #unlockAndNotify()} once the lock
     * is released, so a listener may call back into the cache or its owner.
     */
    private void fireRemovalEvent(CacheItem<V> item, RemovalCause cause) {
        if (removalListener != null) {
            pendingRemovals.add(new PendingRemoval<>(item.getKey(), item.getValue(), cause));
        }
    }

    /**
     * Releases the lock and delivers the removal notifications queued while it was held.
     */
    private void unlockAndNotify() {
        List<PendingRemoval<V>> removals = null;
        if (lock.getHoldCount() == 1 && !pendingRemovals.isEmpty()) {
            removals = new ArrayList<>(pendingRemovals);
            pendingRemovals.clear();
        }
        lock.unlock();
        if (removals == null) {
            return;
        }
        for (PendingRemoval<V> removal : removals) {
            try {
                removalListener.onRemoval(removal.key, removal.value, removal.cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + removal.key
                        + ", cause: " + removal.cause, e);
            }
        }
    }

    private static final class PendingRemoval<V> {
        final String key;
        final V value;
        final RemovalCause cause;

        PendingRemoval(String key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}
