package com.github.rudygunawan.kura.model;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * One cached value and its bookkeeping.
 *
 * <p>Items are created by a write, mutated by reads and tier moves, and dropped on delete, clear,
 * eviction or TTL expiry. The creation time never changes after insertion. All times are ticker
 * readings in nanoseconds.
 *
 * <p>Instances are owned by a single tiered cache and are only mutated while its lock is held.
 *
 * @param <V> the type of the cached value
 */
public class CacheItem<V> {
    private final String key;
    private final V value;
    private final long size;
    private final long createTime;
    private final long ttlNanos;
    private final Set<String> tags;

    private CachePriority priority;
    private long accessCount;
    private long lastAccessTime;

    /**
     * Creates a new item.
     *
     * @param key the key
     * @param value the value
     * @param size the estimated footprint in bytes
     * @param priority the tier the item is placed in
     * @param now the current ticker reading
     * @param ttlNanos the lifespan in nanoseconds, or 0 for no expiration
     * @param tags caller-defined labels, may be empty
     */
    public CacheItem(String key, V value, long size, CachePriority priority, long now,
                     long ttlNanos, Set<String> tags) {
        this.key = key;
        this.value = value;
        this.size = size;
        this.priority = priority;
        this.createTime = now;
        this.lastAccessTime = now;
        this.accessCount = 1;
        this.ttlNanos = ttlNanos;
        this.tags = tags == null ? Collections.emptySet() : Set.copyOf(tags);
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /**
     * Returns the estimated footprint of this item in bytes.
     */
    public long getSize() {
        return size;
    }

    /**
     * Returns the priority, which is also the tier currently holding this item.
     */
    public CachePriority getPriority() {
        return priority;
    }

    public void setPriority(CachePriority priority) {
        this.priority = priority;
    }

    public long getAccessCount() {
        return accessCount;
    }

    public long getLastAccessTime() {
        return lastAccessTime;
    }

    public long getCreateTime() {
        return createTime;
    }

    /**
     * Returns the lifespan in nanoseconds, or 0 if this item never expires.
     */
    public long getTtlNanos() {
        return ttlNanos;
    }

    public Set<String> getTags() {
        return tags;
    }

    /**
     * Counts a read hit at the given time.
     */
    public void recordAccess(long now) {
        accessCount++;
        lastAccessTime = now;
    }

    /**
     * Returns true once more than the TTL has elapsed since creation.
     */
    public boolean isExpired(long now) {
        return ttlNanos > 0 && now - createTime > ttlNanos;
    }

    /**
     * Returns the milliseconds since this item was last read (or written).
     */
    public long idleMillis(long now) {
        return TimeUnit.NANOSECONDS.toMillis(now - lastAccessTime);
    }

    /**
     * Returns the milliseconds since this item was created.
     */
    public long ageMillis(long now) {
        return TimeUnit.NANOSECONDS.toMillis(now - createTime);
    }

    @Override
    public String toString() {
        return "CacheItem{key='" + key + "', priority=" + priority
                + ", size=" + size + ", accessCount=" + accessCount + '}';
    }
}
