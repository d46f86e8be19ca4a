package com.github.rudygunawan.kura.policy;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sliding window of recent access timestamps per key.
 *
 * <p>Each key keeps a ring of ticker readings, oldest first. Every {@link #recordAccess} drops
 * readings older than the retention window, so a key's window stays bounded without a separate
 * sweep. The ring is also capped at {@value #MAX_SAMPLES_PER_KEY} readings; counts above that
 * are never needed by the promotion and priority thresholds.
 *
 * <p>Keys are only forgotten through {@link #forget(String)} or {@link #clear()}. The owning cache
 * must forget a key once it leaves every tier.
 *
 * <p>Not thread-safe. The owning cache guards it with its own lock.
 */
public class AccessPatternTracker {
    /** Default retention window: two minutes. */
    public static final long DEFAULT_RETENTION_NANOS = TimeUnit.MINUTES.toNanos(2);

    static final int MAX_SAMPLES_PER_KEY = 128;

    private final long retentionNanos;
    private final Map<String, ArrayDeque<Long>> windows = new HashMap<>();

    public AccessPatternTracker() {
        this(DEFAULT_RETENTION_NANOS);
    }

    public AccessPatternTracker(long retentionNanos) {
        if (retentionNanos <= 0) {
            throw new IllegalArgumentException("retention must be positive, got: " + retentionNanos);
        }
        this.retentionNanos = retentionNanos;
    }

    /**
     * Appends {@code timestamp} to the key's window and prunes readings outside the retention window.
     *
     * @param key the accessed key
     * @param timestamp the ticker reading of the access, in nanoseconds
     */
    public void recordAccess(String key, long timestamp) {
        ArrayDeque<Long> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        window.addLast(timestamp);

        long cutoff = timestamp - retentionNanos;
        while (!window.isEmpty() && (window.peekFirst() <= cutoff || window.size() > MAX_SAMPLES_PER_KEY)) {
            window.pollFirst();
        }
    }

    /**
     * Returns how many recorded accesses of {@code key} are less than {@code windowNanos} old.
     *
     * @param key the key
     * @param windowNanos the look-back window in nanoseconds
     * @param now the current ticker reading
     * @return the access count, 0 for unknown keys
     */
    public int recentAccessCount(String key, long windowNanos, long now) {
        ArrayDeque<Long> window = windows.get(key);
        if (window == null) {
            return 0;
        }
        int count = 0;
        Iterator<Long> newestFirst = window.descendingIterator();
        while (newestFirst.hasNext()) {
            if (now - newestFirst.next() >= windowNanos) {
                break;
            }
            count++;
        }
        return count;
    }

    /**
     * Returns true if the key has any readings in its window.
     */
    public boolean isTracked(String key) {
        ArrayDeque<Long> window = windows.get(key);
        return window != null && !window.isEmpty();
    }

    public void forget(String key) {
        windows.remove(key);
    }

    public void clear() {
        windows.clear();
    }

    /**
     * Returns the number of keys with a window.
     */
    public int trackedKeyCount() {
        return windows.size();
    }
}
