package com.github.rudygunawan.kura.model;

import java.util.Objects;

/**
 * Statistics about a tiered cache. Instances of this class are immutable.
 *
 * <ul>
 *   <li>A lookup that finds a live item in any tier increments {@code hitCount}.
 *   <li>A lookup that finds nothing, or finds an expired item, increments {@code missCount}.
 *   <li>An item discarded because L3 was full increments {@code evictionCount}. Items that sink
 *       from L1 to L2 or from L2 to L3 are not counted: they are still cached.
 * </ul>
 */
public class TierStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final int l1Size;
    private final int l2Size;
    private final int l3Size;

    public TierStats(long hitCount, long missCount, long evictionCount,
                     int l1Size, int l2Size, int l3Size) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.l1Size = l1Size;
        this.l2Size = l2Size;
        this.l3Size = l3Size;
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns {@code hitCount / (hitCount + missCount)}, or {@code 0.0} when nothing was looked up.
     */
    public double hitRate() {
        long requestCount = hitCount + missCount;
        return (requestCount == 0) ? 0.0 : (double) hitCount / requestCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    public int l1Size() {
        return l1Size;
    }

    public int l2Size() {
        return l2Size;
    }

    public int l3Size() {
        return l3Size;
    }

    /**
     * Returns the number of items resident across all three tiers.
     */
    public int totalSize() {
        return l1Size + l2Size + l3Size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, evictionCount, l1Size, l2Size, l3Size);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof TierStats)) {
            return false;
        }
        TierStats other = (TierStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount
                && l1Size == other.l1Size
                && l2Size == other.l2Size
                && l3Size == other.l3Size;
    }

    @Override
    public String toString() {
        return "TierStats{"
                + "l1Size=" + l1Size
                + ", l2Size=" + l2Size
                + ", l3Size=" + l3Size
                + ", evictionCount=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
