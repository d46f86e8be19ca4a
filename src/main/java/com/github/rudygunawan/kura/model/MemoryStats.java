package com.github.rudygunawan.kura.model;

import java.util.Objects;

/**
 * Point-in-time snapshot of a memory manager: the last sampled memory figure, the tier
 * breakdown, weak-reference count, hit rate, evictions, and the monitor flags.
 * Instances of this class are immutable.
 *
 * <p>A destroyed or freshly cleared manager reports {@link #empty()}.
 */
public final class MemoryStats {
    /** Value of {@link #lastCleanupNanos()} before any cleanup pass has run. */
    public static final long NEVER = -1L;

    private static final MemoryStats EMPTY = new MemoryStats(0,
            new TierStats(0, 0, 0, 0, 0, 0), MemoryUsage.empty(), new WeakRefStats(0, 0),
            false, false, NEVER);

    private final long totalMemory;
    private final TierStats tiers;
    private final MemoryUsage usage;
    private final WeakRefStats weakRefs;
    private final boolean warning;
    private final boolean critical;
    private final long lastCleanupNanos;

    private MemoryStats(long totalMemory, TierStats tiers, MemoryUsage usage, WeakRefStats weakRefs,
                        boolean warning, boolean critical, long lastCleanupNanos) {
        this.totalMemory = totalMemory;
        this.tiers = tiers;
        this.usage = usage;
        this.weakRefs = weakRefs;
        this.warning = warning;
        this.critical = critical;
        this.lastCleanupNanos = lastCleanupNanos;
    }

    public static MemoryStats of(long totalMemory, TierStats tiers, MemoryUsage usage,
                                 WeakRefStats weakRefs, boolean warning, boolean critical,
                                 long lastCleanupNanos) {
        return new MemoryStats(totalMemory, Objects.requireNonNull(tiers),
                Objects.requireNonNull(usage), Objects.requireNonNull(weakRefs),
                warning, critical, lastCleanupNanos);
    }

    /**
     * Returns the zero-state snapshot.
     */
    public static MemoryStats empty() {
        return EMPTY;
    }

    /**
     * Returns the most recent memory sample in bytes, as read by the configured sampler.
     */
    public long totalMemory() {
        return totalMemory;
    }

    /**
     * Returns the estimated bytes held across all tiers.
     */
    public long cacheMemory() {
        return usage.total();
    }

    public long l1Memory() {
        return usage.l1();
    }

    public long l2Memory() {
        return usage.l2();
    }

    public long l3Memory() {
        return usage.l3();
    }

    public int l1Size() {
        return tiers.l1Size();
    }

    public int l2Size() {
        return tiers.l2Size();
    }

    public int l3Size() {
        return tiers.l3Size();
    }

    public int weakRefCount() {
        return weakRefs.count();
    }

    public long weakRefMemory() {
        return weakRefs.totalSize();
    }

    public double cacheHitRate() {
        return tiers.hitRate();
    }

    public long evictionCount() {
        return tiers.evictionCount();
    }

    public boolean isWarning() {
        return warning;
    }

    public boolean isCritical() {
        return critical;
    }

    /**
     * Returns the ticker reading of the last cleanup pass, or {@link #NEVER}.
     */
    public long lastCleanupNanos() {
        return lastCleanupNanos;
    }

    public boolean hasCleanedUp() {
        return lastCleanupNanos != NEVER;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalMemory, tiers, usage.total(), weakRefs.count(), warning, critical,
                lastCleanupNanos);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof MemoryStats)) {
            return false;
        }
        MemoryStats other = (MemoryStats) obj;
        return totalMemory == other.totalMemory
                && tiers.equals(other.tiers)
                && usage.l1() == other.usage.l1()
                && usage.l2() == other.usage.l2()
                && usage.l3() == other.usage.l3()
                && weakRefs.count() == other.weakRefs.count()
                && weakRefs.totalSize() == other.weakRefs.totalSize()
                && warning == other.warning
                && critical == other.critical
                && lastCleanupNanos == other.lastCleanupNanos;
    }

    @Override
    public String toString() {
        return "MemoryStats{"
                + "totalMemory=" + totalMemory
                + ", cacheMemory=" + cacheMemory()
                + ", l1Memory=" + l1Memory()
                + ", l2Memory=" + l2Memory()
                + ", l3Memory=" + l3Memory()
                + ", weakRefCount=" + weakRefCount()
                + ", cacheHitRate=" + String.format("%.2f%%", cacheHitRate() * 100)
                + ", evictionCount=" + evictionCount()
                + ", warning=" + warning
                + ", critical=" + critical
                + '}';
    }
}
