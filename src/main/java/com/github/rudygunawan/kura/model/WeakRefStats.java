package com.github.rudygunawan.kura.model;

/**
 * Count and summed metadata size of the weak references currently tracked.
 */
public final class WeakRefStats {
    private final int count;
    private final long totalSize;

    public WeakRefStats(int count, long totalSize) {
        this.count = count;
        this.totalSize = totalSize;
    }

    public int count() {
        return count;
    }

    public long totalSize() {
        return totalSize;
    }

    @Override
    public String toString() {
        return "WeakRefStats{count=" + count + ", totalSize=" + totalSize + '}';
    }
}
