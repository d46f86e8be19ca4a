package com.github.rudygunawan.kura.model;

/**
 * The raw per-subsystem figures behind {@link MemoryStats}.
 */
public final class CacheInfo {
    private final TierStats cache;
    private final MemoryUsage memory;
    private final WeakRefStats weakRefs;

    public CacheInfo(TierStats cache, MemoryUsage memory, WeakRefStats weakRefs) {
        this.cache = cache;
        this.memory = memory;
        this.weakRefs = weakRefs;
    }

    public TierStats cache() {
        return cache;
    }

    public MemoryUsage memory() {
        return memory;
    }

    public WeakRefStats weakRefs() {
        return weakRefs;
    }

    @Override
    public String toString() {
        return "CacheInfo{cache=" + cache + ", memory=" + memory + ", weakRefs=" + weakRefs + '}';
    }
}
