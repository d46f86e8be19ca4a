package com.github.rudygunawan.kura.model;

/**
 * Temperature of a cached item. The priority of an item is also the tier that currently holds it:
 * {@link #HOT} lives in L1, {@link #WARM} in L2 and {@link #COLD} in L3.
 *
 * <p>Lookups probe the tiers from hottest to coldest, so hot data is the cheapest to find.
 */
public enum CachePriority {
    /** L1, the smallest and first-probed tier. */
    HOT(1),

    /** L2. */
    WARM(2),

    /** L3, the last tier. Eviction from here discards the item. */
    COLD(3);

    private final int level;

    CachePriority(int level) {
        this.level = level;
    }

    /**
     * Returns the tier number, 1 for L1 through 3 for L3.
     */
    public int level() {
        return level;
    }

    /**
     * Returns the next hotter tier, or {@code null} if this is already L1.
     */
    public CachePriority hotter() {
        return switch (this) {
            case COLD -> WARM;
            case WARM -> HOT;
            case HOT -> null;
        };
    }

    /**
     * Returns the next colder tier, or {@code null} if this is already L3.
     */
    public CachePriority colder() {
        return switch (this) {
            case HOT -> WARM;
            case WARM -> COLD;
            case COLD -> null;
        };
    }
}
