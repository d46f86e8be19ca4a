package com.github.rudygunawan.kura.policy;

/**
 * The reason why a cached item left the tiers.
 */
public enum RemovalCause {
    /**
     * The item was removed by {@code delete}, {@code clear} or tag invalidation.
     */
    EXPLICIT,

    /**
     * The item was replaced by a new write under the same key.
     */
    REPLACED,

    /**
     * The item was evicted from a full cold tier.
     */
    SIZE,

    /**
     * The item outlived its TTL.
     */
    EXPIRED,

    /**
     * The item was discarded by a memory-pressure cleanup pass.
     */
    CLEANUP;

    /**
     * Returns {@code true} if the cache removed the item on its own rather than at the caller's request.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED || this == CLEANUP;
    }
}
