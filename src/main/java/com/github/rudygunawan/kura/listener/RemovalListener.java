package com.github.rudygunawan.kura.listener;

import com.github.rudygunawan.kura.policy.RemovalCause;

/**
 * A listener that receives notification when an item leaves the tiered cache for good.
 * Moves between tiers are not removals and are not reported.
 *
 * <p>Called synchronously while the cache lock is held, so implementations must be fast and
 * must not call back into the manager. Exceptions are logged and otherwise ignored.
 *
 * <pre>{@code
 * MemoryManager<Route> manager = MemoryManagerBuilder.newBuilder()
 *     .<Route>removalListener((key, route, cause) -> {
 *         if (cause.wasEvicted()) {
 *             stats.recordDrop(key);
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * Notifies the listener that an item was removed.
     *
     * @param key the key of the removed item
     * @param value the value of the removed item
     * @param cause the reason for the removal
     */
    void onRemoval(String key, V value, RemovalCause cause);
}
