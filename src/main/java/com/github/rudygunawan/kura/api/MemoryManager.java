package com.github.rudygunawan.kura.api;

import com.github.rudygunawan.kura.model.CacheInfo;
import com.github.rudygunawan.kura.model.CacheOptions;
import com.github.rudygunawan.kura.model.MemoryStats;

/**
 * An in-process memory manager: a three-tier hot/warm/cold cache plus a table of weak references,
 * kept tidy by a memory monitor and a periodic cleanup.
 *
 * <p>This is the whole surface host code sees. Construct one instance at startup with
 * {@code MemoryManagerBuilder} and hand it to the collaborators that need it.
 *
 * <p>{@code get}, {@code set} and {@code delete} never throw for non-null arguments. A missing
 * value is reported as {@code null}. Monitoring and cleanup are safety nets only; a manager that
 * is never inspected or destroyed still caches correctly.
 *
 * <p>Implementations are thread-safe.
 *
 * @param <V> the type of cached values
 */
public interface MemoryManager<V> extends AutoCloseable {

    /**
     * Returns the value cached under {@code key} in the tiers, or {@code null}.
     * Weakly held values are not visible here; use {@link #getWeakRef(String)}.
     *
     * @param key the key
     * @return the cached value, or {@code null} if absent or expired
     */
    V get(String key);

    /**
     * Caches {@code value} under {@code key} with no hints.
     */
    default void set(String key, V value) {
        set(key, value, CacheOptions.defaults());
    }

    /**
     * Caches {@code value} under {@code key}, replacing any previous tiered or weak entry.
     *
     * <p>With {@link CacheOptions#isWeak()} set, weak references enabled and a reference-typed value,
     * the value is held weakly instead of in the tiers.
     *
     * @param key the key
     * @param value the value
     * @param options write hints
     */
    void set(String key, V value, CacheOptions options);

    /**
     * Removes {@code key} from the tiers and from the weak-reference table.
     *
     * @return true if anything was removed
     */
    boolean delete(String key);

    /**
     * Removes every tiered item carrying {@code tag}.
     *
     * @return the number of items removed
     */
    int invalidateTag(String tag);

    /**
     * Removes everything from the tiers and the weak-reference table and resets the counters.
     */
    void clear();

    /**
     * Holds {@code target} weakly under {@code key}. No-op when weak references are disabled.
     */
    void createWeakRef(String key, V target);

    /**
     * Returns the weakly held value under {@code key}, or {@code null} if there is none or it has
     * been garbage collected.
     */
    V getWeakRef(String key);

    /**
     * Runs expiry and tier rebalancing now, followed by a cleanup pass.
     */
    void optimize();

    /**
     * Returns a snapshot of the manager's figures and monitor flags. Takes a fresh memory sample;
     * writes never sample.
     */
    MemoryStats getStats();

    /**
     * Returns the raw tier, memory and weak-reference figures.
     */
    CacheInfo getCacheInfo();

    /**
     * Stops the monitor and cleanup timers, drops all data and resets the statistics.
     * Safe to call more than once.
     */
    void destroy();

    /**
     * Same as {@link #destroy()}.
     */
    @Override
    default void close() {
        destroy();
    }
}
