package com.github.rudygunawan.kura.metrics;

import com.github.rudygunawan.kura.model.CachePriority;

/**
 * Interface for memory managers to provide metrics data.
 * This is used by MicrometerMemoryMetrics to collect and expose metrics.
 */
public interface MemoryMetrics {

    /**
     * Returns the number of items resident across all tiers.
     */
    long size();

    /**
     * Returns the number of items resident in one tier.
     */
    long tierSize(CachePriority tier);

    /**
     * Returns the estimated bytes held by one tier.
     */
    long tierMemoryBytes(CachePriority tier);

    long hitCount();

    long missCount();

    /**
     * Returns the number of items discarded because the cold tier was full.
     */
    long evictionCount();

    long weakRefCount();

    /**
     * Returns the estimated bytes held by the tiers and the weak references together.
     */
    long estimatedMemoryUsageBytes();

    /**
     * Returns the most recent memory sample in bytes, as taken by the monitor timer, a cleanup
     * pass or {@code getStats}.
     */
    long sampledMemoryBytes();

    /**
     * Returns the last sample divided by the critical threshold.
     */
    double memoryPressure();

    boolean isWarning();

    boolean isCritical();
}
