package com.github.rudygunawan.kura.api;

import java.lang.management.ManagementFactory;

/**
 * Source of the memory figure the monitor compares against the warning and critical thresholds.
 *
 * <p>When no sampler is configured the manager samples its own estimated footprint (tier bytes
 * plus weak-reference bytes), which matches the default thresholds of 10 MB and 20 MB. Use
 * {@link #heapUsage()} to watch the whole JVM heap instead, with thresholds sized accordingly.
 *
 * <p>A sampler that throws is read as 0: caching never depends on monitoring being available.
 */
@FunctionalInterface
public interface MemorySampler {

    /**
     * Returns the current memory usage in bytes.
     *
     * @return the sampled usage
     */
    long sample();

    /**
     * Returns a sampler reading used heap from the platform {@code MemoryMXBean}.
     */
    static MemorySampler heapUsage() {
        return HeapSampler.INSTANCE;
    }

    /**
     * Heap sampler backed by JMX.
     */
    enum HeapSampler implements MemorySampler {
        INSTANCE;

        @Override
        public long sample() {
            return ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed();
        }

        @Override
        public String toString() {
            return "MemorySampler.heapUsage()";
        }
    }
}
