package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.api.MemorySampler;
import com.github.rudygunawan.kura.policy.CleanupStrategy;
import com.github.rudygunawan.kura.policy.MemoryLevel;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies memory samples as {@link MemoryLevel#NORMAL}, {@link MemoryLevel#WARNING} or
 * {@link MemoryLevel#CRITICAL} and grades cleanup passes by memory pressure, the ratio of the
 * last sample to the critical threshold.
 *
 * <p>Every sample is classified on its own; one sample over a threshold changes the level
 * immediately, and one sample under it changes it back.
 */
public class MemoryMonitor {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Memory");

    private final MemorySampler sampler;
    private final long warningThreshold;
    private final long criticalThreshold;

    private long lastSample;
    private MemoryLevel level = MemoryLevel.NORMAL;

    /**
     * @param sampler the memory source
     * @param warningThreshold bytes at which the level becomes WARNING
     * @param criticalThreshold bytes at which the level becomes CRITICAL
     * @throws IllegalArgumentException if a threshold is not positive or warning exceeds critical
     */
    public MemoryMonitor(MemorySampler sampler, long warningThreshold, long criticalThreshold) {
        if (warningThreshold <= 0 || criticalThreshold <= 0) {
            throw new IllegalArgumentException("memory thresholds must be positive, got warning="
                    + warningThreshold + ", critical=" + criticalThreshold);
        }
        if (warningThreshold > criticalThreshold) {
            throw new IllegalArgumentException("warning threshold " + warningThreshold
                    + " exceeds critical threshold " + criticalThreshold);
        }
        this.sampler = sampler;
        this.warningThreshold = warningThreshold;
        this.criticalThreshold = criticalThreshold;
    }

    /**
     * Reads the sampler and remembers the result. A failing sampler reads as 0.
     *
     * @return the sampled bytes
     */
    public long sample() {
        long sampled = readSampler();
        synchronized (this) {
            lastSample = sampled;
        }
        return sampled;
    }

    /**
     * Samples memory and reclassifies the level.
     *
     * @return the new level
     */
    public MemoryLevel check() {
        long sampled = readSampler();
        synchronized (this) {
            lastSample = sampled;
            MemoryLevel next;
            if (sampled >= criticalThreshold) {
                next = MemoryLevel.CRITICAL;
            } else if (sampled >= warningThreshold) {
                next = MemoryLevel.WARNING;
            } else {
                next = MemoryLevel.NORMAL;
            }
            if (next != level && LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Memory level changed from " + level + " to " + next + ": sampled="
                        + sampled + " bytes, warning=" + warningThreshold + ", critical=" + criticalThreshold);
            }
            level = next;
            return next;
        }
    }

    // The sampler may take other locks, so it is never called while this monitor is held
    private long readSampler() {
        try {
            return Math.max(0, sampler.sample());
        } catch (RuntimeException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Memory sampler failed, assuming zero usage", e);
            }
            return 0;
        }
    }

    /**
     * Returns {@code lastSample / criticalThreshold}.
     */
    public synchronized double pressure() {
        return (double) lastSample / criticalThreshold;
    }

    /**
     * Picks the cleanup to run: the strongest of the requested strategy, the strategy the current
     * pressure calls for, and {@link CleanupStrategy#AGGRESSIVE} when a leak is suspected.
     */
    public synchronized CleanupStrategy selectCleanup(CleanupStrategy requested, boolean leakSuspected) {
        if (leakSuspected) {
            return CleanupStrategy.AGGRESSIVE;
        }
        return requested.atLeast(CleanupStrategy.forPressure(pressure()));
    }

    /**
     * Returns the delay before the next adaptive check: half the base interval above 0.8 pressure,
     * the base interval above 0.5, and double it otherwise.
     */
    public synchronized long nextDelay(long baseInterval) {
        double pressure = pressure();
        if (pressure > 0.8) {
            return Math.max(1, baseInterval / 2);
        }
        if (pressure > 0.5) {
            return baseInterval;
        }
        return baseInterval * 2;
    }

    public synchronized long lastSample() {
        return lastSample;
    }

    public synchronized MemoryLevel level() {
        return level;
    }

    /**
     * Forgets the last sample and returns to {@link MemoryLevel#NORMAL}.
     */
    public synchronized void reset() {
        lastSample = 0;
        level = MemoryLevel.NORMAL;
    }
}
