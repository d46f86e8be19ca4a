package com.github.rudygunawan.kura.policy;

/**
 * How much a cleanup pass is allowed to throw away, from least to most.
 *
 * <ul>
 *   <li>{@link #CONSERVATIVE} - expired items, tier rebalancing, dead weak references
 *   <li>{@link #MODERATE} - the above, plus the older half of the cold tier
 *   <li>{@link #AGGRESSIVE} - every tiered item and every weak reference
 * </ul>
 */
public enum CleanupStrategy {
    CONSERVATIVE,
    MODERATE,
    AGGRESSIVE;

    /**
     * Returns whichever of the two strategies discards more.
     */
    public CleanupStrategy atLeast(CleanupStrategy other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    /**
     * Selects a strategy from the memory pressure ratio, {@code sampled / criticalThreshold}.
     * Above 0.9 is aggressive, above 0.7 is moderate, anything lower is conservative.
     */
    public static CleanupStrategy forPressure(double pressure) {
        if (pressure > 0.9) {
            return AGGRESSIVE;
        }
        if (pressure > 0.7) {
            return MODERATE;
        }
        return CONSERVATIVE;
    }
}
