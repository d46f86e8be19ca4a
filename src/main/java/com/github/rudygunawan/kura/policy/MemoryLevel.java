package com.github.rudygunawan.kura.policy;

/**
 * Memory level reported by the monitor for the latest sample. There is no hysteresis: each
 * sample is classified on its own.
 */
public enum MemoryLevel {
    /** Below the warning threshold. No cleanup is triggered. */
    NORMAL(null),

    /** At or above the warning threshold. Triggers a moderate cleanup. */
    WARNING(CleanupStrategy.MODERATE),

    /** At or above the critical threshold. Triggers an aggressive cleanup. */
    CRITICAL(CleanupStrategy.AGGRESSIVE);

    private final CleanupStrategy response;

    MemoryLevel(CleanupStrategy response) {
        this.response = response;
    }

    /**
     * Returns the cleanup this level triggers, or {@code null} for {@link #NORMAL}.
     */
    public CleanupStrategy response() {
        return response;
    }

    public boolean isWarning() {
        return this != NORMAL;
    }

    public boolean isCritical() {
        return this == CRITICAL;
    }
}
