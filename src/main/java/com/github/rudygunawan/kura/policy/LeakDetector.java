package com.github.rudygunawan.kura.policy;

import java.util.concurrent.TimeUnit;

/**
 * Flags sustained memory growth.
 *
 * <p>Each sample is compared with the previous one. Growth by more than {@value #GROWTH_FACTOR}x
 * extends the streak, anything else resets it. A leak is reported once the streak reaches
 * {@value #STREAK_LENGTH} and the first observation is more than ten minutes old; the detector
 * then starts over.
 *
 * <p>Not thread-safe. Callers serialize access.
 */
public class LeakDetector {
    static final double GROWTH_FACTOR = 1.3;
    static final int STREAK_LENGTH = 5;
    static final long MIN_OBSERVATION_NANOS = TimeUnit.MINUTES.toNanos(10);

    private boolean observing;
    private long previousSample;
    private long firstSeen;
    private int streak;

    /**
     * Records a sample.
     *
     * @param sample the sampled memory in bytes
     * @param now the current ticker reading
     * @return true if this sample completes a suspected leak
     */
    public boolean record(long sample, long now) {
        if (!observing) {
            observing = true;
            previousSample = sample;
            firstSeen = now;
            streak = 0;
            return false;
        }

        if (sample > previousSample * GROWTH_FACTOR) {
            streak++;
            if (streak >= STREAK_LENGTH && now - firstSeen > MIN_OBSERVATION_NANOS) {
                reset();
                return true;
            }
        } else {
            streak = 0;
        }
        previousSample = sample;
        return false;
    }

    public int streak() {
        return streak;
    }

    public void reset() {
        observing = false;
        previousSample = 0;
        firstSeen = 0;
        streak = 0;
    }
}
