package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.policy.CleanupStrategy;
import com.github.rudygunawan.kura.policy.MemoryLevel;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for threshold classification and pressure grading.
 */
class MemoryMonitorTest {

    private final AtomicLong memory = new AtomicLong();
    private final MemoryMonitor monitor = new MemoryMonitor(memory::get, 1000, 2000);

    @Test
    void testLevelsFollowEachSample() {
        memory.set(999);
        assertEquals(MemoryLevel.NORMAL, monitor.check());

        memory.set(1000);
        assertEquals(MemoryLevel.WARNING, monitor.check());

        memory.set(2000);
        assertEquals(MemoryLevel.CRITICAL, monitor.check());
        assertEquals(MemoryLevel.CRITICAL, monitor.level());

        memory.set(10);
        assertEquals(MemoryLevel.NORMAL, monitor.check(), "one low sample clears the flags");
    }

    @Test
    void testFailingSamplerReadsAsZero() {
        MemoryMonitor failing = new MemoryMonitor(() -> {
            throw new IllegalStateException("sampler unavailable");
        }, 1000, 2000);

        assertEquals(0, failing.sample());
        assertEquals(MemoryLevel.NORMAL, failing.check());
    }

    @Test
    void testPressureEscalatesCleanup() {
        memory.set(1000);
        monitor.sample();
        assertEquals(0.5, monitor.pressure(), 0.0001);
        assertEquals(CleanupStrategy.CONSERVATIVE, monitor.selectCleanup(CleanupStrategy.CONSERVATIVE, false));

        memory.set(1600);
        monitor.sample();
        assertEquals(CleanupStrategy.MODERATE, monitor.selectCleanup(CleanupStrategy.CONSERVATIVE, false));
        assertEquals(CleanupStrategy.AGGRESSIVE, monitor.selectCleanup(CleanupStrategy.AGGRESSIVE, false));

        memory.set(1900);
        monitor.sample();
        assertEquals(CleanupStrategy.AGGRESSIVE, monitor.selectCleanup(CleanupStrategy.CONSERVATIVE, false));
    }

    @Test
    void testLeakForcesAggressiveCleanup() {
        memory.set(0);
        monitor.sample();

        assertEquals(CleanupStrategy.AGGRESSIVE, monitor.selectCleanup(CleanupStrategy.CONSERVATIVE, true));
    }

    @Test
    void testAdaptiveDelay() {
        memory.set(1700);
        monitor.sample();
        assertEquals(500, monitor.nextDelay(1000));

        memory.set(1200);
        monitor.sample();
        assertEquals(1000, monitor.nextDelay(1000));

        memory.set(100);
        monitor.sample();
        assertEquals(2000, monitor.nextDelay(1000));
    }

    @Test
    void testResetForgetsLevel() {
        memory.set(5000);
        monitor.check();

        monitor.reset();

        assertEquals(MemoryLevel.NORMAL, monitor.level());
        assertEquals(0, monitor.lastSample());
    }

    @Test
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(memory::get, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(memory::get, 20, 10));
    }
}
