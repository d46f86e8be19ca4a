package com.github.rudygunawan.kura.api;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SizeEstimatorTest {

    private final SizeEstimator<Object> heuristic = SizeEstimator.heuristic();

    @Test
    void testHeuristicSizes() {
        assertEquals(10, heuristic.estimate("hello"));
        assertEquals(8, heuristic.estimate(42L));
        assertEquals(4, heuristic.estimate(Boolean.TRUE));
        assertEquals(2, heuristic.estimate('x'));
        assertEquals(16, heuristic.estimate(new byte[16]));
        assertEquals(150, heuristic.estimate(new String[3]));
        assertEquals(100, heuristic.estimate(List.of(1, 2)));
        assertEquals(200, heuristic.estimate(Map.of("a", 1, "b", 2)));
        assertEquals(100, heuristic.estimate(new Object()));
        assertEquals(0, heuristic.estimate(null));
    }

    @Test
    void testHeapSamplerReportsUsage() {
        assertTrue(MemorySampler.heapUsage().sample() > 0);
    }
}
