package com.github.rudygunawan.kura.api;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * Estimates the byte footprint of a cached value. The estimate feeds the per-tier memory figures,
 * the default memory sampler and the weak-reference totals; it does not affect eviction order.
 *
 * <p>Estimates only need to be proportional to the real footprint. The estimator runs on every
 * write, so keep it cheap and avoid deep traversal.
 *
 * <pre>{@code
 * SizeEstimator<byte[]> bytes = value -> value.length;
 * }</pre>
 *
 * @param <V> the type of values
 */
@FunctionalInterface
public interface SizeEstimator<V> {

    /**
     * Returns the estimated footprint of {@code value} in bytes. Must not be negative.
     *
     * @param value the value to estimate, may be null
     * @return the estimated size in bytes
     */
    long estimate(V value);

    /**
     * Returns the default heuristic: strings 2 bytes per char, numbers 8, booleans 4,
     * characters 2, byte arrays their length, other arrays 50 per element, collections 50 per
     * element, maps 100 per entry, null 0, anything else 100.
     */
    static SizeEstimator<Object> heuristic() {
        return HeuristicEstimator.INSTANCE;
    }

    /**
     * Default heuristic implementation.
     */
    enum HeuristicEstimator implements SizeEstimator<Object> {
        INSTANCE;

        @Override
        public long estimate(Object value) {
            if (value == null) {
                return 0;
            }
            if (value instanceof CharSequence) {
                return ((CharSequence) value).length() * 2L;
            }
            if (value instanceof Number) {
                return 8;
            }
            if (value instanceof Boolean) {
                return 4;
            }
            if (value instanceof Character) {
                return 2;
            }
            if (value instanceof byte[]) {
                return ((byte[]) value).length;
            }
            if (value.getClass().isArray()) {
                return Array.getLength(value) * 50L;
            }
            if (value instanceof Collection) {
                return ((Collection<?>) value).size() * 50L;
            }
            if (value instanceof Map) {
                return ((Map<?, ?>) value).size() * 100L;
            }
            return 100;
        }

        @Override
        public String toString() {
            return "SizeEstimator.heuristic()";
        }
    }
}
