package com.github.rudygunawan.kura.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Optional hints for a single write. Instances are immutable.
 *
 * <pre>{@code
 * manager.set("route:/users", compiled, CacheOptions.builder()
 *     .priority(CachePriority.HOT)
 *     .ttl(5, TimeUnit.MINUTES)
 *     .tags("routes")
 *     .build());
 * }</pre>
 */
public final class CacheOptions {
    private static final long UNSET = -1;
    private static final CacheOptions DEFAULTS = builder().build();

    private final CachePriority priority;
    private final long ttlNanos;
    private final Set<String> tags;
    private final long size;
    private final boolean weak;

    private CacheOptions(Builder builder) {
        this.priority = builder.priority;
        this.ttlNanos = builder.ttlNanos;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.size = builder.size;
        this.weak = builder.weak;
    }

    /**
     * Returns options with no hints: inferred priority, no TTL, no tags, estimated size.
     */
    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the explicit priority, or {@code null} to infer it from recent accesses.
     */
    public CachePriority getPriority() {
        return priority;
    }

    /**
     * Returns the lifespan in nanoseconds, or 0 for no expiration.
     */
    public long getTtlNanos() {
        return ttlNanos;
    }

    public Set<String> getTags() {
        return tags;
    }

    /**
     * Returns true if the caller supplied an explicit size.
     */
    public boolean hasSize() {
        return size != UNSET;
    }

    /**
     * Returns the explicit size in bytes. Only meaningful when {@link #hasSize()} is true.
     */
    public long getSize() {
        return size;
    }

    /**
     * Returns true if the value should be held weakly instead of in the tiers.
     */
    public boolean isWeak() {
        return weak;
    }

    @Override
    public String toString() {
        return "CacheOptions{priority=" + priority + ", ttlNanos=" + ttlNanos + ", tags=" + tags
                + ", size=" + (hasSize() ? size : "estimated") + ", weak=" + weak + '}';
    }

    /**
     * Fluent builder for {@link CacheOptions}.
     */
    public static final class Builder {
        private CachePriority priority;
        private long ttlNanos;
        private final Set<String> tags = new LinkedHashSet<>();
        private long size = UNSET;
        private boolean weak;

        private Builder() {
        }

        public Builder priority(CachePriority priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Sets the lifespan measured from creation.
         *
         * @throws IllegalArgumentException if {@code duration} is negative
         */
        public Builder ttl(long duration, TimeUnit unit) {
            if (duration < 0) {
                throw new IllegalArgumentException("ttl must not be negative: " + duration);
            }
            this.ttlNanos = unit.toNanos(duration);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        /**
         * Overrides the estimated size.
         *
         * @throws IllegalArgumentException if {@code size} is negative
         */
        public Builder size(long size) {
            if (size < 0) {
                throw new IllegalArgumentException("size must not be negative: " + size);
            }
            this.size = size;
            return this;
        }

        public Builder weak(boolean weak) {
            this.weak = weak;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(this);
        }
    }
}
