package com.github.rudygunawan.kura.metrics;

import com.github.rudygunawan.kura.model.CachePriority;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for memory manager metrics.
 *
 * <p>Exposes the following metrics, all tagged with {@code manager}:
 * <ul>
 *   <li>memory.cache.size - Items resident across all tiers
 *   <li>memory.cache.hits - Total number of tier hits
 *   <li>memory.cache.misses - Total number of tier misses
 *   <li>memory.cache.evictions - Items discarded from the full cold tier
 *   <li>memory.cache.hit.ratio - Hit rate (0.0 to 1.0)
 *   <li>memory.tier.size - Items per tier, tagged {@code tier=l1|l2|l3}
 *   <li>memory.tier.bytes - Estimated bytes per tier, tagged {@code tier=l1|l2|l3}
 *   <li>memory.weakrefs - Weak references currently tracked
 *   <li>memory.estimated - Estimated bytes held by tiers and weak references
 *   <li>memory.sampled - Last memory sample
 *   <li>memory.pressure - Last sample over the critical threshold
 *   <li>memory.warning / memory.critical - 1 while the flag is raised, else 0
 * </ul>
 *
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * UnifiedMemoryManager<Object> manager = MemoryManagerBuilder.newBuilder().build();
 * MicrometerMemoryMetrics.monitor(registry, manager, "router");
 * }</pre>
 */
public class MicrometerMemoryMetrics implements MeterBinder {

    private final MemoryMetrics manager;
    private final String managerName;
    private final Iterable<Tag> tags;

    /**
     * @param manager the manager to monitor
     * @param managerName the value of the {@code manager} tag
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerMemoryMetrics(MemoryMetrics manager, String managerName, Iterable<Tag> tags) {
        this.manager = manager;
        this.managerName = managerName;
        this.tags = tags;
    }

    /**
     * Binds metrics for {@code manager} to {@code registry}.
     *
     * @return the manager (for chaining)
     */
    public static <M extends MemoryMetrics> M monitor(MeterRegistry registry, M manager, String managerName) {
        return monitor(registry, manager, managerName, Collections.emptyList());
    }

    /**
     * Binds metrics for {@code manager} to {@code registry} with additional tags.
     *
     * @return the manager (for chaining)
     */
    public static <M extends MemoryMetrics> M monitor(
            MeterRegistry registry, M manager, String managerName, Iterable<Tag> tags) {
        new MicrometerMemoryMetrics(manager, managerName, tags).bindTo(registry);
        return manager;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("manager", managerName).and(tags);

        Gauge.builder("memory.cache.size", manager, MemoryMetrics::size)
                .tags(allTags)
                .description("Items resident across all tiers")
                .register(registry);

        FunctionCounter.builder("memory.cache.hits", manager, MemoryMetrics::hitCount)
                .tags(allTags)
                .description("Total number of tier hits")
                .register(registry);

        FunctionCounter.builder("memory.cache.misses", manager, MemoryMetrics::missCount)
                .tags(allTags)
                .description("Total number of tier misses")
                .register(registry);

        FunctionCounter.builder("memory.cache.evictions", manager, MemoryMetrics::evictionCount)
                .tags(allTags)
                .description("Items discarded because the cold tier was full")
                .register(registry);

        Gauge.builder("memory.cache.hit.ratio", manager, m -> {
                    long hits = m.hitCount();
                    long total = hits + m.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Tier hit ratio (0.0 to 1.0)")
                .register(registry);

        for (CachePriority tier : CachePriority.values()) {
            Tags tierTags = allTags.and("tier", tierName(tier));
            Gauge.builder("memory.tier.size", manager, m -> m.tierSize(tier))
                    .tags(tierTags)
                    .description("Items resident in the tier")
                    .register(registry);
            Gauge.builder("memory.tier.bytes", manager, m -> m.tierMemoryBytes(tier))
                    .tags(tierTags)
                    .baseUnit("bytes")
                    .description("Estimated bytes held by the tier")
                    .register(registry);
        }

        Gauge.builder("memory.weakrefs", manager, MemoryMetrics::weakRefCount)
                .tags(allTags)
                .description("Weak references currently tracked")
                .register(registry);

        Gauge.builder("memory.estimated", manager, MemoryMetrics::estimatedMemoryUsageBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Estimated bytes held by tiers and weak references")
                .register(registry);

        Gauge.builder("memory.sampled", manager, MemoryMetrics::sampledMemoryBytes)
                .tags(allTags)
                .baseUnit("bytes")
                .description("Last memory sample compared against the thresholds")
                .register(registry);

        Gauge.builder("memory.pressure", manager, MemoryMetrics::memoryPressure)
                .tags(allTags)
                .description("Last memory sample divided by the critical threshold")
                .register(registry);

        Gauge.builder("memory.warning", manager, m -> m.isWarning() ? 1.0 : 0.0)
                .tags(allTags)
                .description("1 while memory is at or above the warning threshold")
                .register(registry);

        Gauge.builder("memory.critical", manager, m -> m.isCritical() ? 1.0 : 0.0)
                .tags(allTags)
                .description("1 while memory is at or above the critical threshold")
                .register(registry);
    }

    static String tierName(CachePriority tier) {
        return "l" + tier.level();
    }
}
