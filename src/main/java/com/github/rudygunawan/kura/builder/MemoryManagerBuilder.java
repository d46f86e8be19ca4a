package com.github.rudygunawan.kura.builder;

import com.github.rudygunawan.kura.api.MemorySampler;
import com.github.rudygunawan.kura.api.SizeEstimator;
import com.github.rudygunawan.kura.impl.UnifiedMemoryManager;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.policy.CleanupStrategy;
import com.github.rudygunawan.kura.time.Ticker;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A builder of {@link UnifiedMemoryManager} instances.
 *
 * <p>Every setting is optional. Invalid values fail here, at configuration time, rather than
 * being clamped.
 *
 * <p>Usage example:
 * <pre>{@code
 * UnifiedMemoryManager<Object> manager = MemoryManagerBuilder.newBuilder()
 *     .l1Capacity(20)
 *     .promotionThreshold(3)
 *     .demotionThreshold(60, TimeUnit.SECONDS)
 *     .warningThreshold(8 * 1024 * 1024)
 *     .criticalThreshold(16 * 1024 * 1024)
 *     .cleanupStrategy(CleanupStrategy.MODERATE)
 *     .build();
 * }</pre>
 *
 * @param <V> the type of cached values
 */
public class MemoryManagerBuilder<V> {
    static final int DEFAULT_L1_CAPACITY = 15;
    static final int DEFAULT_L2_CAPACITY = 30;
    static final int DEFAULT_L3_CAPACITY = 60;
    static final int DEFAULT_PROMOTION_THRESHOLD = 2;
    static final long DEFAULT_DEMOTION_THRESHOLD_NANOS = TimeUnit.SECONDS.toNanos(30);
    static final long DEFAULT_MONITOR_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(60);
    static final long DEFAULT_WARNING_THRESHOLD = 10L * 1024 * 1024;
    static final long DEFAULT_CRITICAL_THRESHOLD = 20L * 1024 * 1024;
    static final long DEFAULT_CLEANUP_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(120);
    static final int DEFAULT_MAX_WEAK_REFS = 500;

    private int l1Capacity = DEFAULT_L1_CAPACITY;
    private int l2Capacity = DEFAULT_L2_CAPACITY;
    private int l3Capacity = DEFAULT_L3_CAPACITY;
    private int promotionThreshold = DEFAULT_PROMOTION_THRESHOLD;
    private long demotionThresholdNanos = DEFAULT_DEMOTION_THRESHOLD_NANOS;
    private boolean monitoringEnabled = true;
    private boolean adaptiveMonitoring = false;
    private long monitorIntervalNanos = DEFAULT_MONITOR_INTERVAL_NANOS;
    private long warningThreshold = DEFAULT_WARNING_THRESHOLD;
    private long criticalThreshold = DEFAULT_CRITICAL_THRESHOLD;
    private boolean autoCleanup = true;
    private long cleanupIntervalNanos = DEFAULT_CLEANUP_INTERVAL_NANOS;
    private CleanupStrategy cleanupStrategy = CleanupStrategy.CONSERVATIVE;
    private boolean weakRefEnabled = true;
    private int maxWeakRefs = DEFAULT_MAX_WEAK_REFS;
    private Ticker ticker = Ticker.systemTicker();
    private MemorySampler memorySampler;
    private SizeEstimator<? super V> sizeEstimator;
    private RemovalListener<? super V> removalListener;
    private ScheduledExecutorService scheduler;

    private MemoryManagerBuilder() {
    }

    /**
     * Constructs a new builder with default settings.
     */
    public static MemoryManagerBuilder<Object> newBuilder() {
        return new MemoryManagerBuilder<>();
    }

    /**
     * Maximum items in L1, the hot tier. Default 15.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MemoryManagerBuilder<V> l1Capacity(int capacity) {
        this.l1Capacity = requirePositive(capacity, "l1Capacity");
        return this;
    }

    /**
     * Maximum items in L2, the warm tier. Default 30.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MemoryManagerBuilder<V> l2Capacity(int capacity) {
        this.l2Capacity = requirePositive(capacity, "l2Capacity");
        return this;
    }

    /**
     * Maximum items in L3, the cold tier. Default 60.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MemoryManagerBuilder<V> l3Capacity(int capacity) {
        this.l3Capacity = requirePositive(capacity, "l3Capacity");
        return this;
    }

    /**
     * Accesses within ten seconds that promote an L2 or L3 item one tier up. Default 2.
     *
     * @throws IllegalArgumentException if {@code threshold} is not positive
     */
    public MemoryManagerBuilder<V> promotionThreshold(int threshold) {
        this.promotionThreshold = requirePositive(threshold, "promotionThreshold");
        return this;
    }

    /**
     * Idle time after which {@code optimize} demotes an L1 item to L2. L2 items are demoted to L3
     * after twice this. Default 30 seconds.
     *
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public MemoryManagerBuilder<V> demotionThreshold(long duration, TimeUnit unit) {
        this.demotionThresholdNanos = unit.toNanos(requirePositive(duration, "demotionThreshold"));
        return this;
    }

    /**
     * Whether the monitor timer runs. Default true.
     */
    public MemoryManagerBuilder<V> monitoringEnabled(boolean enabled) {
        this.monitoringEnabled = enabled;
        return this;
    }

    /**
     * Whether the monitor stretches or shortens its interval with memory pressure. Default false.
     */
    public MemoryManagerBuilder<V> adaptiveMonitoring(boolean adaptive) {
        this.adaptiveMonitoring = adaptive;
        return this;
    }

    /**
     * Interval between memory checks. Default 60 seconds.
     *
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public MemoryManagerBuilder<V> monitorInterval(long duration, TimeUnit unit) {
        this.monitorIntervalNanos = unit.toNanos(requirePositive(duration, "monitorInterval"));
        return this;
    }

    /**
     * Sampled bytes at which the monitor raises the warning flag. Default 10 MB.
     *
     * @throws IllegalArgumentException if {@code bytes} is not positive
     */
    public MemoryManagerBuilder<V> warningThreshold(long bytes) {
        this.warningThreshold = requirePositive(bytes, "warningThreshold");
        return this;
    }

    /**
     * Sampled bytes at which the monitor raises the critical flag. Default 20 MB.
     *
     * @throws IllegalArgumentException if {@code bytes} is not positive
     */
    public MemoryManagerBuilder<V> criticalThreshold(long bytes) {
        this.criticalThreshold = requirePositive(bytes, "criticalThreshold");
        return this;
    }

    /**
     * Whether the cleanup timer runs. Default true.
     */
    public MemoryManagerBuilder<V> autoCleanup(boolean enabled) {
        this.autoCleanup = enabled;
        return this;
    }

    /**
     * Interval between periodic {@code optimize} runs. Default 2 minutes.
     *
     * @throws IllegalArgumentException if {@code duration} is not positive
     */
    public MemoryManagerBuilder<V> cleanupInterval(long duration, TimeUnit unit) {
        this.cleanupIntervalNanos = unit.toNanos(requirePositive(duration, "cleanupInterval"));
        return this;
    }

    /**
     * The least a routine cleanup pass does. Memory pressure may escalate a pass beyond it.
     * Default {@link CleanupStrategy#CONSERVATIVE}.
     */
    public MemoryManagerBuilder<V> cleanupStrategy(CleanupStrategy strategy) {
        if (strategy == null) {
            throw new NullPointerException("cleanup strategy cannot be null");
        }
        this.cleanupStrategy = strategy;
        return this;
    }

    /**
     * Whether weak writes are honored. When false, weak writes go to the tiers and
     * {@code createWeakRef} does nothing. Default true.
     */
    public MemoryManagerBuilder<V> weakRefEnabled(boolean enabled) {
        this.weakRefEnabled = enabled;
        return this;
    }

    /**
     * Maximum weak references tracked at once. Default 500.
     *
     * @throws IllegalArgumentException if {@code max} is not positive
     */
    public MemoryManagerBuilder<V> maxWeakRefs(int max) {
        this.maxWeakRefs = requirePositive(max, "maxWeakRefs");
        return this;
    }

    /**
     * Time source for every time-based decision. Default {@link Ticker#systemTicker()}.
     */
    public MemoryManagerBuilder<V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Memory source for the monitor. Defaults to the manager's own estimated footprint.
     */
    public MemoryManagerBuilder<V> memorySampler(MemorySampler sampler) {
        if (sampler == null) {
            throw new NullPointerException("memory sampler cannot be null");
        }
        this.memorySampler = sampler;
        return this;
    }

    /**
     * Size estimator for values written without an explicit size.
     * Defaults to {@link SizeEstimator#heuristic()}.
     */
    public <V1 extends V> MemoryManagerBuilder<V1> sizeEstimator(SizeEstimator<? super V1> estimator) {
        if (estimator == null) {
            throw new NullPointerException("size estimator cannot be null");
        }
        @SuppressWarnings("unchecked")
        MemoryManagerBuilder<V1> me = (MemoryManagerBuilder<V1>) this;
        me.sizeEstimator = estimator;
        return me;
    }

    /**
     * Listener notified when items leave the tiers.
     */
    public <V1 extends V> MemoryManagerBuilder<V1> removalListener(RemovalListener<? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        MemoryManagerBuilder<V1> me = (MemoryManagerBuilder<V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Scheduler for the monitor and cleanup timers. The caller keeps ownership and must shut it
     * down; {@code destroy} only cancels the manager's own tasks. By default the manager creates a
     * single daemon thread and shuts it down on {@code destroy}.
     */
    public MemoryManagerBuilder<V> scheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new NullPointerException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
        return this;
    }

    /**
     * Builds a manager with this configuration and starts its timers.
     *
     * @throws IllegalArgumentException if the warning threshold exceeds the critical threshold
     */
    public <V1 extends V> UnifiedMemoryManager<V1> build() {
        if (warningThreshold > criticalThreshold) {
            throw new IllegalArgumentException("warning threshold " + warningThreshold
                    + " exceeds critical threshold " + criticalThreshold);
        }
        return new UnifiedMemoryManager<>(this);
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    public int getL1Capacity() {
        return l1Capacity;
    }

    public int getL2Capacity() {
        return l2Capacity;
    }

    public int getL3Capacity() {
        return l3Capacity;
    }

    public int getPromotionThreshold() {
        return promotionThreshold;
    }

    public long getDemotionThresholdNanos() {
        return demotionThresholdNanos;
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled;
    }

    public boolean isAdaptiveMonitoring() {
        return adaptiveMonitoring;
    }

    public long getMonitorIntervalNanos() {
        return monitorIntervalNanos;
    }

    public long getWarningThreshold() {
        return warningThreshold;
    }

    public long getCriticalThreshold() {
        return criticalThreshold;
    }

    public boolean isAutoCleanup() {
        return autoCleanup;
    }

    public long getCleanupIntervalNanos() {
        return cleanupIntervalNanos;
    }

    public CleanupStrategy getCleanupStrategy() {
        return cleanupStrategy;
    }

    public boolean isWeakRefEnabled() {
        return weakRefEnabled;
    }

    public int getMaxWeakRefs() {
        return maxWeakRefs;
    }

    public Ticker getTicker() {
        return ticker;
    }

    /**
     * Returns the configured sampler, or {@code null} to sample the manager's own footprint.
     */
    public MemorySampler getMemorySampler() {
        return memorySampler;
    }

    public SizeEstimator<? super V> getSizeEstimator() {
        return sizeEstimator != null ? sizeEstimator : SizeEstimator.heuristic();
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }

    /**
     * Returns the caller-supplied scheduler, or {@code null} if the manager owns its own.
     */
    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }
}
