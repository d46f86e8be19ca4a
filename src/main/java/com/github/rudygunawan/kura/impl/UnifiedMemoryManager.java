package com.github.rudygunawan.kura.impl;

import com.github.rudygunawan.kura.api.MemoryManager;
import com.github.rudygunawan.kura.api.MemorySampler;
import com.github.rudygunawan.kura.api.SizeEstimator;
import com.github.rudygunawan.kura.builder.MemoryManagerBuilder;
import com.github.rudygunawan.kura.listener.RemovalListener;
import com.github.rudygunawan.kura.metrics.MemoryMetrics;
import com.github.rudygunawan.kura.model.CacheInfo;
import com.github.rudygunawan.kura.model.CacheOptions;
import com.github.rudygunawan.kura.model.CachePriority;
import com.github.rudygunawan.kura.model.MemoryStats;
import com.github.rudygunawan.kura.model.MemoryUsage;
import com.github.rudygunawan.kura.model.TierStats;
import com.github.rudygunawan.kura.model.WeakRefStats;
import com.github.rudygunawan.kura.policy.CleanupStrategy;
import com.github.rudygunawan.kura.policy.LeakDetector;
import com.github.rudygunawan.kura.policy.MemoryLevel;
import com.github.rudygunawan.kura.reference.WeakReferenceManager;
import com.github.rudygunawan.kura.time.Ticker;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The memory manager: a {@link TieredCache} for ordinary values, a {@link WeakReferenceManager}
 * for weakly held ones, and a {@link MemoryMonitor} watching both.
 *
 * <p>Two timers run independently on the maintenance scheduler:
 * <ul>
 *   <li>the <b>monitor</b> samples memory every {@code monitorInterval} and triggers a moderate
 *       cleanup at WARNING or an aggressive one at CRITICAL;
 *   <li>the <b>cleanup</b> timer calls {@link #optimize()} every {@code cleanupInterval}, whatever
 *       the memory level, so tidying never depends on the sampler seeing anything.
 * </ul>
 * With the default single-threaded scheduler neither timer overlaps itself or the other.
 *
 * <p>{@link #destroy()} cancels both timers, drops all data and resets the statistics. It is
 * idempotent, and a timer callback that fires after it does nothing.
 *
 * <p>Logging: This class uses java.util.logging under the logger name
 * "com.github.rudygunawan.kura.Memory".
 *
 * @param <V> the type of cached values
 */
public class UnifiedMemoryManager<V> implements MemoryManager<V>, MemoryMetrics {
    /**
     * Logger for memory manager operations. Logger name: "com.github.rudygunawan.kura.Memory"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Listener failures, failed timer runs, suspected leaks</li>
     *   <li>FINE: Cleanup passes, memory level changes, evictions</li>
     *   <li>FINER: Promotions and demotions</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Memory");

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 1;

    private final TieredCache<V> tieredCache;
    private final WeakReferenceManager<V> weakRefs;
    private final MemoryMonitor monitor;
    private final LeakDetector leakDetector = new LeakDetector();
    private final Ticker ticker;
    private final SizeEstimator<? super V> sizeEstimator;
    private final CleanupStrategy cleanupStrategy;
    private final boolean weakRefEnabled;
    private final boolean adaptiveMonitoring;
    private final long monitorIntervalNanos;

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Object timerLock = new Object();
    private volatile boolean destroyed;
    private volatile Thread maintenanceThread;
    private ScheduledFuture<?> monitorTask;
    private ScheduledFuture<?> cleanupTask;

    private volatile long lastCleanupNanos = MemoryStats.NEVER;

    /**
     * Creates a manager from a builder. Use {@link MemoryManagerBuilder#build()}.
     */
    @SuppressWarnings("unchecked")
    public UnifiedMemoryManager(MemoryManagerBuilder<?> builder) {
        this.ticker = builder.getTicker();
        this.sizeEstimator = (SizeEstimator<? super V>) builder.getSizeEstimator();
        this.cleanupStrategy = builder.getCleanupStrategy();
        this.weakRefEnabled = builder.isWeakRefEnabled();
        this.adaptiveMonitoring = builder.isAdaptiveMonitoring();
        this.monitorIntervalNanos = builder.getMonitorIntervalNanos();

        this.tieredCache = new TieredCache<>(
                builder.getL1Capacity(),
                builder.getL2Capacity(),
                builder.getL3Capacity(),
                builder.getPromotionThreshold(),
                builder.getDemotionThresholdNanos(),
                ticker,
                sizeEstimator,
                (RemovalListener<? super V>) builder.getRemovalListener());
        this.weakRefs = new WeakReferenceManager<>(builder.getMaxWeakRefs());

        MemorySampler sampler = builder.getMemorySampler() != null
                ? builder.getMemorySampler()
                : this::estimatedMemoryUsageBytes;
        this.monitor = new MemoryMonitor(sampler, builder.getWarningThreshold(), builder.getCriticalThreshold());

        boolean needsTimers = builder.isMonitoringEnabled() || builder.isAutoCleanup();
        if (builder.getScheduler() != null) {
            this.scheduler = builder.getScheduler();
            this.ownsScheduler = false;
        } else if (needsTimers) {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "kura-memory-maintenance");
                t.setDaemon(true);
                maintenanceThread = t;
                return t;
            });
            this.ownsScheduler = true;
        } else {
            this.scheduler = null;
            this.ownsScheduler = false;
        }

        synchronized (timerLock) {
            if (builder.isMonitoringEnabled()) {
                if (adaptiveMonitoring) {
                    monitorTask = scheduler.schedule(this::monitorTick, 0, TimeUnit.NANOSECONDS);
                } else {
                    monitorTask = scheduler.scheduleWithFixedDelay(this::monitorTick,
                            monitorIntervalNanos, monitorIntervalNanos, TimeUnit.NANOSECONDS);
                }
            }
            if (builder.isAutoCleanup()) {
                long interval = builder.getCleanupIntervalNanos();
                cleanupTask = scheduler.scheduleWithFixedDelay(this::cleanupTick,
                        interval, interval, TimeUnit.NANOSECONDS);
            }
        }
    }

    // ==================== public API ====================

    @Override
    public V get(String key) {
        return tieredCache.get(key);
    }

    @Override
    public void set(String key, V value, CacheOptions options) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        if (options.isWeak() && weakRefEnabled && isReferenceValue(value)) {
            tieredCache.delete(key);
            long size = options.hasSize() ? options.getSize() : sizeEstimator.estimate(value);
            weakRefs.createRef(key, value, size);
        } else {
            weakRefs.removeRef(key);
            tieredCache.set(key, value, options);
        }
    }

    @Override
    public boolean delete(String key) {
        boolean tiered = tieredCache.delete(key);
        boolean weak = weakRefs.removeRef(key);
        return tiered || weak;
    }

    @Override
    public int invalidateTag(String tag) {
        return tieredCache.invalidateTag(tag);
    }

    @Override
    public void clear() {
        tieredCache.clear();
        weakRefs.clear();
    }

    @Override
    public void createWeakRef(String key, V target) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        if (!weakRefEnabled) {
            return;
        }
        tieredCache.delete(key);
        weakRefs.createRef(key, target, sizeEstimator.estimate(target));
    }

    @Override
    public V getWeakRef(String key) {
        return weakRefs.getRef(key);
    }

    @Override
    public void optimize() {
        tieredCache.optimize();
        performCleanup(cleanupStrategy);
    }

    @Override
    public MemoryStats getStats() {
        long sampled = destroyed ? 0 : monitor.sample();
        MemoryLevel level = monitor.level();
        return MemoryStats.of(sampled, tieredCache.getStats(),
                tieredCache.getMemoryUsage(), weakRefs.getStats(),
                level.isWarning(), level.isCritical(), lastCleanupNanos);
    }

    @Override
    public CacheInfo getCacheInfo() {
        return new CacheInfo(tieredCache.getStats(), tieredCache.getMemoryUsage(), weakRefs.getStats());
    }

    @Override
    public void destroy() {
        boolean awaitShutdown = false;
        synchronized (timerLock) {
            if (!destroyed) {
                destroyed = true;
                if (monitorTask != null) {
                    monitorTask.cancel(false);
                    monitorTask = null;
                }
                if (cleanupTask != null) {
                    cleanupTask.cancel(false);
                    cleanupTask = null;
                }
                if (ownsScheduler) {
                    scheduler.shutdownNow();
                    awaitShutdown = true;
                }
            }
        }
        // A timer run cannot wait for its own thread to finish
        if (awaitShutdown && Thread.currentThread() != maintenanceThread) {
            awaitTermination();
        }
        tieredCache.clear();
        weakRefs.clear();
        monitor.reset();
        leakDetector.reset();
        lastCleanupNanos = MemoryStats.NEVER;
    }

    /**
     * Waits briefly for a timer run already in progress, so it cannot write into the reset state.
     */
    private void awaitTermination() {
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Maintenance thread did not stop within " + SHUTDOWN_TIMEOUT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Returns the tier holding {@code key}, or {@code null} if it is not in the tiers.
     * Does not count as an access.
     */
    public CachePriority tierOf(String key) {
        return tieredCache.tierOf(key);
    }

    // ==================== timers ====================

    private void monitorTick() {
        if (destroyed) {
            return;
        }
        try {
            MemoryLevel level = monitor.check();
            CleanupStrategy response = level.response();
            if (response != null) {
                performCleanup(response);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Memory monitor run failed", e);
        } finally {
            if (adaptiveMonitoring) {
                scheduleNextMonitorTick();
            }
        }
    }

    private void scheduleNextMonitorTick() {
        synchronized (timerLock) {
            if (!destroyed) {
                long delay = monitor.nextDelay(monitorIntervalNanos);
                monitorTask = scheduler.schedule(this::monitorTick, delay, TimeUnit.NANOSECONDS);
            }
        }
    }

    private void cleanupTick() {
        if (destroyed) {
            return;
        }
        try {
            optimize();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Periodic cleanup failed", e);
        }
    }

    /**
     * Runs one cleanup pass at least as strong as {@code requested}; high pressure or a suspected
     * leak escalate it.
     */
    void performCleanup(CleanupStrategy requested) {
        long sampled = monitor.sample();
        long now = ticker.read();
        boolean leak;
        synchronized (leakDetector) {
            leak = leakDetector.record(sampled, now);
        }
        if (leak) {
            LOGGER.warning("Potential memory leak detected: sampled=" + sampled
                    + " bytes, cacheMemory=" + tieredCache.getMemoryUsage().total() + " bytes");
        }

        CleanupStrategy strategy = monitor.selectCleanup(requested, leak);
        int discarded;
        switch (strategy) {
            case AGGRESSIVE:
                discarded = tieredCache.evictAll();
                weakRefs.clear();
                break;
            case MODERATE:
                tieredCache.optimize();
                discarded = tieredCache.discardColdHalf();
                weakRefs.purge();
                break;
            default:
                tieredCache.optimize();
                discarded = 0;
                weakRefs.purge();
                break;
        }

        if (!destroyed) {
            lastCleanupNanos = ticker.read();
        }
        long after = monitor.sample();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cleanup pass " + strategy + " (requested " + requested + "): discarded "
                    + discarded + " item(s), memory " + sampled + " -> " + after + " bytes");
        }
    }

    /**
     * Boxed primitives, strings and enums are shared or interned by the JVM and never become
     * unreachable in a useful way, so they are cached strongly even when a weak write is asked for.
     */
    private static boolean isReferenceValue(Object value) {
        return !(value instanceof Number
                || value instanceof CharSequence
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum);
    }

    // ==================== MemoryMetrics ====================

    @Override
    public long size() {
        return tieredCache.getStats().totalSize();
    }

    @Override
    public long tierSize(CachePriority tier) {
        TierStats stats = tieredCache.getStats();
        return switch (tier) {
            case HOT -> stats.l1Size();
            case WARM -> stats.l2Size();
            case COLD -> stats.l3Size();
        };
    }

    @Override
    public long tierMemoryBytes(CachePriority tier) {
        return tieredCache.getMemoryUsage().of(tier);
    }

    @Override
    public long hitCount() {
        return tieredCache.getStats().hitCount();
    }

    @Override
    public long missCount() {
        return tieredCache.getStats().missCount();
    }

    @Override
    public long evictionCount() {
        return tieredCache.getStats().evictionCount();
    }

    @Override
    public long weakRefCount() {
        return weakRefs.getStats().count();
    }

    @Override
    public long estimatedMemoryUsageBytes() {
        MemoryUsage usage = tieredCache.getMemoryUsage();
        WeakRefStats weak = weakRefs.getStats();
        return usage.total() + weak.totalSize();
    }

    @Override
    public long sampledMemoryBytes() {
        return monitor.lastSample();
    }

    @Override
    public double memoryPressure() {
        return monitor.pressure();
    }

    @Override
    public boolean isWarning() {
        return monitor.level().isWarning();
    }

    @Override
    public boolean isCritical() {
        return monitor.level().isCritical();
    }
}
