package com.github.rudygunawan.kura.reference;

import com.github.rudygunawan.kura.model.WeakRefStats;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A keyed table of weak references. The table never keeps a target alive.
 *
 * <p>Collected targets are noticed two ways. Every reference is registered with a
 * {@link ReferenceQueue}; the queue is drained at the start of each operation, dropping the table
 * entries whose targets the garbage collector has reclaimed. Lookups also check the referent
 * directly, so a target that is gone but not yet enqueued still reads as absent.
 *
 * <p>A collected target is not an error: {@link #getRef(String)} simply returns {@code null}.
 *
 * <p>Once more than {@value #SWEEP_THRESHOLD} references are tracked, each new registration first
 * sweeps cleared references. When the table is still at {@code maxRefs}, the oldest reference is
 * dropped to make room.
 *
 * @param <V> the type of the referents
 */
public class WeakReferenceManager<V> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Memory");

    static final int SWEEP_THRESHOLD = 100;

    private final Map<String, KeyedWeakReference<V>> refs = new LinkedHashMap<>();
    private final ReferenceQueue<V> queue = new ReferenceQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxRefs;

    /**
     * Creates a manager holding at most {@code maxRefs} references.
     *
     * @throws IllegalArgumentException if {@code maxRefs} is not positive
     */
    public WeakReferenceManager(int maxRefs) {
        if (maxRefs <= 0) {
            throw new IllegalArgumentException("maxRefs must be positive, got: " + maxRefs);
        }
        this.maxRefs = maxRefs;
    }

    /**
     * Holds {@code target} weakly under {@code key}, replacing any previous reference for the key.
     *
     * @param key the key
     * @param target the object to reference
     * @param size the estimated size of the target in bytes, reported by {@link #getStats()}
     */
    public void createRef(String key, V target, long size) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        lock.lock();
        try {
            expungeStaleEntries();
            if (refs.size() > SWEEP_THRESHOLD) {
                sweepCleared();
            }
            refs.remove(key);
            if (refs.size() >= maxRefs) {
                dropOldest();
            }
            refs.put(key, new KeyedWeakReference<>(key, target, size, queue));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the target held under {@code key}, or {@code null} if there is none or it was collected.
     */
    public V getRef(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            expungeStaleEntries();
            KeyedWeakReference<V> ref = refs.get(key);
            if (ref == null) {
                return null;
            }
            V target = ref.get();
            if (target == null) {
                refs.remove(key, ref);
            }
            return target;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops tracking {@code key}.
     *
     * @return true if a reference was tracked under the key, collected or not
     */
    public boolean removeRef(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            expungeStaleEntries();
            return refs.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every reference whose target has been collected.
     *
     * @return the number of references dropped
     */
    public int purge() {
        lock.lock();
        try {
            return expungeStaleEntries() + sweepCleared();
        } finally {
            lock.unlock();
        }
    }

    public WeakRefStats getStats() {
        lock.lock();
        try {
            expungeStaleEntries();
            long totalSize = 0;
            for (KeyedWeakReference<V> ref : refs.values()) {
                totalSize += ref.size();
            }
            return new WeakRefStats(refs.size(), totalSize);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            // References still queued no longer match an entry and are skipped when polled
            refs.clear();
        } finally {
            lock.unlock();
        }
    }

    public int maxRefs() {
        return maxRefs;
    }

    /**
     * Drops table entries for references the garbage collector has enqueued. An enqueued reference
     * only removes its own entry, never a newer one registered under the same key.
     */
    private int expungeStaleEntries() {
        int removed = 0;
        for (Reference<? extends V> polled; (polled = queue.poll()) != null; ) {
            KeyedWeakReference<?> ref = (KeyedWeakReference<?>) polled;
            if (refs.remove(ref.key(), ref)) {
                removed++;
            }
        }
        return removed;
    }

    private int sweepCleared() {
        List<String> cleared = new ArrayList<>();
        for (Map.Entry<String, KeyedWeakReference<V>> entry : refs.entrySet()) {
            if (entry.getValue().isCleared()) {
                cleared.add(entry.getKey());
            }
        }
        for (String key : cleared) {
            refs.remove(key);
        }
        return cleared.size();
    }

    private void dropOldest() {
        Iterator<KeyedWeakReference<V>> oldest = refs.values().iterator();
        if (oldest.hasNext()) {
            String key = oldest.next().key();
            oldest.remove();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Weak reference table full (" + maxRefs + "), dropped oldest key=" + key);
            }
        }
    }
}
