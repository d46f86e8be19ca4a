package com.github.rudygunawan.kura.reference;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;

/**
 * A weak reference that remembers the key it was registered under and the estimated size of its
 * target, so the table entry can be found and dropped once the reference is enqueued.
 *
 * @param <V> the type of the referent
 */
final class KeyedWeakReference<V> extends WeakReference<V> {
    private final String key;
    private final long size;

    KeyedWeakReference(String key, V referent, long size, ReferenceQueue<? super V> queue) {
        super(referent, queue);
        this.key = key;
        this.size = size;
    }

    String key() {
        return key;
    }

    long size() {
        return size;
    }

    /**
     * Returns true once the referent has been garbage collected or the reference was cleared.
     */
    boolean isCleared() {
        return get() == null;
    }
}
