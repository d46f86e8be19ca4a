package com.github.rudygunawan.kura.model;

/**
 * Estimated bytes held by each tier, summed from the items' sizes.
 */
public final class MemoryUsage {
    private static final MemoryUsage EMPTY = new MemoryUsage(0, 0, 0);

    private final long l1;
    private final long l2;
    private final long l3;

    public MemoryUsage(long l1, long l2, long l3) {
        this.l1 = l1;
        this.l2 = l2;
        this.l3 = l3;
    }

    public static MemoryUsage empty() {
        return EMPTY;
    }

    public long l1() {
        return l1;
    }

    public long l2() {
        return l2;
    }

    public long l3() {
        return l3;
    }

    public long total() {
        return l1 + l2 + l3;
    }

    /**
     * Returns the bytes held by the tier of the given priority.
     */
    public long of(CachePriority tier) {
        return switch (tier) {
            case HOT -> l1;
            case WARM -> l2;
            case COLD -> l3;
        };
    }

    @Override
    public String toString() {
        return "MemoryUsage{l1=" + l1 + ", l2=" + l2 + ", l3=" + l3 + ", total=" + total() + '}';
    }
}
