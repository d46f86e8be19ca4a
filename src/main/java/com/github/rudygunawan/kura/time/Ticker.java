package com.github.rudygunawan.kura.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Every time-based decision of the memory manager (TTL expiry, access windows, promotion,
 * demotion, eviction scoring, leak detection) reads time through this interface. Tests supply
 * a fake ticker they can advance by hand instead of sleeping.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * MemoryManager<String> manager = MemoryManagerBuilder.newBuilder()
 *     .ticker(ticker)
 *     .monitoringEnabled(false)
 *     .autoCleanup(false)
 *     .build();
 *
 * manager.set("page", "<html/>", CacheOptions.builder().ttl(10, TimeUnit.MILLISECONDS).build());
 * ticker.advance(11, TimeUnit.MILLISECONDS);
 * manager.optimize();
 * assertNull(manager.get("page"));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Values must be monotonically increasing and unrelated to wall-clock time, with the
     * same properties as {@link System#nanoTime()}.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
