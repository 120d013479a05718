package com.beacon.observability;

/**
 * Owner of the application's monotonic counters.
 * <p>
 * Implementations must make {@link #increment(CounterName)} atomic under concurrent requests,
 * either with an in-process atomic or with the backing store's own atomic primitive. Reads and
 * increments may throw unchecked exceptions when an external store is unavailable.
 */
public interface CounterStore {

    /**
     * Atomically increments the counter and returns the new value.
     */
    long increment(CounterName counter);

    /**
     * Returns the current value of the counter (0 if it was never incremented).
     */
    long get(CounterName counter);
}
