package com.beacon.observability;

/**
 * Monotonic counters tracked by a {@link CounterStore}.
 */
public enum CounterName {

    /** Requests served by the application. */
    REQUESTS("total_requests", "beacon.requests.total", "Requests served"),

    /** Dashboard page views, reported as cache hits. */
    CACHE_HITS("cache_hits", "beacon.cache.hits", "Dashboard views counted as cache hits");

    private final String key;
    private final String meterName;
    private final String description;

    CounterName(String key, String meterName, String description) {
        this.key = key;
        this.meterName = meterName;
        this.description = description;
    }

    /** Storage key (also the Redis key for the external store). */
    public String key() {
        return key;
    }

    /** Micrometer meter name. */
    public String meterName() {
        return meterName;
    }

    public String description() {
        return description;
    }
}
