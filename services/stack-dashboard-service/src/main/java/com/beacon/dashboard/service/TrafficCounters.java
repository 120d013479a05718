package com.beacon.dashboard.service;

import com.beacon.observability.CounterName;
import com.beacon.observability.CounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort increments of the request and cache-hit counters.
 *
 * <p>With the Redis-backed store an increment can fail; the request is served anyway and the
 * failure logged.
 */
@Component
public class TrafficCounters {

    private static final Logger log = LoggerFactory.getLogger(TrafficCounters.class);

    private final CounterStore store;

    public TrafficCounters(CounterStore store) {
        this.store = store;
    }

    public void recordRequest() {
        increment(CounterName.REQUESTS);
    }

    /** Counted under {@link CounterName#CACHE_HITS} on every dashboard view. */
    public void recordDashboardView() {
        increment(CounterName.CACHE_HITS);
    }

    public CounterStore store() {
        return store;
    }

    private void increment(CounterName counter) {
        try {
            store.increment(counter);
        } catch (RuntimeException e) {
            log.warn("Could not increment {}: {}", counter.key(), e.getMessage());
        }
    }
}
