package com.beacon.observability;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles {@link MetricsSnapshot}s from host metrics and a counter store.
 * <p>
 * Taking a snapshot never mutates counters. A counter that cannot be read (external store
 * down) is reported as 0.
 */
public final class MetricsSnapshotter {

    private static final Logger log = LoggerFactory.getLogger(MetricsSnapshotter.class);

    private final HostMetrics host;
    private final Clock clock;

    public MetricsSnapshotter(HostMetrics host, Clock clock) {
        if (host == null) {
            throw new IllegalArgumentException("host must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.host = host;
        this.clock = clock;
    }

    /**
     * Captures the current metrics.
     *
     * @param counters store to read the request and cache-hit counters from
     * @return the snapshot
     */
    public MetricsSnapshot snapshot(CounterStore counters) {
        if (counters == null) {
            throw new IllegalArgumentException("counters must not be null");
        }
        return new MetricsSnapshot(
                host.memoryUsedBytes(),
                host.cpuCount(),
                read(counters, CounterName.REQUESTS),
                read(counters, CounterName.CACHE_HITS),
                clock.instant());
    }

    private static long read(CounterStore counters, CounterName name) {
        try {
            return counters.get(name);
        } catch (RuntimeException e) {
            log.warn("Counter {} unavailable: {}", name.key(), DependencyProbe.describe(e));
            return 0L;
        }
    }
}
