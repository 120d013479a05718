package com.beacon.observability;

import java.time.Instant;

/**
 * Point-in-time view of process metrics and request counters.
 *
 * @param memoryUsedBytes JVM memory in use (heap + non-heap)
 * @param cpuCount        logical processors available to the process
 * @param requestCount    total requests served, as read from the counter store
 * @param cacheHitCount   dashboard views counted under the cache-hit counter
 * @param capturedAt      when the snapshot was taken
 */
public record MetricsSnapshot(
        long memoryUsedBytes,
        int cpuCount,
        long requestCount,
        long cacheHitCount,
        Instant capturedAt
) {

    /** Memory in use, in mebibytes rounded to two decimals. */
    public double memoryUsedMb() {
        return toMegabytes(memoryUsedBytes);
    }

    static double toMegabytes(long bytes) {
        return Math.round(bytes / 1024.0 / 1024.0 * 100.0) / 100.0;
    }
}
