package com.beacon.observability;

import java.time.Duration;

/**
 * Best-effort, platform-provided facts about the running process and its host.
 */
public interface HostMetrics {

    /** Memory currently used by the process, in bytes. */
    long memoryUsedBytes();

    /** Memory currently used by the process, in mebibytes rounded to two decimals. */
    default double memoryUsedMb() {
        return MetricsSnapshot.toMegabytes(memoryUsedBytes());
    }

    /** Logical CPUs available to the process. */
    int cpuCount();

    /** Host name (the container id when running in Docker). */
    String hostname();

    /** Version of the runtime executing the process. */
    String runtimeVersion();

    /** Time since the process started. */
    Duration uptime();
}
