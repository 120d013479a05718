package com.beacon.observability;

import java.util.Map;

/**
 * Capability a downstream dependency (database, cache) exposes to the {@link DependencyProbe}.
 * <p>
 * Implementations wrap a pooled connection resource owned by the application lifecycle. Both
 * operations may fail with any exception; the probe converts failures into an unreachable
 * {@link DependencyCheck}.
 * <p>
 * Example usage:
 * <pre>{@code
 * DependencyClient postgres = new PostgresDependencyClient(dataSource, jdbcTemplate, 2);
 * DependencyCheck check = new DependencyProbe().probe(postgres);
 * }</pre>
 */
public interface DependencyClient {

    /**
     * Dependency name used in reports (e.g., "database", "redis").
     */
    String name();

    /**
     * Performs a lightweight liveness operation (ping, trivial query).
     *
     * @throws Exception if the dependency cannot be reached or answers unexpectedly
     */
    void checkLiveness() throws Exception;

    /**
     * Reads descriptive metadata from the dependency (version, memory usage, key count).
     *
     * @return metadata in display order; {@code null} values are dropped
     * @throws Exception if the metadata cannot be read
     */
    Map<String, String> queryMetadata() throws Exception;
}
