package com.beacon.observability;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate health verdict derived from a set of dependency checks.
 * <p>
 * The overall status is fully determined by the checks: {@link HealthStatus#DEGRADED} if any
 * check is unreachable, {@link HealthStatus#HEALTHY} otherwise (including the empty case).
 * The canonical constructor rejects a status that contradicts the checks.
 *
 * @param overallStatus aggregate status
 * @param checks        per-dependency results in dependency declaration order
 * @param generatedAt   when the aggregation completed
 */
public record HealthReport(HealthStatus overallStatus, List<DependencyCheck> checks, Instant generatedAt) {

    public HealthReport {
        if (checks == null) {
            throw new IllegalArgumentException("checks must not be null");
        }
        if (generatedAt == null) {
            throw new IllegalArgumentException("generatedAt must not be null");
        }
        checks = List.copyOf(checks);
        HealthStatus derived = statusOf(checks);
        if (overallStatus != derived) {
            throw new IllegalArgumentException(
                    "overallStatus " + overallStatus + " contradicts checks (expected " + derived + ")");
        }
    }

    /**
     * Builds a report whose status is derived from the given checks.
     */
    public static HealthReport of(List<DependencyCheck> checks, Instant generatedAt) {
        return new HealthReport(statusOf(checks), checks, generatedAt);
    }

    /**
     * Applies the degrade-on-any-failure rule.
     */
    public static HealthStatus statusOf(List<DependencyCheck> checks) {
        for (DependencyCheck check : checks) {
            if (!check.reachable()) {
                return HealthStatus.DEGRADED;
            }
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Returns the check for the named dependency, if present.
     */
    public Optional<DependencyCheck> check(String name) {
        return checks.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public boolean isHealthy() {
        return overallStatus == HealthStatus.HEALTHY;
    }
}
