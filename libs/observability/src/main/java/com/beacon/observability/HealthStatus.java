package com.beacon.observability;

import java.util.Locale;

/**
 * Overall health verdict for a set of dependency checks.
 */
public enum HealthStatus {

    /** Every dependency probe reported the dependency as reachable. */
    HEALTHY,

    /** At least one dependency is unreachable; the service itself keeps serving requests. */
    DEGRADED;

    /**
     * Returns the lower-case form used in machine-readable documents ({@code healthy},
     * {@code degraded}).
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
