package com.beacon.observability;

/**
 * Audience a {@link HealthReport} is rendered for.
 */
public enum ReportFormat {

    /** Descriptive multi-line text for people. */
    HUMAN,

    /** JSON document with stable field names for automated callers. */
    MACHINE
}
