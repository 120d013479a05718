package com.beacon.dashboard.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Dashboard settings, bound from the {@code beacon.dashboard.*} prefix:
 *
 * <pre>
 * beacon:
 *   dashboard:
 *     name: stack-dashboard
 *     environment: ${APP_ENV:development}
 *     version: ${APP_VERSION:1.0.0}
 *     counter-store: ${COUNTER_STORE:memory}
 *     probe-timeout: ${PROBE_TIMEOUT_MS:5000}ms
 * </pre>
 *
 * @param name                     service name used in logs and meter tags. Required.
 * @param environment              environment label shown on the dashboard
 * @param version                  version label shown on the dashboard
 * @param counterStore             where request counters live: {@code memory} or {@code redis}
 * @param probeTimeout             upper bound for a single dependency probe
 * @param validationTimeoutSeconds seconds allowed for a JDBC connection validity check
 * @param migrateOnStartup         whether to apply the request-log schema once the app is ready
 */
@ConfigurationProperties(prefix = "beacon.dashboard")
@Validated
public record DashboardProperties(
        @NotBlank String name,
        String environment,
        String version,
        @Pattern(regexp = "memory|redis") String counterStore,
        Duration probeTimeout,
        Integer validationTimeoutSeconds,
        Boolean migrateOnStartup) {

    public static final String COUNTER_STORE_MEMORY = "memory";
    public static final String COUNTER_STORE_REDIS = "redis";

    public DashboardProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
        if (counterStore == null || counterStore.isBlank()) {
            counterStore = COUNTER_STORE_MEMORY;
        }
        if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
            probeTimeout = Duration.ofMillis(5000);
        }
        if (validationTimeoutSeconds == null || validationTimeoutSeconds <= 0) {
            validationTimeoutSeconds = 2;
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
    }
}
