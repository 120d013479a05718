package com.beacon.sysinfo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Labels shown by the system-info pages, bound from {@code beacon.system-info.*}.
 *
 * @param environment environment label ({@code ENVIRONMENT})
 * @param version     version label ({@code APP_VERSION})
 * @param debug       debug label ({@code DEBUG})
 */
@ConfigurationProperties(prefix = "beacon.system-info")
public record SystemInfoProperties(String environment, String version, boolean debug) {

    public SystemInfoProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
    }
}
