package com.beacon.dashboard.api;

import com.beacon.observability.DependencyCheck;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * One dependency as shown in {@code /api/stats}: {@code healthy} or {@code unhealthy}, with the
 * facts gathered or the reason it was unreachable.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ServiceStatus(String status, Map<String, String> detail, String error) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static String statusOf(DependencyCheck check) {
        return check.reachable() ? HEALTHY : UNHEALTHY;
    }

    public static ServiceStatus from(DependencyCheck check) {
        return new ServiceStatus(statusOf(check), check.detail(), check.error());
    }
}
