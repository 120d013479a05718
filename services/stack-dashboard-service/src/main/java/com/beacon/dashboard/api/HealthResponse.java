package com.beacon.dashboard.api;

import com.beacon.observability.DependencyCheck;
import com.beacon.observability.HealthReport;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code GET /health}.
 *
 * @param status    {@code healthy} or {@code degraded}
 * @param timestamp when the report was generated (ISO-8601)
 * @param services  dependency name to {@code healthy}/{@code unhealthy}, in declaration order
 */
public record HealthResponse(String status, String timestamp, Map<String, String> services) {

    public static HealthResponse from(HealthReport report) {
        Map<String, String> services = new LinkedHashMap<>();
        for (DependencyCheck check : report.checks()) {
            services.put(check.name(), ServiceStatus.statusOf(check));
        }
        return new HealthResponse(
                report.overallStatus().wireValue(), report.generatedAt().toString(), services);
    }
}
