package com.beacon.dashboard.api;

import com.beacon.observability.DependencyCheck;
import com.beacon.observability.HealthReport;
import com.beacon.observability.MetricsSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code GET /api/stats}: the health report merged with a metrics snapshot.
 */
public record StatsResponse(
        @JsonProperty("overall_status") String overallStatus,
        @JsonProperty("services") Map<String, ServiceStatus> services,
        @JsonProperty("memory_used_bytes") long memoryUsedBytes,
        @JsonProperty("cpu_count") int cpuCount,
        @JsonProperty("request_count") long requestCount,
        @JsonProperty("cache_hit_count") long cacheHitCount,
        @JsonProperty("captured_at") String capturedAt,
        @JsonProperty("generated_at") String generatedAt) {

    public static StatsResponse of(HealthReport report, MetricsSnapshot snapshot) {
        Map<String, ServiceStatus> services = new LinkedHashMap<>();
        for (DependencyCheck check : report.checks()) {
            services.put(check.name(), ServiceStatus.from(check));
        }
        return new StatsResponse(
                report.overallStatus().wireValue(),
                services,
                snapshot.memoryUsedBytes(),
                snapshot.cpuCount(),
                snapshot.requestCount(),
                snapshot.cacheHitCount(),
                snapshot.capturedAt().toString(),
                report.generatedAt().toString());
    }
}
