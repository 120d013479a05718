package com.beacon.dashboard.api;

import com.beacon.dashboard.config.DashboardProperties;
import com.beacon.dashboard.service.StackHealthService;
import com.beacon.dashboard.service.TrafficCounters;
import com.beacon.observability.HostMetrics;
import com.beacon.observability.MetricsSnapshot;
import com.beacon.observability.MetricsSnapshotter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.SpringBootVersion;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Machine-readable status endpoints: {@code /health}, {@code /info} and {@code /api/stats}.
 *
 * <p>{@code /health} is answered with 200 whatever the dependencies' state; callers read the
 * {@code status} field.
 */
@RestController
public class StackStatusController {

    private final StackHealthService healthService;
    private final MetricsSnapshotter snapshotter;
    private final TrafficCounters counters;
    private final HostMetrics hostMetrics;
    private final DashboardProperties properties;

    public StackStatusController(
            StackHealthService healthService,
            MetricsSnapshotter snapshotter,
            TrafficCounters counters,
            HostMetrics hostMetrics,
            DashboardProperties properties) {
        this.healthService = healthService;
        this.snapshotter = snapshotter;
        this.counters = counters;
        this.hostMetrics = hostMetrics;
        this.properties = properties;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.from(healthService.currentReport());
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        MetricsSnapshot snapshot = snapshotter.snapshot(counters.store());
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("hostname", hostMetrics.hostname());
        info.put("runtime_version", hostMetrics.runtimeVersion());
        info.put("spring_boot_version", SpringBootVersion.getVersion());
        info.put("environment", properties.environment());
        info.put("version", properties.version());
        info.put("memory_mb", snapshot.memoryUsedMb());
        info.put("cpu_count", snapshot.cpuCount());
        info.put("uptime_seconds", hostMetrics.uptime().toSeconds());
        return info;
    }

    @GetMapping("/api/stats")
    public StatsResponse stats() {
        return StatsResponse.of(healthService.currentReport(), snapshotter.snapshot(counters.store()));
    }
}
