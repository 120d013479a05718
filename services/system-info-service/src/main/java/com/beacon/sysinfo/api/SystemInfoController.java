package com.beacon.sysinfo.api;

import com.beacon.observability.HealthReport;
import com.beacon.observability.HostMetrics;
import com.beacon.observability.StatusAggregator;
import com.beacon.sysinfo.config.SystemInfoProperties;
import com.beacon.sysinfo.view.SystemInfoPage;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.SpringBootVersion;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Host and runtime facts as an HTML page ({@code /}) and as JSON ({@code /health}, {@code /info}).
 */
@RestController
public class SystemInfoController {

    private final HostMetrics hostMetrics;
    private final StatusAggregator aggregator;
    private final SystemInfoProperties properties;
    private final SystemInfoPage page;
    private final Clock clock;

    public SystemInfoController(
            HostMetrics hostMetrics,
            StatusAggregator aggregator,
            SystemInfoProperties properties,
            SystemInfoPage page,
            Clock clock) {
        this.hostMetrics = hostMetrics;
        this.aggregator = aggregator;
        this.properties = properties;
        this.page = page;
        this.clock = clock;
    }

    @GetMapping(path = "/", produces = MediaType.TEXT_HTML_VALUE)
    public String home() {
        return page.render(hostMetrics, properties, LocalDateTime.now(clock));
    }

    /**
     * No dependencies are aggregated, so the status is always {@code healthy}.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        HealthReport report = aggregator.aggregate(List.of());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", report.overallStatus().wireValue());
        body.put("timestamp", report.generatedAt().toString());
        body.put("memory_mb", hostMetrics.memoryUsedMb());
        body.put("version", properties.version());
        return body;
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runtime_version", hostMetrics.runtimeVersion());
        body.put("spring_boot_version", SpringBootVersion.getVersion());
        body.put("hostname", hostMetrics.hostname());
        body.put("environment", properties.environment());
        body.put("debug", properties.debug());
        body.put("memory_mb", hostMetrics.memoryUsedMb());
        body.put("cpu_count", hostMetrics.cpuCount());
        return body;
    }
}
